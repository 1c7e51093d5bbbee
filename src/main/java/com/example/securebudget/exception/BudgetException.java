package com.example.securebudget.exception;

/**
 * Base type for user-facing budget errors. The console reports the message and keeps running.
 */
public class BudgetException extends RuntimeException {
    public BudgetException(String message, Throwable cause) {
        super(message, cause);
    }
    public BudgetException(String message) {
        super(message);
    }
}
