package com.example.securebudget.exception;

public class InvalidInputException extends BudgetException {
    public InvalidInputException(String message) {
        super(message);
    }
}
