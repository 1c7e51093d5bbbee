package com.example.securebudget.exception;

public class DuplicateBudgetNameException extends BudgetException {
    public DuplicateBudgetNameException(String name) {
        super("Budget name already exists: " + name);
    }
}
