package com.example.securebudget.exception;

public class BudgetNotFoundException extends BudgetException {
    public BudgetNotFoundException(Long budgetId) {
        super("Budget " + budgetId + " not found");
    }
}
