package com.example.securebudget.exception;

public class ItemNotFoundException extends BudgetException {
    public ItemNotFoundException(Long itemId, Long budgetId) {
        super("Item " + itemId + " not found in budget " + budgetId);
    }
}
