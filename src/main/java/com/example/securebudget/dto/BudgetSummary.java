package com.example.securebudget.dto;

import com.example.securebudget.entity.Budget;
import lombok.Value;

@Value
public class BudgetSummary {
    Long id;
    String name;

    public static BudgetSummary from(Budget budget) {
        return new BudgetSummary(budget.getId(), budget.getName());
    }
}
