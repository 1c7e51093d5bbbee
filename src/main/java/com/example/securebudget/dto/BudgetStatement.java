package com.example.securebudget.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Listing of one budget: every item row plus the total of the amounts that decrypted and parsed.
 */
@Value
public class BudgetStatement {
    BudgetSummary budget;
    List<ItemLine> lines;
    BigDecimal total;
    int excludedCount;
}
