package com.example.securebudget.repository;

import com.example.securebudget.entity.BudgetItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for BudgetItem entities. Items are only ever addressed through their budget.
 */
public interface BudgetItemRepository extends JpaRepository<BudgetItem, Long> {
    List<BudgetItem> findByBudgetIdOrderByIdAsc(Long budgetId);
    Optional<BudgetItem> findByIdAndBudgetId(Long id, Long budgetId);
    long countByBudgetId(Long budgetId);
}
