package com.example.securebudget.repository;

import com.example.securebudget.entity.Budget;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for Budget entities.
 */
public interface BudgetRepository extends JpaRepository<Budget, Long> {
    List<Budget> findAllByOrderByIdAsc();
    Optional<Budget> findByName(String name);
    boolean existsByName(String name);
}
