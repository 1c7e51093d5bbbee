package com.example.securebudget.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * One line of a budget.
 *
 * Notes:
 * - Description and amount are never stored in clear; both columns hold FieldCipher tokens.
 * - Tokens are replaced wholesale on edit.
 * - Avoid logging this entity directly; log ids only.
 */
@Entity
@Table(name = "BUDGET_ITEMS", indexes = {
    @Index(name = "IDX_ITEM_BUDGET", columnList = "BUDGET_ID")
})
@Getter
@Setter
@NoArgsConstructor
public class BudgetItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "BUDGET_ID", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Budget budget;

    @NotNull
    @Lob
    @Column(name = "DESCRIPTION_TOKEN", nullable = false)
    private String descriptionToken;

    @NotNull
    @Lob
    @Column(name = "AMOUNT_TOKEN", nullable = false)
    private String amountToken;

    @Column(name = "UPDATED_AT")
    private OffsetDateTime updatedAt;

    public BudgetItem(Budget budget, String descriptionToken, String amountToken) {
        this.budget = budget;
        this.descriptionToken = descriptionToken;
        this.amountToken = amountToken;
    }

    @PrePersist
    @PreUpdate
    public void touch() {
        this.updatedAt = OffsetDateTime.now();
    }
}
