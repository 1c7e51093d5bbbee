package com.example.securebudget.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A named budget. Names are unique; deleting a budget removes all of its items.
 */
@Entity
@Table(name = "BUDGETS", uniqueConstraints = {
    @UniqueConstraint(name = "UK_BUDGET_NAME", columnNames = "NAME")
})
@Getter
@Setter
@NoArgsConstructor
public class Budget {

    public static final int MAX_NAME_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = MAX_NAME_LENGTH)
    @Column(name = "NAME", length = MAX_NAME_LENGTH, nullable = false)
    private String name;

    @Column(name = "CREATED_AT")
    private OffsetDateTime createdAt;

    @OneToMany(mappedBy = "budget", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<BudgetItem> items = new ArrayList<>();

    public Budget(String name) {
        this.name = name;
    }

    @PrePersist
    public void prePersist() {
        this.createdAt = OffsetDateTime.now();
    }
}
