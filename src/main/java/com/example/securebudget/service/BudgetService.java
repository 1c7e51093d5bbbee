package com.example.securebudget.service;

import com.example.securebudget.crypto.DecryptedField;
import com.example.securebudget.crypto.FieldCipher;
import com.example.securebudget.dto.BudgetStatement;
import com.example.securebudget.dto.BudgetSummary;
import com.example.securebudget.dto.ItemLine;
import com.example.securebudget.entity.Budget;
import com.example.securebudget.entity.BudgetItem;
import com.example.securebudget.exception.BudgetNotFoundException;
import com.example.securebudget.exception.DuplicateBudgetNameException;
import com.example.securebudget.exception.InvalidInputException;
import com.example.securebudget.exception.ItemNotFoundException;
import com.example.securebudget.repository.BudgetItemRepository;
import com.example.securebudget.repository.BudgetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Budget and item management on top of encrypted storage.
 *
 * Item descriptions and amounts are encrypted before they reach the repository and decrypted on
 * the way out; the entities only ever see tokens. Logs carry ids, never field contents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetService {

    /** Plain decimals only: no exponent, at most 15 integer and 10 fraction digits. */
    private static final Pattern AMOUNT = Pattern.compile("[+-]?\\d{1,15}(\\.\\d{1,10})?");

    private final BudgetRepository budgetRepository;
    private final BudgetItemRepository itemRepository;
    private final FieldCipher fieldCipher;

    @Transactional
    public BudgetSummary createBudget(String name) {
        String cleaned = validateName(name);
        if (budgetRepository.existsByName(cleaned)) {
            throw new DuplicateBudgetNameException(cleaned);
        }
        try {
            Budget saved = budgetRepository.saveAndFlush(new Budget(cleaned));
            log.info("Budget {} created", saved.getId());
            return BudgetSummary.from(saved);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateBudgetNameException(cleaned);
        }
    }

    @Transactional(readOnly = true)
    public List<BudgetSummary> listBudgets() {
        return budgetRepository.findAllByOrderByIdAsc().stream()
                .map(BudgetSummary::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public BudgetSummary renameBudget(Long budgetId, String newName) {
        String cleaned = validateName(newName);
        Budget budget = requireBudget(budgetId);
        budgetRepository.findByName(cleaned)
                .filter(other -> !other.getId().equals(budgetId))
                .ifPresent(other -> {
                    throw new DuplicateBudgetNameException(cleaned);
                });
        budget.setName(cleaned);
        try {
            budgetRepository.saveAndFlush(budget);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateBudgetNameException(cleaned);
        }
        log.info("Budget {} renamed", budgetId);
        return BudgetSummary.from(budget);
    }

    /**
     * Deletes the budget together with all of its items.
     */
    @Transactional
    public void deleteBudget(Long budgetId) {
        Budget budget = requireBudget(budgetId);
        long itemCount = itemRepository.countByBudgetId(budgetId);
        budgetRepository.delete(budget);
        log.info("Budget {} deleted with {} item(s)", budgetId, itemCount);
    }

    @Transactional
    public Long addItem(Long budgetId, String description, String amount) {
        Budget budget = requireBudget(budgetId);
        String amountText = validateAmount(amount);
        BudgetItem item = new BudgetItem(budget, encryptDescription(description), fieldCipher.encrypt(amountText));
        budget.getItems().add(item);
        BudgetItem saved = itemRepository.save(item);
        log.info("Item {} added to budget {}", saved.getId(), budgetId);
        return saved.getId();
    }

    @Transactional
    public void updateItem(Long budgetId, Long itemId, String description, String amount) {
        BudgetItem item = requireItem(budgetId, itemId);
        String amountText = validateAmount(amount);
        item.setDescriptionToken(encryptDescription(description));
        item.setAmountToken(fieldCipher.encrypt(amountText));
        itemRepository.save(item);
        log.info("Item {} in budget {} updated", itemId, budgetId);
    }

    @Transactional
    public void deleteItem(Long budgetId, Long itemId) {
        BudgetItem item = requireItem(budgetId, itemId);
        item.getBudget().getItems().remove(item);
        itemRepository.delete(item);
        log.info("Item {} deleted from budget {}", itemId, budgetId);
    }

    /**
     * Decrypts every item of a budget. A field that fails to decrypt is marked on its own row
     * and the rest of the listing is unaffected; rows without a usable amount are left out of
     * the total and counted in {@link BudgetStatement#getExcludedCount()}.
     */
    @Transactional(readOnly = true)
    public BudgetStatement getStatement(Long budgetId) {
        Budget budget = requireBudget(budgetId);
        List<ItemLine> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        int excluded = 0;

        for (BudgetItem item : itemRepository.findByBudgetIdOrderByIdAsc(budgetId)) {
            ItemLine line = toLine(item);
            lines.add(line);
            if (line.countsTowardsTotal()) {
                total = total.add(line.getAmount());
            } else {
                excluded++;
            }
        }
        if (excluded > 0) {
            long withErrors = lines.stream().filter(ItemLine::hasError).count();
            log.warn("Budget {}: {} item(s) with errors, {} excluded from total", budgetId, withErrors, excluded);
        }
        return new BudgetStatement(BudgetSummary.from(budget), lines, total, excluded);
    }

    private ItemLine toLine(BudgetItem item) {
        DecryptedField description = fieldCipher.tryDecrypt(item.getDescriptionToken());
        DecryptedField amountField = fieldCipher.tryDecrypt(item.getAmountToken());
        if (!description.isSuccess() || !amountField.isSuccess()) {
            log.warn("Item {} has field(s) that failed to decrypt (description: {}, amount: {})",
                    item.getId(), failureReason(description), failureReason(amountField));
        }

        BigDecimal amount = amountField.map(BudgetService::parseAmount).orElse(null);
        boolean invalidAmount = amountField.isSuccess() && amount == null;
        if (invalidAmount) {
            log.warn("Item {} holds an amount that is not a plain decimal", item.getId());
        }
        return new ItemLine(
                item.getId(),
                description.orElse(ItemLine.DECRYPTION_ERROR),
                amountField.orElse(ItemLine.DECRYPTION_ERROR),
                amount,
                !description.isSuccess(),
                !amountField.isSuccess(),
                invalidAmount);
    }

    private static String failureReason(DecryptedField field) {
        return field.error().map(Exception::getMessage).orElse("ok");
    }

    private Budget requireBudget(Long budgetId) {
        return budgetRepository.findById(budgetId)
                .orElseThrow(() -> new BudgetNotFoundException(budgetId));
    }

    private BudgetItem requireItem(Long budgetId, Long itemId) {
        return itemRepository.findByIdAndBudgetId(itemId, budgetId)
                .orElseThrow(() -> new ItemNotFoundException(itemId, budgetId));
    }

    private String encryptDescription(String description) {
        if (description == null) {
            throw new InvalidInputException("Description is required");
        }
        return fieldCipher.encrypt(description);
    }

    private static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Budget name must not be blank");
        }
        String cleaned = name.trim();
        if (cleaned.length() > Budget.MAX_NAME_LENGTH) {
            throw new InvalidInputException("Budget name must be at most " + Budget.MAX_NAME_LENGTH + " characters");
        }
        return cleaned;
    }

    private static String validateAmount(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new InvalidInputException("Amount is required");
        }
        String cleaned = amount.trim();
        if (parseAmount(cleaned) == null) {
            throw new InvalidInputException("Amount must be a plain decimal number, e.g. 12.50");
        }
        return cleaned;
    }

    /**
     * Parses a plain decimal amount, or returns null for anything else, including exponent notation.
     */
    static BigDecimal parseAmount(String text) {
        String cleaned = text.trim();
        if (!AMOUNT.matcher(cleaned).matches()) {
            return null;
        }
        return new BigDecimal(cleaned);
    }
}
