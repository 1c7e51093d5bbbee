package com.example.securebudget.console;

import com.example.securebudget.exception.BudgetException;
import com.example.securebudget.exception.BudgetNotFoundException;
import com.example.securebudget.exception.DuplicateBudgetNameException;
import com.example.securebudget.exception.ItemNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps exceptions raised while handling a console command to a one-line message.
 * - BudgetNotFoundException -> "Invalid Budget ID."
 * - ItemNotFoundException -> "Item ID not found in this budget."
 * - DuplicateBudgetNameException -> "Error: Budget name already exists."
 * - InvalidInputException and other BudgetExceptions -> "Error: <message>"
 * - anything else -> logged with stack trace, generic message
 *
 * The console keeps running after every mapped error.
 */
@Component
@Slf4j
public class ConsoleErrorHandler {

    static final String UNEXPECTED = "Unexpected error, see the log file for details.";

    public String toMessage(RuntimeException ex) {
        if (ex instanceof BudgetNotFoundException) {
            log.debug("Budget lookup failed: {}", ex.getMessage());
            return "Invalid Budget ID.";
        }
        if (ex instanceof ItemNotFoundException) {
            log.debug("Item lookup failed: {}", ex.getMessage());
            return "Item ID not found in this budget.";
        }
        if (ex instanceof DuplicateBudgetNameException) {
            return "Error: Budget name already exists.";
        }
        if (ex instanceof BudgetException) {
            return "Error: " + ex.getMessage();
        }
        log.error("Command failed: {}", ex.getMessage(), ex);
        return UNEXPECTED;
    }
}
