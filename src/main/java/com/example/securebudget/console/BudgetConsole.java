package com.example.securebudget.console;

import com.example.securebudget.dto.BudgetStatement;
import com.example.securebudget.dto.BudgetSummary;
import com.example.securebudget.dto.ItemLine;
import com.example.securebudget.service.BudgetService;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Interactive text menu over {@link BudgetService}.
 *
 * Main menu: 1 create, 2 manage, 3 exit. Budget list: "O id", "R id", "D id", "B".
 * Single budget: "A", "E id", "D id", "B". End of input exits cleanly from any level.
 */
@Slf4j
public class BudgetConsole {

    private static final String RULE = "-".repeat(50);
    private static final String ROW = "%-4s | %-30s | %10s%n";

    private final BudgetService service;
    private final ConsoleErrorHandler errorHandler;
    private final BufferedReader in;
    private final PrintWriter out;

    public BudgetConsole(BudgetService service, ConsoleErrorHandler errorHandler,
                         BufferedReader in, PrintWriter out) {
        this.service = service;
        this.errorHandler = errorHandler;
        this.in = in;
        this.out = out;
    }

    public void run() {
        log.info("Console session started");
        try {
            mainMenu();
        } catch (InputClosedException ex) {
            log.info("Input closed, leaving console");
        }
        out.println("Goodbye.");
        out.flush();
    }

    private void mainMenu() {
        while (true) {
            out.println();
            out.println("=== Encrypted Budget Manager ===");
            out.println("1. Create New Budget");
            out.println("2. Manage Existing Budgets (Open/Rename/Delete)");
            out.println("3. Exit");
            String choice = prompt("Select option: ").trim();

            switch (choice) {
                case "1":
                    String name = prompt("Enter unique budget name: ");
                    guarded(() -> {
                        BudgetSummary created = service.createBudget(name);
                        out.println("Budget '" + created.getName() + "' created.");
                    });
                    break;
                case "2":
                    manageBudgets();
                    break;
                case "3":
                    return;
                default:
                    out.println("Unknown option.");
            }
        }
    }

    private void manageBudgets() {
        while (true) {
            List<BudgetSummary> budgets = service.listBudgets();
            if (budgets.isEmpty()) {
                out.println();
                out.println("No budgets found.");
                return;
            }
            out.println();
            out.println("--- Available Budgets ---");
            for (BudgetSummary b : budgets) {
                out.println("ID: " + b.getId() + " | Name: " + b.getName());
            }
            out.println("-------------------------");
            out.println("Actions: [O]pen ID, [R]ename ID, [D]elete ID, [B]ack");

            Command cmd = Command.parse(prompt("Command (e.g., 'O 1'): "));
            if (cmd == null) {
                continue;
            }
            if (cmd.action.equals("B")) {
                return;
            }
            if (cmd.arg == null) {
                out.println("Please provide an ID (e.g., 'O 5').");
                continue;
            }
            Long budgetId = cmd.id();
            if (budgetId == null) {
                out.println("Invalid input.");
                continue;
            }
            BudgetSummary selected = budgets.stream()
                    .filter(b -> b.getId().equals(budgetId))
                    .findFirst()
                    .orElse(null);
            if (selected == null) {
                out.println("Invalid Budget ID.");
                continue;
            }

            switch (cmd.action) {
                case "O":
                    manageSingleBudget(selected);
                    break;
                case "R":
                    String newName = prompt("Rename '" + selected.getName() + "' to: ");
                    guarded(() -> {
                        service.renameBudget(budgetId, newName);
                        out.println("Budget renamed.");
                    });
                    break;
                case "D":
                    String confirm = prompt("Are you sure you want to DELETE '" + selected.getName()
                            + "' and ALL its encrypted items? (y/n): ");
                    if (confirm.trim().equalsIgnoreCase("y")) {
                        guarded(() -> {
                            service.deleteBudget(budgetId);
                            out.println("Budget deleted.");
                        });
                    }
                    break;
                default:
                    out.println("Unknown action.");
            }
        }
    }

    private void manageSingleBudget(BudgetSummary budget) {
        while (true) {
            out.println();
            out.println(">>> Managing: " + budget.getName() + " <<<");
            BudgetStatement statement;
            try {
                statement = service.getStatement(budget.getId());
            } catch (RuntimeException ex) {
                out.println(errorHandler.toMessage(ex));
                return;
            }
            printStatement(statement);

            out.println();
            out.println("Actions: [A]dd Item, [E]dit Item ID, [D]elete Item ID, [B]ack");
            Command cmd = Command.parse(prompt("Command: "));
            if (cmd == null) {
                continue;
            }

            switch (cmd.action) {
                case "B":
                    return;
                case "A": {
                    String desc = prompt("Description: ");
                    String amount = prompt("Amount: ");
                    guarded(() -> service.addItem(budget.getId(), desc, amount));
                    break;
                }
                case "E":
                case "D": {
                    if (cmd.arg == null) {
                        out.println("Please provide an Item ID.");
                        break;
                    }
                    Long itemId = cmd.id();
                    if (itemId == null) {
                        out.println("Invalid ID format.");
                        break;
                    }
                    boolean listed = statement.getLines().stream().anyMatch(l -> l.getId().equals(itemId));
                    if (!listed) {
                        out.println("Item ID not found in this budget.");
                        break;
                    }
                    if (cmd.action.equals("E")) {
                        String desc = prompt("New Description: ");
                        String amount = prompt("New Amount: ");
                        guarded(() -> {
                            service.updateItem(budget.getId(), itemId, desc, amount);
                            out.println("Item updated.");
                        });
                    } else {
                        guarded(() -> {
                            service.deleteItem(budget.getId(), itemId);
                            out.println("Item deleted.");
                        });
                    }
                    break;
                }
                default:
                    out.println("Unknown action.");
            }
        }
    }

    void printStatement(BudgetStatement statement) {
        out.printf(ROW, "ID", "Description", "Amount");
        out.println(RULE);
        for (ItemLine line : statement.getLines()) {
            out.printf(ROW, line.getId(), line.getDescription(), amountCell(line));
        }
        out.println(RULE);
        out.printf(ROW, "", "TOTAL", String.format(Locale.ROOT, "%.2f", statement.getTotal()));
        if (statement.getExcludedCount() > 0) {
            out.println("Note: " + statement.getExcludedCount() + " item(s) excluded from the total.");
        }
    }

    private static String amountCell(ItemLine line) {
        if (line.isAmountFailed()) {
            return ItemLine.DECRYPTION_ERROR;
        }
        if (line.isInvalidAmount()) {
            return "Error";
        }
        return String.format(Locale.ROOT, "%.2f", line.getAmount());
    }

    private void guarded(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            out.println(errorHandler.toMessage(ex));
        }
    }

    private String prompt(String text) {
        out.print(text);
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new InputClosedException();
            }
            return line;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read console input", ex);
        }
    }

    private static final class InputClosedException extends RuntimeException {
        InputClosedException() {
            super("console input closed", null, false, false);
        }
    }

    private static final class Command {
        final String action;
        final String arg;

        private Command(String action, String arg) {
            this.action = action;
            this.arg = arg;
        }

        static Command parse(String line) {
            String[] parts = line.trim().split("\\s+");
            if (parts[0].isEmpty()) {
                return null;
            }
            return new Command(parts[0].toUpperCase(Locale.ROOT), parts.length > 1 ? parts[1] : null);
        }

        Long id() {
            try {
                return Long.parseLong(arg);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
    }
}
