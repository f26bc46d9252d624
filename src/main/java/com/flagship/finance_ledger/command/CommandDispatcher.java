package com.flagship.finance_ledger.command;

import com.flagship.finance_ledger.bill.Bill;
import com.flagship.finance_ledger.config.LedgerProperties;
import com.flagship.finance_ledger.ledger.FinanceLedger;
import com.flagship.finance_ledger.ledger.InvalidInputException;
import com.flagship.finance_ledger.ledger.Transaction;
import com.flagship.finance_ledger.ledger.TransactionType;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.snapshot.LedgerSnapshot;
import com.flagship.finance_ledger.snapshot.LedgerSnapshotStore;
import com.flagship.finance_ledger.undo.Action;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Translates named commands into ledger calls and ledger results into outcomes.
 *
 * This is the only component that touches the ledger, and every command runs
 * under one lock, so the single-writer ledger never sees concurrent calls.
 * After a successful mutating command the current state is written to the
 * snapshot store (when enabled).
 */
@Service
@Slf4j
public class CommandDispatcher {

    static final int DEFAULT_TOP_K = 5;
    static final int DEFAULT_RECENT_COUNT = 10;

    private final FinanceLedger ledger;
    private final LedgerMetrics metrics;
    private final LedgerSnapshotStore snapshotStore;
    private final Clock clock;
    private final int suggestionLimit;
    private final ReentrantLock lock = new ReentrantLock();

    public CommandDispatcher(FinanceLedger ledger, LedgerMetrics metrics, LedgerProperties properties,
                             LedgerSnapshotStore snapshotStore, Clock clock) {
        this.ledger = ledger;
        this.metrics = metrics;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
        this.suggestionLimit = properties.autocomplete().maxResults();
        metrics.registerLedgerGauges(ledger);
    }

    /**
     * Executes one command.
     *
     * @param commandName wire name, e.g. "add_transaction"
     * @param params named fields; may be null for commands without parameters
     * @return the outcome; rejected input is reported, never thrown
     */
    public CommandOutcome dispatch(String commandName, Map<String, Object> params) {
        Optional<LedgerCommand> command = LedgerCommand.fromWireName(commandName);
        if (command.isEmpty()) {
            log.warn("Rejected unknown command: {}", commandName);
            metrics.recordCommand("unknown", ErrorKind.INVALID_INPUT.getWireName());
            return CommandOutcome.invalidInput("Unknown command: " + commandName);
        }

        LedgerCommand resolved = command.get();
        long startTime = System.nanoTime();
        String outcomeTag = "error";
        MDC.put(CorrelationContext.COMMAND_MDC_KEY, resolved.getWireName());
        lock.lock();
        try {
            CommandOutcome outcome;
            try {
                outcome = execute(resolved, new CommandParameters(params));
            } catch (InvalidInputException e) {
                log.warn("Rejected {}: {}", resolved.getWireName(), e.getMessage());
                outcome = CommandOutcome.invalidInput(e.getMessage());
            }

            if (outcome.isSuccess() && resolved.isMutating()) {
                log.info("Applied {}: undoDepth={}, transactions={}",
                        resolved.getWireName(), ledger.getUndoDepth(), ledger.getTransactionCount());
                if (snapshotStore.isEnabled()) {
                    snapshotStore.write(LedgerSnapshot.capture(ledger, Instant.now(clock)));
                }
            }
            outcomeTag = outcome.getOutcomeTag();
            return outcome;
        } finally {
            lock.unlock();
            metrics.recordCommand(resolved.getWireName(), outcomeTag);
            metrics.recordCommandLatency(resolved.getWireName(), Duration.ofNanos(System.nanoTime() - startTime));
            MDC.remove(CorrelationContext.COMMAND_MDC_KEY);
        }
    }

    private CommandOutcome execute(LedgerCommand command, CommandParameters p) {
        return switch (command) {
            case ADD_TRANSACTION -> CommandOutcome.ok(ledger.addTransaction(
                    p.requireString("type"),
                    p.requireAmount("amount"),
                    p.requireString("category"),
                    p.optionalString("description", ""),
                    p.requireString("date")));
            case DELETE_TRANSACTION -> {
                String id = p.requireString("id");
                yield ledger.deleteTransaction(id)
                        ? CommandOutcome.ok(deleted(id))
                        : CommandOutcome.notFound("Transaction not found: " + id);
            }
            case GET_TRANSACTIONS -> CommandOutcome.ok(listTransactions(p));
            case GET_RECENT_TRANSACTIONS -> CommandOutcome.ok(
                    ledger.getRecentTransactions(nonNegative(p.optionalInt("count", DEFAULT_RECENT_COUNT), "count")));
            case GET_TRANSACTIONS_BY_DATE -> CommandOutcome.ok(
                    ledger.getTransactionsInRange(p.requireString("start"), p.requireString("end")));
            case SET_BUDGET -> CommandOutcome.ok(
                    ledger.setBudget(p.requireString("category"), p.requireAmount("limit")));
            case GET_BUDGETS -> CommandOutcome.ok(ledger.getAllBudgets());
            case GET_ALERTS -> CommandOutcome.ok(ledger.getBudgetAlerts());
            case ADD_BILL -> CommandOutcome.ok(ledger.addBill(
                    p.requireString("name"),
                    p.requireAmount("amount"),
                    p.requireString("due_date"),
                    p.requireString("category")));
            case GET_BILLS -> CommandOutcome.ok(listBills(p));
            case PAY_BILL -> {
                String id = p.requireString("id");
                yield ledger.payBill(id)
                        ? CommandOutcome.ok(ledger.findBill(id).orElseThrow())
                        : CommandOutcome.notFound("Bill not found: " + id);
            }
            case DELETE_BILL -> {
                String id = p.requireString("id");
                yield ledger.removeBill(id)
                        ? CommandOutcome.ok(deleted(id))
                        : CommandOutcome.notFound("Bill not found: " + id);
            }
            case GET_TOP_EXPENSES -> CommandOutcome.ok(ledger.getTopExpenses(p.optionalInt("k", DEFAULT_TOP_K)));
            case GET_TOP_CATEGORIES -> CommandOutcome.ok(ledger.getTopCategories(p.optionalInt("k", DEFAULT_TOP_K)));
            case GET_MONTHLY_SUMMARY -> CommandOutcome.ok(ledger.getMonthlySummary(p.requireString("month")));
            case GET_CATEGORY_SUGGESTIONS -> CommandOutcome.ok(ledger.getCategorySuggestions(
                    p.optionalString("prefix", ""), suggestionLimit(p)));
            case GET_PAYEE_SUGGESTIONS -> CommandOutcome.ok(ledger.getPayeeSuggestions(
                    p.optionalString("prefix", ""), suggestionLimit(p)));
            case GET_ALL_CATEGORIES -> CommandOutcome.ok(ledger.getAllCategories());
            case UNDO -> undo();
            case GET_DASHBOARD -> CommandOutcome.ok(dashboard(p));
        };
    }

    private List<Transaction> listTransactions(CommandParameters p) {
        String category = p.optionalString("category", null);
        String type = p.optionalString("type", null);
        String sort = p.optionalString("sort", "newest");

        List<Transaction> ordered = switch (sort) {
            case "newest" -> ledger.getAllTransactions();
            case "date_asc" -> ledger.getTransactionsByDateAsc();
            case "date_desc" -> ledger.getTransactionsByDateDesc();
            default -> throw new InvalidInputException(
                    "Unknown sort '" + sort + "'. Expected newest, date_asc or date_desc.");
        };

        TransactionType kind = type != null ? TransactionType.fromWireName(type) : null;
        return ordered.stream()
                .filter(t -> category == null || t.getCategory().equals(category))
                .filter(t -> kind == null || t.getType() == kind)
                .toList();
    }

    private List<Bill> listBills(CommandParameters p) {
        String filter = p.optionalString("filter", "all");
        return switch (filter) {
            case "all" -> ledger.getAllBills();
            case "unpaid" -> ledger.getUnpaidBills();
            case "overdue" -> ledger.getOverdueBills(referenceDate(p));
            default -> throw new InvalidInputException(
                    "Unknown bill filter '" + filter + "'. Expected all, unpaid or overdue.");
        };
    }

    private CommandOutcome undo() {
        Optional<Action> undone = ledger.undoLast();
        if (undone.isEmpty()) {
            return CommandOutcome.logEmpty();
        }
        String type = undone.get().getType().getWireName();
        metrics.recordUndo(type);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("undone", type);
        return CommandOutcome.ok(data);
    }

    private Dashboard dashboard(CommandParameters p) {
        return Dashboard.builder()
                .totals(ledger.getTotals())
                .recentTransactions(ledger.getRecentTransactions(DEFAULT_RECENT_COUNT))
                .topCategories(ledger.getTopCategories(DEFAULT_TOP_K))
                .alerts(ledger.getBudgetAlerts())
                .unpaidBills(ledger.getUnpaidBills())
                .overdueBills(ledger.getOverdueBills(referenceDate(p)))
                .nextBill(ledger.getNextBill().orElse(null))
                .canUndo(ledger.canUndo())
                .generatedAt(Instant.now(clock))
                .build();
    }

    private String referenceDate(CommandParameters p) {
        return p.optionalString("date", LocalDate.now(clock).toString());
    }

    private int suggestionLimit(CommandParameters p) {
        return nonNegative(p.optionalInt("limit", suggestionLimit), "limit");
    }

    private static int nonNegative(int value, String name) {
        if (value < 0) {
            throw new InvalidInputException("Parameter '" + name + "' cannot be negative: " + value);
        }
        return value;
    }

    private static Map<String, Object> deleted(String id) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("deleted", true);
        data.put("id", id);
        return data;
    }
}
