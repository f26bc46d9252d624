package com.flagship.finance_ledger.command;

import com.flagship.finance_ledger.bill.Bill;
import com.flagship.finance_ledger.budget.AlertLevel;
import com.flagship.finance_ledger.budget.Budget;
import com.flagship.finance_ledger.budget.BudgetAlert;
import com.flagship.finance_ledger.config.JacksonConfig;
import com.flagship.finance_ledger.config.LedgerProperties;
import com.flagship.finance_ledger.ledger.FinanceLedger;
import com.flagship.finance_ledger.ledger.Transaction;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.snapshot.LedgerSnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command boundary tests: parameter handling, outcome kinds and metrics.
 */
class CommandDispatcherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-07-15T10:00:00Z"), ZoneOffset.UTC);

    private FinanceLedger ledger;
    private SimpleMeterRegistry registry;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties(null, null, null, null);
        ledger = new FinanceLedger(50, 100, FinanceLedger.DEFAULT_CATEGORIES, CLOCK);
        registry = new SimpleMeterRegistry();
        LedgerSnapshotStore store = new LedgerSnapshotStore(new JacksonConfig().objectMapper(), properties);
        dispatcher = new CommandDispatcher(ledger, new LedgerMetrics(registry), properties, store, CLOCK);
    }

    private CommandOutcome run(String command, Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return dispatcher.dispatch(command, params);
    }

    private Transaction addExpense(String amount, String category, String date) {
        CommandOutcome outcome = run("add_transaction",
            "type", "expense", "amount", amount, "category", category, "date", date);
        assertTrue(outcome.isSuccess(), () -> "add_transaction failed: " + outcome.getMessage());
        return (Transaction) outcome.getData();
    }

    @Test
    @DisplayName("add_transaction accepts numeric strings and JSON numbers")
    void testAddTransaction() {
        Transaction fromString = addExpense("12.50", "Food", "2025-07-01");
        CommandOutcome fromNumber = run("add_transaction",
            "type", "income", "amount", 3000, "category", "Salary", "description", "Payroll", "date", "2025-07-01");

        assertEquals(0, new BigDecimal("12.50").compareTo(fromString.getAmount()));
        assertTrue(fromNumber.isSuccess());
        assertEquals("Payroll", ((Transaction) fromNumber.getData()).getDescription());
        assertEquals(2, ledger.getTransactionCount());
    }

    @Test
    @DisplayName("Unknown commands and bad parameters are invalid input")
    void testInvalidInput() {
        CommandOutcome unknown = run("transfer_funds");
        CommandOutcome missing = run("add_transaction", "type", "expense", "category", "Food", "date", "2025-07-01");
        CommandOutcome badAmount = run("add_transaction",
            "type", "expense", "amount", "ten", "category", "Food", "date", "2025-07-01");
        CommandOutcome negativeAmount = run("add_transaction",
            "type", "expense", "amount", "-3", "category", "Food", "date", "2025-07-01");
        CommandOutcome badK = run("get_top_expenses", "k", "-2");
        CommandOutcome badSort = run("get_transactions", "sort", "random");

        for (CommandOutcome outcome : List.of(unknown, missing, badAmount, negativeAmount, badK, badSort)) {
            assertFalse(outcome.isSuccess());
            assertEquals(ErrorKind.INVALID_INPUT, outcome.getError());
            assertNotNull(outcome.getMessage());
        }
        assertEquals(0, ledger.getTransactionCount());
    }

    @Test
    @DisplayName("Oversized amounts and malformed range dates are invalid input")
    void testOutOfRangeInput() {
        addExpense("10", "Food", "2025-07-01");

        CommandOutcome huge = run("add_transaction",
            "type", "expense", "amount", "1e999999999", "category", "Food", "date", "2025-07-02");
        CommandOutcome badStart = run("get_transactions_by_date", "start", "2025-7-1", "end", "2025-07-31");
        CommandOutcome badEnd = run("get_transactions_by_date", "start", "2025-07-01", "end", "2025-7-31");

        for (CommandOutcome outcome : List.of(huge, badStart, badEnd)) {
            assertFalse(outcome.isSuccess());
            assertEquals(ErrorKind.INVALID_INPUT, outcome.getError());
        }
        assertEquals(1, ledger.getTransactionCount());
        assertEquals(1, ledger.getUndoDepth());
    }

    @Test
    @DisplayName("Deleting an unknown transaction or bill is not found, not an error")
    void testNotFound() {
        CommandOutcome transaction = run("delete_transaction", "id", "txn_0_1");
        CommandOutcome payBill = run("pay_bill", "id", "bill_0_1");
        CommandOutcome deleteBill = run("delete_bill", "id", "bill_0_1");

        assertEquals(ErrorKind.NOT_FOUND, transaction.getError());
        assertEquals(ErrorKind.NOT_FOUND, payBill.getError());
        assertEquals(ErrorKind.NOT_FOUND, deleteBill.getError());
        assertFalse(ledger.canUndo());
    }

    @Test
    @DisplayName("Undo on an empty log reports log_empty; otherwise names the reversed action")
    @SuppressWarnings("unchecked")
    void testUndo() {
        CommandOutcome empty = run("undo");
        assertEquals(ErrorKind.LOG_EMPTY, empty.getError());

        Transaction t = addExpense("40", "Food", "2025-07-01");
        run("delete_transaction", "id", t.getId());
        CommandOutcome undone = run("undo");

        assertTrue(undone.isSuccess());
        assertEquals("delete_transaction", ((Map<String, Object>) undone.getData()).get("undone"));
        assertEquals(1, ledger.getTransactionCount());
        assertEquals(1.0, registry.get("ledger.undo").tag("action", "delete_transaction").counter().count());
    }

    @Test
    @DisplayName("Budget flow through commands")
    @SuppressWarnings("unchecked")
    void testBudgets() {
        addExpense("100", "Food", "2025-07-01");
        addExpense("50", "Food", "2025-07-02");
        CommandOutcome set = run("set_budget", "category", "Food", "limit", "120");

        assertEquals(0, new BigDecimal("150").compareTo(((Budget) set.getData()).getSpent()));

        List<BudgetAlert> alerts = (List<BudgetAlert>) run("get_alerts").getData();
        assertEquals(1, alerts.size());
        assertEquals(AlertLevel.EXCEEDED, alerts.get(0).getLevel());
        assertEquals(1, ((List<Budget>) run("get_budgets").getData()).size());
    }

    @Test
    @DisplayName("Bill filters use the supplied reference date or today")
    @SuppressWarnings("unchecked")
    void testBills() {
        CommandOutcome water = run("add_bill",
            "name", "Water", "amount", "45", "due_date", "2025-07-10", "category", "Utilities");
        run("add_bill", "name", "Rent", "amount", "1200", "due_date", "2025-08-01", "category", "Rent");
        String waterId = ((Bill) water.getData()).getId();

        assertEquals(2, ((List<Bill>) run("get_bills").getData()).size());
        // clock is fixed at 2025-07-15
        assertEquals(1, ((List<Bill>) run("get_bills", "filter", "overdue").getData()).size());
        assertEquals(0, ((List<Bill>) run("get_bills", "filter", "overdue", "date", "2025-07-01").getData()).size());

        CommandOutcome paid = run("pay_bill", "id", waterId);
        assertTrue(((Bill) paid.getData()).isPaid());
        assertEquals(1, ((List<Bill>) run("get_bills", "filter", "unpaid").getData()).size());

        assertEquals(ErrorKind.INVALID_INPUT, run("get_bills", "filter", "late").getError());
    }

    @Test
    @DisplayName("get_transactions filters by category and type and sorts by date")
    @SuppressWarnings("unchecked")
    void testGetTransactions() {
        Transaction late = addExpense("10", "Food", "2025-07-20");
        Transaction early = addExpense("20", "Food", "2025-07-01");
        addExpense("30", "Travel", "2025-07-05");
        run("add_transaction", "type", "income", "amount", "500", "category", "Food", "date", "2025-07-02");

        List<Transaction> foodExpenses = (List<Transaction>) run("get_transactions",
            "category", "Food", "type", "expense", "sort", "date_asc").getData();

        assertEquals(List.of(early.getId(), late.getId()), foodExpenses.stream().map(Transaction::getId).toList());
        assertEquals(4, ((List<Transaction>) run("get_transactions").getData()).size());
        assertEquals(2, ((List<Transaction>) run("get_recent_transactions", "count", 2).getData()).size());
        assertEquals(3, ((List<Transaction>) run("get_transactions_by_date",
            "start", "2025-07-01", "end", "2025-07-05").getData()).size());
    }

    @Test
    @DisplayName("Suggestions honour the configured default limit")
    @SuppressWarnings("unchecked")
    void testSuggestions() {
        List<String> all = (List<String>) run("get_category_suggestions", "prefix", "").getData();
        assertEquals(10, all.size());

        List<String> two = (List<String>) run("get_category_suggestions", "prefix", "", "limit", 2).getData();
        assertEquals(2, two.size());

        run("add_transaction", "type", "expense", "amount", "3", "category", "Food",
            "description", "Bagel Shop", "date", "2025-07-01");
        assertEquals(List.of("Bagel Shop"), run("get_payee_suggestions", "prefix", "bag").getData());
        assertEquals(15, ((List<String>) run("get_all_categories").getData()).size());
    }

    @Test
    @DisplayName("Dashboard aggregates totals, alerts and bills")
    void testDashboard() {
        addExpense("90", "Food", "2025-07-01");
        run("set_budget", "category", "Food", "limit", "100");
        run("add_bill", "name", "Phone", "amount", "30", "due_date", "2025-07-01", "category", "Bills");

        Dashboard dashboard = (Dashboard) run("get_dashboard").getData();

        assertEquals(1, dashboard.getTotals().getTransactionCount());
        assertEquals(1, dashboard.getAlerts().size());
        assertEquals(1, dashboard.getOverdueBills().size());
        assertEquals("Phone", dashboard.getNextBill().getName());
        assertTrue(dashboard.isCanUndo());
        assertEquals(Instant.parse("2025-07-15T10:00:00Z"), dashboard.getGeneratedAt());
    }

    @Test
    @DisplayName("Monthly summary and top-K commands")
    void testAnalytics() {
        addExpense("10", "Food", "2025-07-01");
        addExpense("70", "Rent", "2025-07-02");

        assertEquals(ErrorKind.INVALID_INPUT, run("get_monthly_summary").getError());
        assertTrue(run("get_monthly_summary", "month", "2025-07").isSuccess());
        assertEquals(2, ((List<?>) run("get_top_expenses").getData()).size());
        assertEquals(1, ((List<?>) run("get_top_categories", "k", 1).getData()).size());
    }

    @Test
    @DisplayName("Every command is counted with its outcome and the gauges track the ledger")
    void testMetrics() {
        addExpense("10", "Food", "2025-07-01");
        run("delete_transaction", "id", "missing");
        run("add_transaction");

        assertEquals(1.0, registry.get("ledger.commands")
            .tags("command", "add_transaction", "outcome", "success").counter().count());
        assertEquals(1.0, registry.get("ledger.commands")
            .tags("command", "delete_transaction", "outcome", "not_found").counter().count());
        assertEquals(1.0, registry.get("ledger.commands")
            .tags("command", "add_transaction", "outcome", "invalid_input").counter().count());
        assertEquals(3, registry.get("ledger.command.duration").timers().stream()
            .mapToLong(t -> t.count()).sum());
        assertEquals(1.0, registry.get("ledger.transactions").gauge().value());
    }
}
