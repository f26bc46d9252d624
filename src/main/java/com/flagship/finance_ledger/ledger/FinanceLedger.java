package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.bill.Bill;
import com.flagship.finance_ledger.bill.BillSchedule;
import com.flagship.finance_ledger.budget.Budget;
import com.flagship.finance_ledger.budget.BudgetAlert;
import com.flagship.finance_ledger.budget.CategoryAggregator;
import com.flagship.finance_ledger.index.AutocompleteIndex;
import com.flagship.finance_ledger.index.ChronologicalIndex;
import com.flagship.finance_ledger.index.DateIndex;
import com.flagship.finance_ledger.index.TopMagnitudeCache;
import com.flagship.finance_ledger.undo.Action;
import com.flagship.finance_ledger.undo.ActionLog;
import com.flagship.finance_ledger.undo.AddBillAction;
import com.flagship.finance_ledger.undo.AddBudgetAction;
import com.flagship.finance_ledger.undo.AddTransactionAction;
import com.flagship.finance_ledger.undo.DeleteBillAction;
import com.flagship.finance_ledger.undo.DeleteTransactionAction;
import com.flagship.finance_ledger.undo.PayBillAction;
import com.flagship.finance_ledger.undo.UpdateBudgetAction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The ledger: one transaction set seen through several synchronized indexes,
 * plus budgets, bills and an undo log.
 *
 * Key invariants:
 * 1. A transaction is in both the chronological and the date index, or in neither
 * 2. A category's spent value equals the sum of its non-deleted expenses
 * 3. Every mutation validates first, then applies to all indexes and logs one action
 *
 * Single writer. Nothing here is safe for concurrent use; callers that share a
 * ledger across threads must serialize every call behind one lock. The count
 * getters are the exception: they read volatile copies refreshed after each mutation.
 */
@Slf4j
public class FinanceLedger {

    public static final int DEFAULT_UNDO_CAPACITY = 50;
    public static final int DEFAULT_BUCKET_COUNT = 100;
    public static final List<String> DEFAULT_CATEGORIES = List.of(
        "Food", "Transport", "Shopping", "Entertainment", "Bills",
        "Healthcare", "Education", "Salary", "Freelance", "Investment",
        "Rent", "Utilities", "Groceries", "Dining", "Travel"
    );

    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern YEAR_MONTH = Pattern.compile("\\d{4}-\\d{2}");
    private static final int AMOUNT_MAX_SCALE = 4;
    private static final int AMOUNT_MAX_INTEGER_DIGITS = 15;

    private final ChronologicalIndex chronological = new ChronologicalIndex();
    private final DateIndex byDate = new DateIndex();
    private final TopMagnitudeCache<Transaction> expenseCache =
        new TopMagnitudeCache<>(Comparator.comparing(Transaction::getAmount));
    private final TopMagnitudeCache<CategoryAmount> categoryCache =
        new TopMagnitudeCache<>(Comparator.comparing(CategoryAmount::getTotalAmount));
    private final CategoryAggregator aggregator;
    private final BillSchedule bills = new BillSchedule();
    private final ActionLog actionLog;
    private final AutocompleteIndex categoryNames = new AutocompleteIndex();
    private final AutocompleteIndex payees = new AutocompleteIndex();
    private final IdGenerator transactionIds;
    private final IdGenerator billIds;

    // Published after every mutation for readers outside the owning lock.
    private volatile int transactionCount;
    private volatile int budgetCount;
    private volatile int billCount;
    private volatile int undoDepth;

    public FinanceLedger() {
        this(DEFAULT_UNDO_CAPACITY, DEFAULT_BUCKET_COUNT, DEFAULT_CATEGORIES, Clock.systemUTC());
    }

    public FinanceLedger(int undoCapacity, int bucketCount, Collection<String> defaultCategories, Clock clock) {
        this.actionLog = new ActionLog(undoCapacity);
        this.aggregator = new CategoryAggregator(bucketCount);
        this.transactionIds = new IdGenerator("txn", clock);
        this.billIds = new IdGenerator("bill", clock);
        defaultCategories.forEach(categoryNames::insert);
    }

    // ===== Transactions =====

    /**
     * Records a new transaction at the front of the chronological order.
     *
     * @throws InvalidInputException if the type is unknown, the amount is not
     *         positive or out of range, the category is blank or the date is not YYYY-MM-DD
     */
    public Transaction addTransaction(String type, BigDecimal amount, String category,
                                      String description, String date) {
        Transaction transaction = validatedTransaction(transactionIds.next(this::transactionIdTaken),
            type, amount, category, description, date);

        index(transaction, true);
        actionLog.push(new AddTransactionAction(transaction));
        publishCounts();

        log.debug("Added transaction: id={}, type={}, amount={}, category={}",
            transaction.getId(), transaction.getType(), transaction.getAmount(), transaction.getCategory());
        return transaction;
    }

    /**
     * Deletes a transaction from every index and reverses its aggregation.
     *
     * @return false if no transaction has that id; nothing is logged then
     */
    public boolean deleteTransaction(String id) {
        Optional<Transaction> found = byDate.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        Transaction transaction = found.get();
        actionLog.push(new DeleteTransactionAction(transaction));
        unindex(transaction);
        publishCounts();
        return true;
    }

    public Optional<Transaction> findTransaction(String id) {
        return byDate.findById(id);
    }

    /**
     * Chronological order, front first.
     */
    public List<Transaction> getAllTransactions() {
        return chronological.traverseForward();
    }

    public List<Transaction> getAllTransactionsReversed() {
        return chronological.traverseBackward();
    }

    public List<Transaction> getTransactionsByDateAsc() {
        return byDate.inorderTraversal();
    }

    public List<Transaction> getTransactionsByDateDesc() {
        return byDate.reverseInorderTraversal();
    }

    /**
     * Transactions dated within {@code [startDate, endDate]}, both inclusive.
     */
    public List<Transaction> getTransactionsInRange(String startDate, String endDate) {
        requireDate(startDate, "Start date");
        requireDate(endDate, "End date");
        return byDate.rangeQuery(startDate, endDate);
    }

    public List<Transaction> getRecentTransactions(int count) {
        return chronological.first(count);
    }

    public List<Transaction> getTransactionsByCategory(String category) {
        return chronological.filterByCategory(category);
    }

    public List<Transaction> getTransactionsByType(TransactionType type) {
        return chronological.filterByType(type);
    }

    // ===== Budgets =====

    /**
     * Creates a budget or replaces the limit of an existing one.
     * Spent is never set directly; it comes from the category's expenses.
     */
    public Budget setBudget(String category, BigDecimal limit) {
        requireCategory(category);
        requireLimit(limit);

        Optional<Budget> existing = aggregator.findBudget(category);
        if (existing.isPresent()) {
            actionLog.push(new UpdateBudgetAction(category, existing.get().getLimit()));
        } else {
            actionLog.push(new AddBudgetAction(category));
        }
        categoryNames.insert(category);
        Budget budget = aggregator.putBudget(category, limit);
        publishCounts();
        return budget;
    }

    public Optional<Budget> getBudget(String category) {
        return aggregator.findBudget(category);
    }

    public List<Budget> getAllBudgets() {
        return aggregator.budgets();
    }

    public List<BudgetAlert> getBudgetAlerts() {
        return aggregator.alerts();
    }

    // ===== Bills =====

    public Bill addBill(String name, BigDecimal amount, String dueDate, String category) {
        Bill bill = validatedBill(billIds.next(id -> bills.findById(id).isPresent()),
            name, amount, dueDate, category, false);
        bills.enqueue(bill);
        actionLog.push(new AddBillAction(bill.getId()));
        publishCounts();
        return bill;
    }

    /**
     * @return false if no bill has that id
     */
    public boolean payBill(String id) {
        Optional<Bill> bill = bills.findById(id);
        if (bill.isEmpty()) {
            return false;
        }
        actionLog.push(new PayBillAction(id, bill.get().isPaid()));
        boolean paid = bills.markAsPaid(id);
        publishCounts();
        return paid;
    }

    /**
     * @return false if no bill has that id
     */
    public boolean removeBill(String id) {
        Optional<Bill> bill = bills.findById(id);
        if (bill.isEmpty()) {
            return false;
        }
        actionLog.push(new DeleteBillAction(bill.get()));
        boolean removed = bills.removeById(id);
        publishCounts();
        return removed;
    }

    public Optional<Bill> findBill(String id) {
        return bills.findById(id);
    }

    public Optional<Bill> getNextBill() {
        return bills.peek();
    }

    public List<Bill> getAllBills() {
        return bills.getAllBills();
    }

    public List<Bill> getUnpaidBills() {
        return bills.getUnpaidBills();
    }

    public List<Bill> getOverdueBills(String referenceDate) {
        requireDate(referenceDate, "Reference date");
        return bills.getOverdueBills(referenceDate);
    }

    // ===== Analytics =====

    /**
     * Largest {@code k} expenses. The heap is rebuilt from the chronological
     * index on every call.
     */
    public List<Transaction> getTopExpenses(int k) {
        requireNonNegative(k);
        expenseCache.buildHeap(chronological.filterByType(TransactionType.EXPENSE));
        log.debug("Rebuilt expense heap with {} entries", expenseCache.size());
        return expenseCache.getTopK(k);
    }

    public List<CategoryAmount> getTopCategories(int k) {
        requireNonNegative(k);
        categoryCache.buildHeap(aggregator.categoryTotals());
        return categoryCache.getTopK(k);
    }

    /**
     * Summary of one month ({@code YYYY-MM}) from a date-index range query.
     */
    public MonthlySummary getMonthlySummary(String yearMonth) {
        if (yearMonth == null || !YEAR_MONTH.matcher(yearMonth).matches()) {
            throw new InvalidInputException("Month must be formatted as YYYY-MM: " + yearMonth);
        }

        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        List<Transaction> transactions = byDate.getByMonth(yearMonth);
        for (Transaction t : transactions) {
            if (t.isIncome()) {
                income = income.add(t.getAmount());
            } else {
                expenses = expenses.add(t.getAmount());
                byCategory.merge(t.getCategory(), t.getAmount(), BigDecimal::add);
            }
        }

        List<CategoryAmount> breakdown = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, total) -> breakdown.add(new CategoryAmount(category, total)));

        return MonthlySummary.builder()
            .month(yearMonth)
            .totalIncome(income)
            .totalExpenses(expenses)
            .netSavings(income.subtract(expenses))
            .transactionCount(transactions.size())
            .categoryBreakdown(breakdown)
            .build();
    }

    public BigDecimal getTotalIncome() {
        return sum(chronological.filterByType(TransactionType.INCOME));
    }

    public BigDecimal getTotalExpenses() {
        return sum(chronological.filterByType(TransactionType.EXPENSE));
    }

    public BigDecimal getTotalBalance() {
        return getTotalIncome().subtract(getTotalExpenses());
    }

    public LedgerTotals getTotals() {
        BigDecimal income = getTotalIncome();
        BigDecimal expenses = getTotalExpenses();
        return LedgerTotals.builder()
            .totalIncome(income)
            .totalExpenses(expenses)
            .balance(income.subtract(expenses))
            .transactionCount(getTransactionCount())
            .budgetCount(getBudgetCount())
            .billCount(getBillCount())
            .build();
    }

    public int getTransactionCount() {
        return transactionCount;
    }

    public int getBudgetCount() {
        return budgetCount;
    }

    public int getBillCount() {
        return billCount;
    }

    // ===== Autocomplete =====

    public List<String> getCategorySuggestions(String prefix, int limit) {
        return categoryNames.getWordsWithPrefix(prefix, limit);
    }

    public List<String> getPayeeSuggestions(String prefix, int limit) {
        return payees.getWordsWithPrefix(prefix, limit);
    }

    public List<String> getAllCategories() {
        return categoryNames.getAllWords();
    }

    // ===== Undo =====

    /**
     * Reverses the most recent logged action.
     *
     * @return false if there is nothing to undo
     */
    public boolean undo() {
        return undoLast().isPresent();
    }

    /**
     * Reverses the most recent logged action. The reversal itself is never logged.
     *
     * @return the action that was reversed, empty if the log is empty
     */
    public Optional<Action> undoLast() {
        Optional<Action> popped = actionLog.pop();
        popped.ifPresent(this::reverse);
        publishCounts();
        return popped;
    }

    public boolean canUndo() {
        return !actionLog.isEmpty();
    }

    public int getUndoDepth() {
        return undoDepth;
    }

    /**
     * Undoable actions, most recent first.
     */
    public List<Action> getActionHistory() {
        return actionLog.getAll();
    }

    // ===== Loading =====

    /**
     * Replays a stored transaction at the back of the chronological order.
     * Loads are not undoable.
     *
     * @throws InvalidInputException if the id is blank or already in the ledger
     */
    public Transaction loadTransaction(String id, String type, BigDecimal amount, String category,
                                       String description, String date) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Transaction id is required");
        }
        if (transactionIdTaken(id)) {
            throw new InvalidInputException("Duplicate transaction id: " + id);
        }
        Transaction transaction = validatedTransaction(id, type, amount, category, description, date);
        index(transaction, false);
        transactionIds.advancePast(id);
        publishCounts();
        return transaction;
    }

    public Budget loadBudget(String category, BigDecimal limit) {
        requireCategory(category);
        requireLimit(limit);
        categoryNames.insert(category);
        Budget budget = aggregator.putBudget(category, limit);
        publishCounts();
        return budget;
    }

    public Bill loadBill(String id, String name, BigDecimal amount, String dueDate,
                         String category, boolean paid) {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Bill id is required");
        }
        if (bills.findById(id).isPresent()) {
            throw new InvalidInputException("Duplicate bill id: " + id);
        }
        Bill bill = validatedBill(id, name, amount, dueDate, category, paid);
        bills.enqueue(bill);
        billIds.advancePast(id);
        publishCounts();
        return bill;
    }

    /**
     * Drops all transactions, budgets, bills and logged actions.
     * Autocomplete vocabularies are kept.
     */
    public void clearAll() {
        chronological.clear();
        byDate.clear();
        expenseCache.clear();
        categoryCache.clear();
        aggregator.clear();
        bills.clear();
        actionLog.clear();
        publishCounts();
    }

    // ===== Internals =====

    private void reverse(Action action) {
        log.debug("Undoing {}", action.getType());
        switch (action.getType()) {
            case ADD_TRANSACTION -> unindex(((AddTransactionAction) action).getTransaction());
            case DELETE_TRANSACTION -> {
                index(((DeleteTransactionAction) action).getSnapshot(), false);
            }
            case ADD_BUDGET -> aggregator.removeBudget(((AddBudgetAction) action).getCategory());
            case UPDATE_BUDGET -> {
                UpdateBudgetAction update = (UpdateBudgetAction) action;
                aggregator.findBudget(update.getCategory())
                    .ifPresent(b -> aggregator.putBudget(update.getCategory(), update.getPreviousLimit()));
            }
            case ADD_BILL -> bills.removeById(((AddBillAction) action).getBillId());
            case DELETE_BILL -> bills.enqueue(((DeleteBillAction) action).getSnapshot());
            case PAY_BILL -> {
                PayBillAction pay = (PayBillAction) action;
                bills.setPaid(pay.getBillId(), pay.isPreviouslyPaid());
            }
        }
    }

    /**
     * Adds to aggregation, both ordered indexes and autocomplete. Aggregation
     * runs first so a failure there leaves the indexes untouched.
     */
    private void index(Transaction transaction, boolean front) {
        if (transaction.isExpense()) {
            aggregator.recordExpense(transaction.getCategory(), transaction.getAmount());
        }
        if (front) {
            chronological.addFront(transaction);
        } else {
            chronological.addBack(transaction);
        }
        byDate.insert(transaction);
        categoryNames.insert(transaction.getCategory());
        if (!transaction.getDescription().isEmpty()) {
            payees.insert(transaction.getDescription());
        }
    }

    private void unindex(Transaction transaction) {
        if (!chronological.deleteById(transaction.getId())) {
            log.warn("Transaction {} already absent from the ledger, nothing to remove", transaction.getId());
            return;
        }
        byDate.remove(transaction);
        if (transaction.isExpense()) {
            aggregator.reverseExpense(transaction.getCategory(), transaction.getAmount());
        }
    }

    private boolean transactionIdTaken(String id) {
        return chronological.contains(id) || byDate.findById(id).isPresent();
    }

    private void publishCounts() {
        transactionCount = chronological.size();
        budgetCount = aggregator.budgetCount();
        billCount = bills.size();
        undoDepth = actionLog.size();
    }

    private Transaction validatedTransaction(String id, String type, BigDecimal amount, String category,
                                             String description, String date) {
        TransactionType transactionType = TransactionType.fromWireName(type);
        requireAmount(amount, "Transaction amount");
        requireCategory(category);
        requireDate(date, "Transaction date");
        return new Transaction(id, transactionType, amount, category,
            description == null ? "" : description, date);
    }

    private Bill validatedBill(String id, String name, BigDecimal amount, String dueDate,
                               String category, boolean paid) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Bill name is required");
        }
        requireAmount(amount, "Bill amount");
        requireDate(dueDate, "Bill due date");
        requireCategory(category);
        return new Bill(id, name, amount, dueDate, category, paid);
    }

    private static void requireAmount(BigDecimal amount, String field) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidInputException(field + " must be positive");
        }
        requireInRange(amount, field);
    }

    private static void requireLimit(BigDecimal limit) {
        if (limit == null || limit.signum() < 0) {
            throw new InvalidInputException("Budget limit must be zero or positive");
        }
        requireInRange(limit, "Budget limit");
    }

    // Same bounds as a DECIMAL(19,4) column.
    private static void requireInRange(BigDecimal amount, String field) {
        if (amount.signum() == 0) {
            return;
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        long integerDigits = (long) normalized.precision() - normalized.scale();
        if (normalized.scale() > AMOUNT_MAX_SCALE || integerDigits > AMOUNT_MAX_INTEGER_DIGITS) {
            throw new InvalidInputException(field + " is out of range: at most "
                + AMOUNT_MAX_INTEGER_DIGITS + " integer digits and "
                + AMOUNT_MAX_SCALE + " decimal places are allowed");
        }
    }

    private static void requireCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new InvalidInputException("Category is required");
        }
    }

    private static void requireDate(String date, String field) {
        if (date == null || !DATE.matcher(date).matches()) {
            throw new InvalidInputException(field + " must be formatted as YYYY-MM-DD: " + date);
        }
    }

    private static void requireNonNegative(int k) {
        if (k < 0) {
            throw new InvalidInputException("Result count cannot be negative: " + k);
        }
    }

    private static BigDecimal sum(List<Transaction> transactions) {
        return transactions.stream()
            .map(Transaction::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
