package com.flagship.finance_ledger.budget;

import com.flagship.finance_ledger.index.CategoryTable;
import com.flagship.finance_ledger.ledger.CategoryAmount;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running per-category totals and the budgets that track them.
 *
 * Two tables are kept: the raw expense total for every category that has
 * ever seen an expense, and the budget records created by setting a limit.
 * Every expense change writes both, so a budget's spent value always equals
 * the category's running total.
 */
public class CategoryAggregator {

    private final CategoryTable<Budget> budgets;
    private final CategoryTable<BigDecimal> expenseTotals;

    public CategoryAggregator(int bucketCount) {
        this.budgets = new CategoryTable<>(bucketCount);
        this.expenseTotals = new CategoryTable<>(bucketCount);
    }

    public void recordExpense(String category, BigDecimal amount) {
        writeTotal(category, spentFor(category).add(amount));
    }

    /**
     * Subtracts an expense. The total is floored at zero.
     */
    public void reverseExpense(String category, BigDecimal amount) {
        writeTotal(category, spentFor(category).subtract(amount).max(BigDecimal.ZERO));
    }

    public BigDecimal spentFor(String category) {
        return expenseTotals.get(category).orElse(BigDecimal.ZERO);
    }

    public Optional<Budget> findBudget(String category) {
        return budgets.get(category);
    }

    /**
     * Creates the budget, seeding spent from the running total, or replaces
     * the limit of an existing one.
     */
    public Budget putBudget(String category, BigDecimal limit) {
        Budget budget = budgets.get(category)
            .map(existing -> existing.withLimit(limit))
            .orElseGet(() -> new Budget(category, limit, spentFor(category)));
        budgets.put(category, budget);
        return budget;
    }

    public boolean removeBudget(String category) {
        return budgets.remove(category);
    }

    public List<Budget> budgets() {
        return budgets.values();
    }

    /**
     * Alerts for every budget at caution level or above, derived on each call.
     */
    public List<BudgetAlert> alerts() {
        List<BudgetAlert> alerts = new ArrayList<>();
        for (Budget budget : budgets.values()) {
            if (budget.getAlertLevel() != AlertLevel.NORMAL) {
                alerts.add(BudgetAlert.from(budget));
            }
        }
        return alerts;
    }

    /**
     * Categories with a positive expense total.
     */
    public List<CategoryAmount> categoryTotals() {
        List<CategoryAmount> totals = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> entry : expenseTotals.entries()) {
            if (entry.getValue().signum() > 0) {
                totals.add(new CategoryAmount(entry.getKey(), entry.getValue()));
            }
        }
        return totals;
    }

    public int budgetCount() {
        return budgets.size();
    }

    public void clear() {
        budgets.clear();
        expenseTotals.clear();
    }

    private void writeTotal(String category, BigDecimal total) {
        expenseTotals.put(category, total);
        budgets.get(category).ifPresent(b -> budgets.update(category, b.withSpent(total)));
    }
}
