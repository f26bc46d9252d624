package com.flagship.finance_ledger.snapshot;

import com.flagship.finance_ledger.bill.Bill;
import com.flagship.finance_ledger.budget.Budget;
import com.flagship.finance_ledger.ledger.FinanceLedger;
import com.flagship.finance_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Queryable ledger state as written to and read from storage.
 *
 * Transactions are kept in chronological (front-to-back) order and bills in
 * queue order, so replaying them through the load path rebuilds the same
 * orderings. Budgets carry only their limit; spent is recomputed on replay.
 */
@Value
public class LedgerSnapshot {
    List<Transaction> transactions;
    List<BudgetEntry> budgets;
    List<Bill> bills;
    Instant capturedAt;

    @Value
    public static class BudgetEntry {
        String category;
        BigDecimal limit;
    }

    public static LedgerSnapshot capture(FinanceLedger ledger, Instant capturedAt) {
        return new LedgerSnapshot(
            ledger.getAllTransactions(),
            ledger.getAllBudgets().stream()
                .map(LedgerSnapshot::toEntry)
                .toList(),
            ledger.getAllBills(),
            capturedAt
        );
    }

    /**
     * Loads every record into the ledger. Nothing replayed here is undoable.
     */
    public void replayInto(FinanceLedger ledger) {
        for (Transaction t : nullSafe(transactions)) {
            ledger.loadTransaction(t.getId(), t.getType().getWireName(), t.getAmount(),
                t.getCategory(), t.getDescription(), t.getDate());
        }
        for (BudgetEntry b : nullSafe(budgets)) {
            ledger.loadBudget(b.getCategory(), b.getLimit());
        }
        for (Bill b : nullSafe(bills)) {
            ledger.loadBill(b.getId(), b.getName(), b.getAmount(), b.getDueDate(), b.getCategory(), b.isPaid());
        }
    }

    private static BudgetEntry toEntry(Budget budget) {
        return new BudgetEntry(budget.getCategory(), budget.getLimit());
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
