package com.flagship.finance_ledger.command;

import com.flagship.finance_ledger.bill.Bill;
import com.flagship.finance_ledger.budget.BudgetAlert;
import com.flagship.finance_ledger.ledger.CategoryAmount;
import com.flagship.finance_ledger.ledger.LedgerTotals;
import com.flagship.finance_ledger.ledger.Transaction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One-call overview of the ledger for the presentation layer.
 */
@Value
@Builder
public class Dashboard {
    LedgerTotals totals;
    List<Transaction> recentTransactions;
    List<CategoryAmount> topCategories;
    List<BudgetAlert> alerts;
    List<Bill> unpaidBills;
    List<Bill> overdueBills;
    Bill nextBill;
    boolean canUndo;
    Instant generatedAt;
}
