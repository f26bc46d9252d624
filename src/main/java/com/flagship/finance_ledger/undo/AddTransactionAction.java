package com.flagship.finance_ledger.undo;

import com.flagship.finance_ledger.ledger.Transaction;
import lombok.Value;

/**
 * A transaction was created. Undone by removing it from every index.
 */
@Value
public class AddTransactionAction implements Action {
    Transaction transaction;

    @Override
    public ActionType getType() {
        return ActionType.ADD_TRANSACTION;
    }
}
