package com.flagship.finance_ledger.undo;

import com.flagship.finance_ledger.ledger.Transaction;
import lombok.Value;

/**
 * A transaction was deleted. Holds the full pre-delete snapshot so it can be
 * restored.
 */
@Value
public class DeleteTransactionAction implements Action {
    Transaction snapshot;

    @Override
    public ActionType getType() {
        return ActionType.DELETE_TRANSACTION;
    }
}
