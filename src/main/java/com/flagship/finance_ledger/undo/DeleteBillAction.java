package com.flagship.finance_ledger.undo;

import com.flagship.finance_ledger.bill.Bill;
import lombok.Value;

/**
 * A bill was removed from the schedule. Restoring it re-enqueues the snapshot
 * at the tail; the original queue position is not recovered.
 */
@Value
public class DeleteBillAction implements Action {
    Bill snapshot;

    @Override
    public ActionType getType() {
        return ActionType.DELETE_BILL;
    }
}
