package com.flagship.finance_ledger.undo;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of reversible ledger mutations.
 */
public enum ActionType {
    ADD_TRANSACTION,
    DELETE_TRANSACTION,
    ADD_BUDGET,
    UPDATE_BUDGET,
    ADD_BILL,
    DELETE_BILL,
    PAY_BILL;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
