package com.flagship.finance_ledger.undo;

/**
 * Reversible descriptor of one past ledger mutation.
 *
 * Each implementation carries exactly the typed payload its inverse needs.
 */
public interface Action {

    ActionType getType();
}
