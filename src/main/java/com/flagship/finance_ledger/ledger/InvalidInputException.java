package com.flagship.finance_ledger.ledger;

/**
 * Raised when a caller supplies malformed input to the ledger.
 *
 * This is the only ledger failure that surfaces to the boundary as a rejected
 * command. It is always raised before any index is touched, so a rejected
 * mutation is never partially applied.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
