package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Result of one command: a success payload or a failure kind with a message.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandOutcome {
    boolean success;
    Object data;
    ErrorKind error;
    String message;

    public static CommandOutcome ok(Object data) {
        return new CommandOutcome(true, data, null, null);
    }

    public static CommandOutcome invalidInput(String message) {
        return new CommandOutcome(false, null, ErrorKind.INVALID_INPUT, message);
    }

    public static CommandOutcome notFound(String message) {
        return new CommandOutcome(false, null, ErrorKind.NOT_FOUND, message);
    }

    public static CommandOutcome logEmpty() {
        return new CommandOutcome(false, null, ErrorKind.LOG_EMPTY, "Nothing to undo");
    }

    /**
     * Metric tag for this outcome.
     */
    @JsonIgnore
    public String getOutcomeTag() {
        return success ? "success" : error.getWireName();
    }
}
