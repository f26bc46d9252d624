package com.flagship.finance_ledger.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.util.Map;

/**
 * Request DTO for executing a ledger command.
 */
@Value
public class CommandRequest {

    @NotBlank(message = "Command is required")
    @JsonProperty("command")
    String command;

    @JsonProperty("params")
    Map<String, Object> params;
}
