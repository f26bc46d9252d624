package com.flagship.finance_ledger.command;

import com.flagship.finance_ledger.command.dto.CommandRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * REST entry point for ledger commands.
 *
 * Rejected input is answered with 400 and the outcome body. Not-found and
 * empty-undo outcomes are ordinary results and come back as 200 with
 * {@code success=false}.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final CommandDispatcher dispatcher;

    @PostMapping("/commands")
    public ResponseEntity<CommandOutcome> execute(@Valid @RequestBody CommandRequest request) {
        log.debug("Received command request: command={}", request.getCommand());

        CommandOutcome outcome = dispatcher.dispatch(request.getCommand(), request.getParams());
        if (outcome.getError() == ErrorKind.INVALID_INPUT) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }

    @GetMapping("/commands")
    public ResponseEntity<List<String>> listCommands() {
        return ResponseEntity.ok(Arrays.stream(LedgerCommand.values())
                .map(LedgerCommand::getWireName)
                .toList());
    }
}
