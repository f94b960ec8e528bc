package com.example.commandservice.controller;

import com.example.commandservice.dto.request.CommandRequest;
import com.example.commandservice.dto.request.TransactionBatchRequest;
import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.dto.response.TransactionBatchResponse;
import com.example.commandservice.security.CurrentUser;
import com.example.commandservice.service.CommandRouter;
import com.example.commandservice.service.IntentTransactionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/commands")
@RequiredArgsConstructor
@Slf4j
public class CommandController {

    private final CommandRouter commandRouter;
    private final IntentTransactionService intentTransactionService;

    /**
     * Execute one command. The HTTP status follows the envelope's error code.
     */
    @PostMapping
    public ResponseEntity<CommandResult> execute(
            @AuthenticationPrincipal CurrentUser currentUser,
            @RequestBody CommandRequest request) {
        CommandResult result = commandRouter.handle(request.toCommand(currentUser.getUserId()));
        return ResponseEntity.status(result.httpStatus()).body(result);
    }

    /**
     * Execute the ordered commands of one intent under a shared transaction id.
     * 200 when every step succeeded, otherwise the status of the first failed step.
     */
    @PostMapping("/transactions")
    public ResponseEntity<TransactionBatchResponse> executeTransaction(
            @AuthenticationPrincipal CurrentUser currentUser,
            @Valid @RequestBody TransactionBatchRequest request) {
        TransactionBatchResponse response = intentTransactionService.execute(currentUser.getUserId(), request);
        HttpStatus status = response.getFailedStep() == null
                ? HttpStatus.OK
                : response.getResults().get(response.getFailedStep()).httpStatus();
        return ResponseEntity.status(status).body(response);
    }
}
