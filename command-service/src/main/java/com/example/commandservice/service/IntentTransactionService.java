package com.example.commandservice.service;

import com.example.commandservice.dto.Command;
import com.example.commandservice.dto.TransactionContext;
import com.example.commandservice.dto.request.CommandRequest;
import com.example.commandservice.dto.request.TransactionBatchRequest;
import com.example.commandservice.dto.response.CommandResult;
import com.example.commandservice.dto.response.TransactionBatchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the commands of one user intent in order under a shared transaction id.
 *
 * <p>Best-effort grouping only: each step commits on its own and nothing is undone when a later
 * step fails. The shared id lets callers rebuild the intent from the audit ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentTransactionService {

    private final CommandRouter commandRouter;

    public TransactionBatchResponse execute(UUID ownerId, TransactionBatchRequest request) {
        TransactionContext context = TransactionContext.begin(request.getTransactionId(), request.getIntent());
        boolean stopOnFailure = request.getStopOnFailure() == null || request.getStopOnFailure();
        log.info("Starting intent transaction: transactionId={}, ownerId={}, steps={}",
                context.getTransactionId(), ownerId, request.getCommands().size());

        List<CommandResult> results = new ArrayList<>();
        Integer failedStep = null;
        for (int step = 0; step < request.getCommands().size(); step++) {
            CommandRequest stepRequest = request.getCommands().get(step);
            Command command = context.stamp(stepRequest.toCommand(ownerId));
            CommandResult result = commandRouter.handle(command);
            results.add(result);

            if (!result.isSuccess()) {
                if (failedStep == null) {
                    failedStep = step;
                }
                log.warn("Intent transaction step failed: transactionId={}, step={}, code={}",
                        context.getTransactionId(), step, result.getErrorCode());
                if (stopOnFailure) {
                    break;
                }
            }
        }

        log.info("Intent transaction finished: transactionId={}, executed={}, failedStep={}",
                context.getTransactionId(), results.size(), failedStep);
        return TransactionBatchResponse.builder()
                .success(failedStep == null)
                .transactionId(context.getTransactionId())
                .executedSteps(results.size())
                .failedStep(failedStep)
                .results(results)
                .build();
    }
}
