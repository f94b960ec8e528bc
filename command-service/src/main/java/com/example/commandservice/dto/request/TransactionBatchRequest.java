package com.example.commandservice.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransactionBatchRequest {

    private UUID transactionId;

    private String intent;

    @Builder.Default
    private Boolean stopOnFailure = true;

    @NotEmpty(message = "commands must not be empty")
    @Size(max = 50, message = "at most 50 commands per transaction")
    @Valid
    private List<CommandRequest> commands;
}
