package com.example.commandservice.dto.response;

import com.example.commandservice.exception.BaseException;
import com.example.commandservice.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Result envelope returned for every command, successful or not.
 *
 * <p>For a successful mutation {@code data} equals the after state recorded in the audit ledger,
 * so a cached replay differs from the original response only in {@code cached}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CommandResult {

    private boolean success;
    private JsonNode data;
    private String error;
    private ErrorCode errorCode;
    private UUID entityId;
    private Boolean cached;
    private UUID auditLogId;
    /** Set when the entity write committed but its audit record could not be written. */
    private Boolean degraded;

    public static CommandResult ok(JsonNode data, UUID entityId) {
        return CommandResult.builder()
                .success(true)
                .data(data)
                .entityId(entityId)
                .build();
    }

    public static CommandResult failure(ErrorCode errorCode, String message) {
        return CommandResult.builder()
                .success(false)
                .error(message)
                .errorCode(errorCode)
                .build();
    }

    public static CommandResult failure(BaseException ex) {
        return failure(ex.getErrorCode(), ex.getMessage());
    }

    @JsonIgnore
    public HttpStatus httpStatus() {
        return success || errorCode == null ? HttpStatus.OK : errorCode.getStatus();
    }
}
