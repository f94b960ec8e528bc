package com.example.commandservice.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of the notes generation service. Field names follow that service's camelCase contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationRequest {
    private String topic;
    private String fileContent;
    private String fileName;
    private String filePrompt;
    private String depthLevel;
}
