package com.example.commandservice.handler;

import com.example.commandservice.client.DocumentGenerationClient;
import com.example.commandservice.client.GenerationRequest;
import com.example.commandservice.client.GenerationResponse;
import com.example.commandservice.entity.CommandAction;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.exception.InvalidPayloadException;
import com.example.commandservice.exception.NotImplementedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Generated study documents. Only create exists: it proxies to the generation service and
 * stores nothing locally, so the outcome has no entity id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentGenerationHandler implements EntityHandler {

    static final String DEFAULT_DEPTH = "standard";

    private final DocumentGenerationClient generationClient;

    @Override
    public EntityKind kind() {
        return EntityKind.DOCUMENT_GENERATION;
    }

    @Override
    public boolean callsExternalService() {
        return true;
    }

    @Override
    public HandlerOutcome create(UUID ownerId, Payload payload) {
        String topic = payload.text("topic");
        String fileContent = text(payload, "file_content", "fileContent");
        if (isBlank(topic) && isBlank(fileContent)) {
            throw new InvalidPayloadException("Either topic or file_content is required");
        }

        GenerationRequest request = GenerationRequest.builder()
                .topic(topic)
                .fileContent(fileContent)
                .fileName(text(payload, "file_name", "fileName"))
                .filePrompt(text(payload, "file_prompt", "filePrompt"))
                .depthLevel(orDefault(text(payload, "depth_level", "depthLevel"), DEFAULT_DEPTH))
                .build();

        log.info("Generating document: ownerId={}, topic={}", ownerId, topic);
        GenerationResponse response = generationClient.generate(request);
        return HandlerOutcome.mutation(null, null, response.getData());
    }

    @Override
    public HandlerOutcome read(UUID ownerId, Payload filter) {
        throw new NotImplementedException(kind(), CommandAction.READ);
    }

    @Override
    public HandlerOutcome update(UUID ownerId, Payload payload) {
        throw new NotImplementedException(kind(), CommandAction.UPDATE);
    }

    @Override
    public HandlerOutcome delete(UUID ownerId, Payload payload) {
        throw new NotImplementedException(kind(), CommandAction.DELETE);
    }

    private static String text(Payload payload, String... fields) {
        String field = payload.firstPresent(fields);
        return field != null ? payload.text(field) : null;
    }

    private static String orDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
