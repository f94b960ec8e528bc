package com.example.commandservice.handler;

import com.example.commandservice.client.DocumentGenerationClient;
import com.example.commandservice.client.GenerationRequest;
import com.example.commandservice.client.GenerationResponse;
import com.example.commandservice.exception.ErrorCode;
import com.example.commandservice.exception.InvalidPayloadException;
import com.example.commandservice.exception.NotImplementedException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentGenerationHandlerTest {

    private static final UUID OWNER_ID = UUID.randomUUID();

    @Mock
    private DocumentGenerationClient generationClient;

    @InjectMocks
    private DocumentGenerationHandler handler;

    @Test
    void createForwardsTopicWithDefaultDepth() {
        ObjectNode document = JsonNodeFactory.instance.objectNode().put("title", "Cell biology");
        when(generationClient.generate(any(GenerationRequest.class)))
                .thenReturn(new GenerationResponse(true, document, null));
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("topic", "Cell biology");

        HandlerOutcome outcome = handler.create(OWNER_ID, Payload.of(payload));

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationClient).generate(request.capture());
        assertThat(request.getValue().getTopic()).isEqualTo("Cell biology");
        assertThat(request.getValue().getDepthLevel()).isEqualTo(DocumentGenerationHandler.DEFAULT_DEPTH);
        assertThat(outcome.getEntityId()).isNull();
        assertThat(outcome.getData()).isEqualTo(document);
        assertThat(outcome.getAfterState()).isEqualTo(document);
    }

    @Test
    void createAcceptsCamelCaseFileFields() {
        when(generationClient.generate(any(GenerationRequest.class)))
                .thenReturn(new GenerationResponse(true, JsonNodeFactory.instance.objectNode(), null));
        ObjectNode payload = JsonNodeFactory.instance.objectNode()
                .put("fileContent", "Mitochondria are ...")
                .put("fileName", "lecture4.txt")
                .put("depth_level", "deep");

        handler.create(OWNER_ID, Payload.of(payload));

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationClient).generate(request.capture());
        assertThat(request.getValue().getFileContent()).isEqualTo("Mitochondria are ...");
        assertThat(request.getValue().getFileName()).isEqualTo("lecture4.txt");
        assertThat(request.getValue().getDepthLevel()).isEqualTo("deep");
    }

    @Test
    void createNeedsTopicOrFileContent() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("topic", " ");

        assertThatThrownBy(() -> handler.create(OWNER_ID, Payload.of(payload)))
                .isInstanceOf(InvalidPayloadException.class);
        verifyNoInteractions(generationClient);
    }

    @Test
    void otherActionsAreNotImplemented() {
        assertThatThrownBy(() -> handler.read(OWNER_ID, Payload.empty()))
                .isInstanceOf(NotImplementedException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.NOT_IMPLEMENTED);
        assertThatThrownBy(() -> handler.update(OWNER_ID, Payload.empty()))
                .isInstanceOf(NotImplementedException.class);
        assertThatThrownBy(() -> handler.delete(OWNER_ID, Payload.empty()))
                .isInstanceOf(NotImplementedException.class);
    }
}
