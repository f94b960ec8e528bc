package com.example.commandservice.controller;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CommandControllerTest {

    private static final long HOUR_MS = 3_600_000L;

    @Autowired
    private MockMvc mockMvc;

    @Value("${jwt.secret}")
    private String jwtSecret;

    private UUID ownerId;
    private String token;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
        token = tokenFor(ownerId, signingKey(jwtSecret), new Date(System.currentTimeMillis() + HOUR_MS));
    }

    private static SecretKey signingKey(String secret) {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    private static String tokenFor(UUID ownerId, SecretKey key, Date expiration) {
        return Jwts.builder()
                .subject(ownerId.toString())
                .claim("userId", ownerId.toString())
                .issuedAt(new Date(expiration.getTime() - 2 * HOUR_MS))
                .expiration(expiration)
                .signWith(key)
                .compact();
    }

    private String bearer() {
        return "Bearer " + token;
    }

    @Test
    void missingTokenIsAuthRequired() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"course\", \"action\": \"read\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_code").value("AUTH_REQUIRED"));
    }

    @Test
    void commandApiDocsArePublicAndGrouped() throws Exception {
        mockMvc.perform(get("/v3/api-docs/commands"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paths['/api/commands']").exists())
                .andExpect(jsonPath("$.paths['/api/audit/transactions/{transactionId}']").doesNotExist());
    }

    @Test
    void garbageTokenIsInvalidToken() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not.a.jwt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"course\", \"action\": \"read\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("INVALID_TOKEN"));
    }

    @Test
    void nonBearerSchemeIsInvalidToken() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"course\", \"action\": \"read\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("INVALID_TOKEN"));
    }

    @Test
    void tokenSignedWithAnotherKeyIsInvalidToken() throws Exception {
        String forged = tokenFor(ownerId, signingKey("another-secret-key-that-is-long-enough-0123456789"),
                new Date(System.currentTimeMillis() + HOUR_MS));

        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + forged)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"course\", \"action\": \"read\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("INVALID_TOKEN"));
    }

    @Test
    void expiredTokenIsInvalidToken() throws Exception {
        String expired = tokenFor(ownerId, signingKey(jwtSecret), new Date(System.currentTimeMillis() - HOUR_MS));

        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + expired)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"course\", \"action\": \"read\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("INVALID_TOKEN"));
    }

    @Test
    void createCourseUsesOwnerFromToken() throws Exception {
        String body = "{\"entity_kind\": \"course\", \"action\": \"create\", "
                + "\"payload\": {\"name\": \"Statistics\", \"owner_id\": \"" + UUID.randomUUID() + "\"}}";

        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.entity_id").exists())
                .andExpect(jsonPath("$.audit_log_id").exists())
                .andExpect(jsonPath("$.data.name").value("Statistics"))
                .andExpect(jsonPath("$.data.owner_id").value(ownerId.toString()));
    }

    @Test
    void legacyEntityTypeFieldIsAccepted() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_type\": \"course\", \"action\": \"read\", \"payload\": {}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(0)));
    }

    @Test
    void unknownEntityKindIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"spaceship\", \"action\": \"create\", \"payload\": {}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("UNKNOWN_ENTITY"));
    }

    @Test
    void updatingMissingRecordIsNotFound() throws Exception {
        String body = "{\"entity_kind\": \"assignment\", \"action\": \"update\", "
                + "\"payload\": {\"id\": \"" + UUID.randomUUID() + "\", \"title\": \"x\"}}";

        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    void malformedBodyIsInvalidPayload() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_PAYLOAD"));
    }

    @Test
    void requestIdHeaderIsEchoed() throws Exception {
        mockMvc.perform(post("/api/commands")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .header("X-Request-ID", "req-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entity_kind\": \"course\", \"action\": \"read\", \"payload\": {}}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-123"));
    }

    @Test
    void transactionBatchIsQueryableFromAuditLedger() throws Exception {
        UUID transactionId = UUID.randomUUID();
        String body = "{\"transaction_id\": \"" + transactionId + "\", \"intent\": \"set_up_course\", \"commands\": ["
                + "{\"entity_kind\": \"course\", \"action\": \"create\", \"payload\": {\"name\": \"Biology\"}},"
                + "{\"entity_kind\": \"event\", \"action\": \"create\", \"payload\": {\"title\": \"Lecture\","
                + " \"start_iso\": \"2025-03-04T09:00:00Z\", \"end_iso\": \"2025-03-04T10:00:00Z\"}}]}";

        mockMvc.perform(post("/api/commands/transactions")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.executed_steps").value(2))
                .andExpect(jsonPath("$.transaction_id").value(transactionId.toString()));

        mockMvc.perform(get("/api/audit/transactions/{id}", transactionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].entity_kind").value("course"))
                .andExpect(jsonPath("$[0].intent").value("set_up_course"))
                .andExpect(jsonPath("$[1].entity_kind").value("event"));

        // another owner sees nothing
        String otherToken = tokenFor(UUID.randomUUID(), signingKey(jwtSecret),
                new Date(System.currentTimeMillis() + HOUR_MS));
        mockMvc.perform(get("/api/audit/transactions/{id}", transactionId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + otherToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void failedBatchStepSetsResponseStatus() throws Exception {
        String body = "{\"commands\": ["
                + "{\"entity_kind\": \"course\", \"action\": \"create\", \"payload\": {\"name\": \"History\"}},"
                + "{\"entity_kind\": \"assignment\", \"action\": \"delete\", \"payload\": {\"id\": \"" + UUID.randomUUID() + "\"}}]}";

        mockMvc.perform(post("/api/commands/transactions")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.failed_step").value(1))
                .andExpect(jsonPath("$.results[0].success").value(true));
    }

    @Test
    void emptyBatchIsInvalidPayload() throws Exception {
        mockMvc.perform(post("/api/commands/transactions")
                        .header(HttpHeaders.AUTHORIZATION, bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"commands\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_PAYLOAD"));
    }

    @Test
    void entityHistoryRejectsUnknownKind() throws Exception {
        mockMvc.perform(get("/api/audit/entities/{kind}/{id}", "spaceship", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, bearer()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("UNKNOWN_ENTITY"));
    }

    @Test
    void entityHistoryRejectsMalformedId() throws Exception {
        mockMvc.perform(get("/api/audit/entities/{kind}/{id}", "course", "not-a-uuid")
                        .header(HttpHeaders.AUTHORIZATION, bearer()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_PAYLOAD"));
    }
}
