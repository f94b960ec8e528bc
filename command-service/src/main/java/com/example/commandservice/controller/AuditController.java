package com.example.commandservice.controller;

import com.example.commandservice.dto.response.AuditRecordResponse;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.exception.UnknownCommandException;
import com.example.commandservice.security.CurrentUser;
import com.example.commandservice.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only provenance queries over the caller's own audit records.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<List<AuditRecordResponse>> getTransaction(
            @AuthenticationPrincipal CurrentUser currentUser,
            @PathVariable UUID transactionId) {
        return ResponseEntity.ok(auditService.findTransaction(currentUser.getUserId(), transactionId));
    }

    @GetMapping("/entities/{entityKind}/{entityId}")
    public ResponseEntity<List<AuditRecordResponse>> getEntityHistory(
            @AuthenticationPrincipal CurrentUser currentUser,
            @PathVariable String entityKind,
            @PathVariable UUID entityId) {
        EntityKind kind = EntityKind.fromWire(entityKind)
                .orElseThrow(() -> UnknownCommandException.unknownEntity(entityKind));
        return ResponseEntity.ok(auditService.findEntityHistory(currentUser.getUserId(), kind, entityId));
    }
}
