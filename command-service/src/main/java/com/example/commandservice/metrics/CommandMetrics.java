package com.example.commandservice.metrics;

import com.example.commandservice.dto.response.CommandResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for command handling.
 *
 * <ul>
 *   <li>{@code planner_commands_total{entity_kind, action, outcome}}: outcome is "success" or the error code</li>
 *   <li>{@code planner_command_replays_total{entity_kind}}: idempotent replays</li>
 *   <li>{@code planner_audit_failures_total{entity_kind}}: committed writes without an audit record</li>
 * </ul>
 */
@Component
public class CommandMetrics {

    static final String UNKNOWN = "unknown";

    private final MeterRegistry meterRegistry;

    public CommandMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordOutcome(String entityKind, String action, CommandResult result) {
        String outcome = result.isSuccess() ? "success" : String.valueOf(result.getErrorCode());
        Counter.builder("planner_commands_total")
                .description("Commands handled by the router")
                .tag("entity_kind", orUnknown(entityKind))
                .tag("action", orUnknown(action))
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordReplay(String entityKind) {
        Counter.builder("planner_command_replays_total")
                .description("Keyed commands answered from the audit ledger")
                .tag("entity_kind", orUnknown(entityKind))
                .register(meterRegistry)
                .increment();
    }

    public void recordAuditFailure(String entityKind) {
        Counter.builder("planner_audit_failures_total")
                .description("Entity writes committed without an audit record")
                .tag("entity_kind", orUnknown(entityKind))
                .register(meterRegistry)
                .increment();
    }

    private static String orUnknown(String value) {
        return value != null ? value : UNKNOWN;
    }
}
