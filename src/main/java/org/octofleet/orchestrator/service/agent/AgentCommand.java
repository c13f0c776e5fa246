package org.octofleet.orchestrator.service.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Work handed to a node agent.
 *
 * @param referenceId deployment id, remediation job id or live session id
 */
public record AgentCommand(String id, Type type, String referenceId, Map<String, Object> payload, Instant issuedAt) {

    public enum Type {
        INSTALL, UNINSTALL, REMEDIATE, ROLLBACK, OPEN_SESSION, CLOSE_SESSION;

        @JsonValue
        public String wire() { return name().toLowerCase(Locale.ROOT); }
    }

    public static AgentCommand of(Type type, String referenceId, Map<String, Object> payload) {
        return new AgentCommand(UUID.randomUUID().toString(), type, referenceId,
                payload == null ? Map.of() : payload, Instant.now());
    }
}
