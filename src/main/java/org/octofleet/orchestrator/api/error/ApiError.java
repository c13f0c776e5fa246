package org.octofleet.orchestrator.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        Instant timestamp,
        ErrorCode code,
        String message,
        String correlationId,
        Map<String,Object> details
) {
    public static ApiError of(ErrorCode code, String message, String correlationId, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, message, correlationId, details == null ? Map.of() : details);
    }
}
