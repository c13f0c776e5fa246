package org.octofleet.orchestrator.service;

import org.octofleet.orchestrator.api.error.ErrorCode;

import java.util.Map;

public class ValidationException extends FleetException {
    public ValidationException(ErrorCode code, String message) {
        super(code, message, Map.of());
    }

    public ValidationException(ErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details);
    }

    public static ValidationException invalidTarget(String message) {
        return new ValidationException(ErrorCode.INVALID_TARGET, message);
    }

    public static ValidationException packageNotFound(String name, String version) {
        return new ValidationException(ErrorCode.PACKAGE_NOT_FOUND,
                "package not found or inactive: " + name + " " + version,
                Map.of("package_name", name, "package_version", version));
    }
}
