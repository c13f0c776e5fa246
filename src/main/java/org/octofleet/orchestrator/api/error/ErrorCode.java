package org.octofleet.orchestrator.api.error;
public enum ErrorCode {
    BAD_REQUEST, INVALID_TARGET, PACKAGE_NOT_FOUND, NOT_FOUND,
    ILLEGAL_TRANSITION, SESSION_KIND_CONFLICT, NOT_REQUIRING_APPROVAL, APPROVAL_REQUIRED, ROLLBACK_UNSUPPORTED,
    NODE_OFFLINE, UPSTREAM_UNAVAILABLE, TIMEOUT, AUTH_REQUIRED, INTERNAL_ERROR
}
