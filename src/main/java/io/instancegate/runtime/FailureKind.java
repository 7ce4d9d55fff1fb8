package io.instancegate.runtime;

public enum FailureKind {
    UNAUTHORIZED(401, "unauthorized"),
    CONFLICT(400, "conflict"),
    BAD_REQUEST(400, "bad_request"),
    STORAGE_FAILURE(500, "storage_failure");

    private final int httpStatus;
    private final String auditResult;

    FailureKind(int httpStatus, String auditResult) {
        this.httpStatus = httpStatus;
        this.auditResult = auditResult;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String auditResult() {
        return auditResult;
    }
}
