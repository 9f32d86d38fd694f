package com.flexboard.agent.error;

/**
 * Error kinds surfaced in {@code QueryResult.errorCode}.
 */
public enum ErrorKind {
    VALIDATION("VALIDATION_FAILED", 400),
    CAPACITY("CAPACITY_EXHAUSTED", 503),
    TRANSIENT_BACKEND("BACKEND_UNAVAILABLE", 502),
    PERMANENT_BACKEND("BACKEND_ERROR", 422),
    TIMEOUT("TIMEOUT", 504);

    private final String code;
    private final int httpStatus;

    ErrorKind(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    /**
     * Status an upstream HTTP handler should answer with for this kind.
     *
     * @return http status code
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Resolve a kind from its wire code.
     *
     * @param code error code
     * @return matching kind, or {@link #PERMANENT_BACKEND} for unknown codes
     */
    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        return PERMANENT_BACKEND;
    }
}
