package com.itms.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Status exception carrying a stable machine-readable code, rendered as a {@link ProblemResponse}.
 */
public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:itms:";

    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, String typeOverride) {
        this(status, code, detail, typeOverride, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, String typeOverride, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        if (typeOverride != null && !typeOverride.isBlank()) {
            this.type = typeOverride;
        } else {
            this.type = DEFAULT_TYPE_PREFIX + code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        }
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
