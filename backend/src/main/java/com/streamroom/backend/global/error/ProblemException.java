package com.streamroom.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ErrorCode errorCode;
    private final String detail;

    public ProblemException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ProblemException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    public ProblemException(ErrorCode errorCode, String detail, Throwable cause) {
        super(requireCode(errorCode).getStatus(), errorCode.name(), cause);
        this.errorCode = errorCode;
        this.detail = (detail != null && !detail.isBlank()) ? detail : errorCode.getDefaultDetail();
    }

    private static ErrorCode requireCode(ErrorCode errorCode) {
        if (errorCode == null) {
            throw new IllegalArgumentException("ProblemException errorCode must not be null");
        }
        return errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.name();
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }

    public String getDetailMessage() {
        return detail;
    }
}
