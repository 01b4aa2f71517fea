package com.avatarflow.pipeline.exception;

import lombok.Getter;

/**
 * Base of every error the pipeline raises on purpose. The error code decides the HTTP status
 * on the operational surface.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final ErrorCode errorCode;

    public PipelineException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public PipelineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
