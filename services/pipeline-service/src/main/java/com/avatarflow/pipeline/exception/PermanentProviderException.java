package com.avatarflow.pipeline.exception;

public class PermanentProviderException extends PipelineException {

    public PermanentProviderException(String message) {
        super(ErrorCode.PROVIDER_REJECTED, message);
    }

    public PermanentProviderException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_REJECTED, message, cause);
    }
}
