package com.avatarflow.pipeline.exception;

/**
 * A provider call failed in a way worth retrying: timeout, rate limit, 5xx.
 */
public class TransientProviderException extends PipelineException {

    public TransientProviderException(String message) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, message, cause);
    }
}
