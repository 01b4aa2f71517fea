package com.avatarflow.pipeline.exception;

public class InvalidRequestException extends PipelineException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
