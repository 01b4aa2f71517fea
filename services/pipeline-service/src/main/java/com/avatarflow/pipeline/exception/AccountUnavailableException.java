package com.avatarflow.pipeline.exception;

public class AccountUnavailableException extends PipelineException {

    public AccountUnavailableException(String message) {
        super(ErrorCode.ACCOUNT_UNAVAILABLE, message);
    }
}
