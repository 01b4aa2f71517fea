package com.avatarflow.pipeline.exception;

public class StorageConflictException extends PipelineException {

    public StorageConflictException(String message) {
        super(ErrorCode.STORAGE_CONFLICT, message);
    }
}
