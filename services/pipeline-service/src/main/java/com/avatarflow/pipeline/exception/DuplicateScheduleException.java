package com.avatarflow.pipeline.exception;

public class DuplicateScheduleException extends PipelineException {

    public DuplicateScheduleException(String message) {
        super(ErrorCode.DUPLICATE_SCHEDULE, message);
    }
}
