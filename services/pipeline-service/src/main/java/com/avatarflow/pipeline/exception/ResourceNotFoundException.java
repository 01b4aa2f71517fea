package com.avatarflow.pipeline.exception;

public class ResourceNotFoundException extends PipelineException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static ResourceNotFoundException of(String kind, Object id) {
        return new ResourceNotFoundException(kind + " not found: " + id);
    }
}
