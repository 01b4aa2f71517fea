package com.avatarflow.pipeline.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "P000", "Internal pipeline error"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "P001", "Invalid request"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "P002", "Resource not found"),

    // Generation
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "G001", "Generation provider temporarily unavailable"),
    PROVIDER_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, "G002", "Generation provider rejected the request"),

    // Distribution
    DUPLICATE_SCHEDULE(HttpStatus.CONFLICT, "D001", "Artifact already has an active post on this platform"),
    ACCOUNT_UNAVAILABLE(HttpStatus.CONFLICT, "D002", "Platform account is suspended"),

    // Storage
    STORAGE_CONFLICT(HttpStatus.CONFLICT, "S001", "Concurrent modification detected");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
