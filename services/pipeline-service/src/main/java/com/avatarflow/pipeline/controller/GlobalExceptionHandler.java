package com.avatarflow.pipeline.controller;

import com.avatarflow.pipeline.dto.ApiErrorResponse;
import com.avatarflow.pipeline.exception.ErrorCode;
import com.avatarflow.pipeline.exception.PipelineException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.OffsetDateTime;

/**
 * Maps pipeline errors to a uniform JSON body with the status of their {@link ErrorCode}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ApiErrorResponse> handlePipelineException(PipelineException e, HttpServletRequest request) {
        ErrorCode code = e.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.error("{} {} failed [{}]: {}", request.getMethod(), request.getRequestURI(), code.getCode(), e.getMessage(), e);
        } else {
            log.warn("{} {} rejected [{}]: {}", request.getMethod(), request.getRequestURI(), code.getCode(), e.getMessage());
        }
        return build(code, e.getMessage(), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorResponse> handleBadInput(Exception e, HttpServletRequest request) {
        log.warn("{} {} unreadable request: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return build(ErrorCode.INVALID_REQUEST, "Malformed request: " + e.getMessage(), request);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException e, HttpServletRequest request) {
        log.error("{} {} failed unexpectedly: {}", request.getMethod(), request.getRequestURI(), e.getMessage(), e);
        return build(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage(), request);
    }

    private static ResponseEntity<ApiErrorResponse> build(ErrorCode code, String message, HttpServletRequest request) {
        return ResponseEntity.status(code.getStatus())
                .body(ApiErrorResponse.builder()
                        .status(code.getStatus().value())
                        .code(code.getCode())
                        .error(code.name())
                        .message(message)
                        .path(request.getRequestURI())
                        .timestamp(OffsetDateTime.now())
                        .build());
    }
}
