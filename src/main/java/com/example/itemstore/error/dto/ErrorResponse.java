package com.example.itemstore.error.dto;

import com.example.itemstore.error.ErrorCode;
import com.example.itemstore.error.exception.BaseException;
import lombok.Builder;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;

/**
 * Error body. {@code detail} carries the human readable reason.
 */
public record ErrorResponse(int status, String code, String detail, LocalDateTime timestamp) {

    @Builder
    public ErrorResponse {}

    /**
     * Business exceptions keep their formatted message, e.g. which field failed validation.
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
        return toResponseEntity(e.getErrorCode().getStatus(), e.getErrorCode().getCode(), e.getMessage());
    }

    /**
     * Uses the code's fixed message; for unexpected failures nothing internal leaks out.
     */
    public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
        return toResponseEntity(errorCode.getStatus(), errorCode.getCode(), errorCode.getMessage());
    }

    public static ResponseEntity<ErrorResponse> toResponseEntity(HttpStatusCode status, String code, String detail) {
        return ResponseEntity
                .status(status)
                .body(ErrorResponse.builder()
                        .status(status.value())
                        .code(code)
                        .detail(detail)
                        .timestamp(LocalDateTime.now())
                        .build());
    }
}
