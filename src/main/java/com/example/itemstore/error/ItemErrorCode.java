package com.example.itemstore.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ItemErrorCode implements ErrorCode {
    // === Client Errors (4xx) ===
    ITEM_NOT_FOUND("I001", "Item not found", HttpStatus.NOT_FOUND),
    INVALID_INPUT_VALUE("I002", "Invalid input: %s", HttpStatus.UNPROCESSABLE_ENTITY),
    // status is taken from the framework exception (404, 405, 415), not from this entry
    UNSUPPORTED_REQUEST("I003", "Unsupported request: %s", HttpStatus.BAD_REQUEST),

    // === Server Errors (5xx) ===
    INTERNAL_SERVER_ERROR("S001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus status;
}
