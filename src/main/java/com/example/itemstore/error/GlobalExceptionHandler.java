package com.example.itemstore.error;

import com.example.itemstore.error.dto.ErrorResponse;
import com.example.itemstore.error.exception.BaseException;
import com.fasterxml.jackson.databind.JsonMappingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * NotFound and ValidationError raised by the store.
     */
    @ExceptionHandler(BaseException.class)
    protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
        log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
        return ErrorResponse.toResponseEntity(e);
    }

    /**
     * Bean Validation failures on a request body, e.g. a blank name.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    protected ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String reason = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        return invalidInput(reason);
    }

    /**
     * Bodies that are not JSON or carry a field of the wrong type.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    protected ResponseEntity<ErrorResponse> handleNotReadable(HttpMessageNotReadableException e) {
        String reason = "malformed request body";
        if (e.getCause() instanceof JsonMappingException) {
            JsonMappingException cause = (JsonMappingException) e.getCause();
            String field = cause.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining("."));
            if (!field.isEmpty()) {
                reason = field + " has an invalid type";
            }
        }
        return invalidInput(reason);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    protected ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return invalidInput(e.getName() + " must be an integer");
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    protected ResponseEntity<ErrorResponse> handleUnsupportedRequest(Exception e) {
        ItemErrorCode errorCode = ItemErrorCode.UNSUPPORTED_REQUEST;
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) e).getStatusCode();
        log.debug("Unsupported request: {}", e.getMessage());
        return ErrorResponse.toResponseEntity(
                status, errorCode.getCode(), String.format(errorCode.getMessage(), e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected System Failure: ", e);
        return ErrorResponse.toResponseEntity(ItemErrorCode.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> invalidInput(String reason) {
        ItemErrorCode errorCode = ItemErrorCode.INVALID_INPUT_VALUE;
        log.warn("Validation Exception: {} | Reason: {}", errorCode.getCode(), reason);
        return ErrorResponse.toResponseEntity(
                errorCode.getStatus(), errorCode.getCode(), String.format(errorCode.getMessage(), reason));
    }
}
