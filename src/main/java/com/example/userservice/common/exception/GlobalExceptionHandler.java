package com.example.userservice.common.exception;

import com.example.userservice.api.response.ApiResponse;
import com.example.userservice.common.logging.AccessLogFilter;
import com.example.userservice.domain.error.UserDomainError;
import com.example.userservice.domain.error.UserDomainException;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String REQUEST_INVALID = "REQUEST_INVALID";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(UserDomainException.class)
    public ResponseEntity<ApiResponse<Void>> handleUserDomainException(UserDomainException e) {
        HttpStatus status = statusOf(e.getError());
        if (status.is5xxServerError()) {
            log.error("User operation failed, code={}", e.getCode(), e);
            return respond(status, e.getCode(), "Internal server error");
        }
        return respond(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiResponse<Void>> handleValidationException(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, REQUEST_INVALID, "Request parameters are invalid");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, REQUEST_INVALID, "Request body is malformed");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, REQUEST_INVALID, "Request body must be JSON");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, REQUEST_INVALID, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Internal server error");
    }

    static HttpStatus statusOf(UserDomainError error) {
        switch (error) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case STORE_FAILURE:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String code, String message) {
        MDC.put(AccessLogFilter.MDC_ERROR_CODE, code);
        return ResponseEntity.status(status).body(ApiResponse.fail(status, code, message));
    }
}
