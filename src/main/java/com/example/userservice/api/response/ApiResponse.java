package com.example.userservice.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private int statusCode;
    private String code;
    private String message;
    private T data;
    private String traceId;

    public static <T> ApiResponse<T> success(HttpStatus status, T data) {
        return new ApiResponse<>(status.value(), null, "OK", data, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(HttpStatus status, String code, String message) {
        return new ApiResponse<>(status.value(), code, message, null, currentTraceId());
    }

    private static String currentTraceId() {
        return MDC.get("requestId");
    }
}
