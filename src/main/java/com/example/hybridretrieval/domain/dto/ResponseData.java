package com.example.hybridretrieval.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Envelope of every successful REST response.
 */
@Builder
@Getter
public class ResponseData<T> {
    private int status;
    private String message;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private T data;

    public static <T> ResponseData<T> ok(String message, T data) {
        return of(HttpStatus.OK, message, data);
    }

    public static <T> ResponseData<T> of(HttpStatus status, String message, T data) {
        return ResponseData.<T>builder()
                .status(status.value())
                .message(message)
                .data(data)
                .build();
    }
}
