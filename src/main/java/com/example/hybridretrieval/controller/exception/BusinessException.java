package com.example.hybridretrieval.controller.exception;

import org.springframework.http.HttpStatus;

public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final HttpStatus status;

    public BusinessException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public BusinessException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static BusinessException badRequest(String msg) {
        return new BusinessException(HttpStatus.BAD_REQUEST, msg);
    }

    public static BusinessException notFound(String msg) {
        return new BusinessException(HttpStatus.NOT_FOUND, msg);
    }

    public HttpStatus getStatus() {
        return status;
    }
}
