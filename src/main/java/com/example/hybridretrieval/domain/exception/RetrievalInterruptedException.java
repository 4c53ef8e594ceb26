package com.example.hybridretrieval.domain.exception;

public class RetrievalInterruptedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RetrievalInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
