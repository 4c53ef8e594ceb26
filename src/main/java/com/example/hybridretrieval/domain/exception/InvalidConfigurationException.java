package com.example.hybridretrieval.domain.exception;

/**
 * Invalid chunking or retrieval parameters. Fatal to the calling operation, never retried.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
