package com.psl.orchestrator.backend;

public class BackendRequestException extends RuntimeException {
    public BackendRequestException(String message) {
        super(message);
    }

    public BackendRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
