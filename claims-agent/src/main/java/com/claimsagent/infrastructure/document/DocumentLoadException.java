package com.claimsagent.infrastructure.document;

public class DocumentLoadException extends RuntimeException {

    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
