package com.claimsagent.application.claim.exception;

import java.nio.file.Path;

public class DocumentDirectoryNotFoundException extends RuntimeException {
    public DocumentDirectoryNotFoundException(Path directory) {
        super("Documents directory not found: " + directory);
    }
}
