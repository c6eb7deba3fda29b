package com.claimsagent.infrastructure.document;

import java.nio.file.Path;

public class DocumentNotFoundException extends DocumentLoadException {

    public DocumentNotFoundException(Path path) {
        super("Document not found: " + path);
    }
}
