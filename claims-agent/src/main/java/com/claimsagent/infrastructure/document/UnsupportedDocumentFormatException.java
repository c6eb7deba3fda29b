package com.claimsagent.infrastructure.document;

import java.nio.file.Path;

public class UnsupportedDocumentFormatException extends DocumentLoadException {

    public UnsupportedDocumentFormatException(Path path) {
        super("Unsupported document format: " + path.getFileName() + " (expected .txt or .pdf)");
    }
}
