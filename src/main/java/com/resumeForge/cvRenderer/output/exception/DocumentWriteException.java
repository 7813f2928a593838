package com.resumeForge.cvRenderer.output.exception;

import java.nio.file.Path;

/**
 * Exception thrown when the document cannot be written to its destination.
 * No partial file is left at the destination when this is thrown.
 */
public class DocumentWriteException extends RuntimeException {

    private final Path destination;

    public DocumentWriteException(Path destination, String message, Throwable cause) {
        super("Failed to write document to " + destination + ": " + message, cause);
        this.destination = destination;
    }

    public Path getDestination() {
        return destination;
    }
}
