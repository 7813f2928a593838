package com.resumeForge.cvRenderer.output.exception;

import com.resumeForge.cvRenderer.output.model.TargetFormat;

import java.nio.file.Path;

/**
 * Exception thrown when the fixed-layout conversion of a saved document fails or times out.
 */
public class DocumentConversionException extends RuntimeException {

    private final Path source;
    private final TargetFormat format;

    public DocumentConversionException(Path source, TargetFormat format, String message) {
        super(describe(source, format, message));
        this.source = source;
        this.format = format;
    }

    public DocumentConversionException(Path source, TargetFormat format, String message, Throwable cause) {
        super(describe(source, format, message), cause);
        this.source = source;
        this.format = format;
    }

    private static String describe(Path source, TargetFormat format, String message) {
        return "Failed to convert " + source + " to " + format + ": " + message;
    }

    public Path getSource() {
        return source;
    }

    public TargetFormat getFormat() {
        return format;
    }
}
