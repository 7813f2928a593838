package com.resumeForge.cvRenderer.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one render pass.
 *
 * The document path is always valid. A failed conversion leaves {@code convertedPath}
 * empty and explains itself in {@code conversionError}.
 */
@Value
@Builder
public class RenderResult {

    String renderId;

    Path documentPath;

    Path convertedPath;

    String conversionError;

    public Optional<Path> getConvertedPath() {
        return Optional.ofNullable(convertedPath);
    }

    public Optional<String> getConversionError() {
        return Optional.ofNullable(conversionError);
    }

    public boolean isConversionFailed() {
        return conversionError != null;
    }
}
