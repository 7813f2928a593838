package com.resumeForge.cvRenderer.output.service;

import com.resumeForge.cvRenderer.output.exception.DocumentConversionException;
import com.resumeForge.cvRenderer.output.model.TargetFormat;

import java.nio.file.Path;

/**
 * External collaborator turning a saved document into a fixed-layout rendering.
 */
public interface DocumentConverter {

    /**
     * Converts the document at {@code source}.
     *
     * @param source Existing, fully written document
     * @param format Target format
     * @return Path of the produced file, next to the source with the format's extension
     * @throws DocumentConversionException if conversion fails, times out or produces no file
     */
    Path convert(Path source, TargetFormat format);
}
