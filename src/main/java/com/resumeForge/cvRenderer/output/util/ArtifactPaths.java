package com.resumeForge.cvRenderer.output.util;

import java.nio.file.Path;

/**
 * Naming rules for generated artifacts.
 */
public class ArtifactPaths {

    public static final String DOCUMENT_EXTENSION = "docx";

    private static final int SHORT_ID_LENGTH = 8;

    /**
     * Path next to the given file with the same base name and a different extension,
     * e.g. {@code out/resume.docx -> out/resume.pdf}.
     */
    public static Path withExtension(Path file, String extension) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return file.resolveSibling(baseName + "." + extension);
    }

    /**
     * File name for a generated resume, e.g. {@code resume_1a2b3c4d.docx} for id "1a2b3c4d-...".
     */
    public static String generatedFileName(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        String shortId = id.length() > SHORT_ID_LENGTH ? id.substring(0, SHORT_ID_LENGTH) : id;
        return "resume_" + shortId + "." + DOCUMENT_EXTENSION;
    }

    /**
     * Resolves a bare file name inside a base directory.
     *
     * @param directory Base directory
     * @param fileName File name without any directory part
     * @return Normalized path inside the directory
     * @throws IllegalArgumentException if the name is blank, contains a separator or "..",
     *         or would resolve outside the directory
     */
    public static Path resolveWithin(Path directory, String fileName) {
        if (fileName == null || fileName.isBlank()
                || fileName.contains("..") || fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("Invalid file name: " + fileName);
        }
        Path base = directory.toAbsolutePath().normalize();
        Path resolved = base.resolve(fileName).normalize();
        if (!resolved.getParent().equals(base)) {
            throw new IllegalArgumentException("File name escapes output directory: " + fileName);
        }
        return resolved;
    }
}
