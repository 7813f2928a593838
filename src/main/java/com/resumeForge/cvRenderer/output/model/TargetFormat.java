package com.resumeForge.cvRenderer.output.model;

/**
 * Fixed-layout formats the external converter can produce.
 */
public enum TargetFormat {

    PDF("pdf");

    private final String extension;

    TargetFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
