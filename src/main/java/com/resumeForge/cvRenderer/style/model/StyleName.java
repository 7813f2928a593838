package com.resumeForge.cvRenderer.style.model;

/**
 * The four paragraph styles every renderer refers to.
 * Each carries the style id and display name it is registered under in the output document.
 */
public enum StyleName {

    HEADING("ResumeHeading", "Resume Heading"),
    SUBHEADING("ResumeSubheading", "Resume Subheading"),
    BODY("ResumeBody", "Resume Body"),
    BULLET("ResumeBullet", "Resume Bullet");

    private final String styleId;
    private final String displayName;

    StyleName(String styleId, String displayName) {
        this.styleId = styleId;
        this.displayName = displayName;
    }

    public String getStyleId() {
        return styleId;
    }

    public String getDisplayName() {
        return displayName;
    }
}
