package com.resumeForge.cvRenderer.style.model;

import lombok.Builder;
import lombok.Value;

/**
 * Typography and spacing of one named paragraph style.
 * Lengths are in points; line spacing is a multiple of single spacing.
 */
@Value
@Builder
public class StyleDefinition {

    String typeface;

    double pointSize;

    boolean bold;

    @Builder.Default
    double spaceBefore = 0;

    @Builder.Default
    double spaceAfter = 0;

    @Builder.Default
    double lineSpacing = 1.0;

    @Builder.Default
    double leftIndent = 0;

    /**
     * Distance the first line is pulled back to the left of {@link #leftIndent}.
     * A positive value produces a hanging first line.
     */
    @Builder.Default
    double hangingIndent = 0;

    /**
     * Whether paragraphs in this style are justified by default.
     */
    @Builder.Default
    boolean justified = false;
}
