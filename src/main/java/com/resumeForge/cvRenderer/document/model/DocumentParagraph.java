package com.resumeForge.cvRenderer.document.model;

import com.resumeForge.cvRenderer.style.model.StyleName;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One block of the document: a styled paragraph made of runs.
 * Formatting beyond alignment, tab stops and the heading rule comes from the named style.
 */
@Value
@Builder
public class DocumentParagraph {

    StyleName style;

    @Builder.Default
    Alignment alignment = Alignment.LEFT;

    /**
     * Full-width rule line under the paragraph, lowered to a paragraph bottom border.
     */
    boolean bottomBorder;

    @Singular
    List<TabStop> tabStops;

    @Singular
    List<TextRun> runs;

    /**
     * Concatenated run text, tabs included as {@code \t}.
     */
    public String getText() {
        return runs.stream().map(TextRun::getText).collect(Collectors.joining());
    }

    public boolean isBlank() {
        return runs.isEmpty();
    }
}
