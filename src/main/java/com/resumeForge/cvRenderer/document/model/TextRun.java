package com.resumeForge.cvRenderer.document.model;

import lombok.Value;

/**
 * A span of text with uniform character formatting, or a tab character.
 */
@Value
public class TextRun {

    String text;

    boolean bold;

    boolean tab;

    public static TextRun plain(String text) {
        return new TextRun(text, false, false);
    }

    public static TextRun bold(String text) {
        return new TextRun(text, true, false);
    }

    public static TextRun tab() {
        return new TextRun("\t", false, true);
    }
}
