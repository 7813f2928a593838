package com.resumeForge.cvRenderer.render.util;

import com.resumeForge.cvRenderer.document.model.Alignment;
import com.resumeForge.cvRenderer.document.model.DocumentParagraph;
import com.resumeForge.cvRenderer.document.model.TabStop;
import com.resumeForge.cvRenderer.document.model.TextRun;
import com.resumeForge.cvRenderer.style.model.StyleName;
import com.resumeForge.cvRenderer.style.model.StyleRegistry;

/**
 * Factory for the paragraph shapes the section renderers share.
 */
public class Paragraphs {

    /**
     * Section title with a rule line beneath it.
     */
    public static DocumentParagraph heading(String text) {
        return DocumentParagraph.builder()
                .style(StyleName.HEADING)
                .bottomBorder(true)
                .run(TextRun.plain(text))
                .build();
    }

    public static DocumentParagraph centered(StyleName style, String text) {
        return DocumentParagraph.builder()
                .style(style)
                .alignment(Alignment.CENTER)
                .run(TextRun.plain(text))
                .build();
    }

    /**
     * Entry title on the left, dates pushed to the registry's right-aligned tab stop.
     * The stop position is the same for every entry, so date columns line up.
     */
    public static DocumentParagraph datedSubheading(String left, String dates, StyleRegistry styles) {
        return DocumentParagraph.builder()
                .style(StyleName.SUBHEADING)
                .tabStop(TabStop.right(styles.getDateTabStop()))
                .run(TextRun.plain(left))
                .run(TextRun.tab())
                .run(TextRun.plain(dates))
                .build();
    }

    public static DocumentParagraph subheading(String text) {
        return DocumentParagraph.builder()
                .style(StyleName.SUBHEADING)
                .run(TextRun.plain(text))
                .build();
    }

    public static DocumentParagraph body(String text) {
        return DocumentParagraph.builder()
                .style(StyleName.BODY)
                .run(TextRun.plain(text))
                .build();
    }

    public static DocumentParagraph boldBody(String text) {
        return DocumentParagraph.builder()
                .style(StyleName.BODY)
                .run(TextRun.bold(text))
                .build();
    }

    /**
     * Body line with a bold label prefix, e.g. "Languages: " followed by the value.
     */
    public static DocumentParagraph labelValue(String label, String value) {
        return DocumentParagraph.builder()
                .style(StyleName.BODY)
                .run(TextRun.bold(label))
                .run(TextRun.plain(value))
                .build();
    }

    public static DocumentParagraph bullet(String text) {
        return DocumentParagraph.builder()
                .style(StyleName.BULLET)
                .alignment(Alignment.JUSTIFY)
                .run(TextRun.plain(text))
                .build();
    }

    /**
     * Empty body paragraph separating sections.
     */
    public static DocumentParagraph spacer() {
        return DocumentParagraph.builder()
                .style(StyleName.BODY)
                .build();
    }
}
