package com.resumeForge.cvRenderer.document.model;

import com.resumeForge.cvRenderer.style.model.StyleName;
import com.resumeForge.cvRenderer.style.model.StyleRegistry;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory document produced by one render pass.
 *
 * A tree is built through {@link #builder(StyleRegistry)}; once {@link Builder#build()}
 * has been called the builder refuses further appends and the tree itself is immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DocumentTree {

    private final StyleRegistry styles;
    private final String title;
    private final List<DocumentParagraph> paragraphs;

    private DocumentTree(StyleRegistry styles, String title, List<DocumentParagraph> paragraphs) {
        this.styles = styles;
        this.title = title;
        this.paragraphs = Collections.unmodifiableList(new ArrayList<>(paragraphs));
    }

    public static Builder builder(StyleRegistry styles) {
        return new Builder(styles);
    }

    /**
     * Text of every paragraph in the given style, in document order.
     */
    public List<String> textsInStyle(StyleName style) {
        return paragraphs.stream()
                .filter(paragraph -> paragraph.getStyle() == style && !paragraph.isBlank())
                .map(DocumentParagraph::getText)
                .toList();
    }

    /**
     * Titles of the section headings, i.e. paragraphs carrying a rule line.
     */
    public List<String> headings() {
        return paragraphs.stream()
                .filter(DocumentParagraph::isBottomBorder)
                .map(DocumentParagraph::getText)
                .toList();
    }

    /**
     * Append-only builder shared by the section renderers during one pass.
     */
    public static final class Builder {

        private final StyleRegistry styles;
        private final List<DocumentParagraph> paragraphs = new ArrayList<>();
        private String title = "";
        private boolean built;

        private Builder(StyleRegistry styles) {
            this.styles = styles;
        }

        public StyleRegistry styles() {
            return styles;
        }

        public Builder title(String title) {
            ensureOpen();
            this.title = title;
            return this;
        }

        public Builder append(DocumentParagraph paragraph) {
            ensureOpen();
            paragraphs.add(paragraph);
            return this;
        }

        public int size() {
            return paragraphs.size();
        }

        public DocumentTree build() {
            ensureOpen();
            built = true;
            return new DocumentTree(styles, title, paragraphs);
        }

        private void ensureOpen() {
            if (built) {
                throw new IllegalStateException("Document tree already built");
            }
        }
    }
}
