package com.resumeForge.cvRenderer.style.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed catalogue of paragraph styles plus the layout constants shared by all sections.
 *
 * Instances are immutable. Renderers look styles up by {@link StyleName} and never
 * build formatting of their own, so the look of the document is decided here only.
 */
public final class StyleRegistry {

    public static final double POINTS_PER_INCH = 72.0;

    private static final String TYPEFACE = "Calibri";

    private static final StyleRegistry STANDARD = createStandard();

    private final Map<StyleName, StyleDefinition> styles;
    private final PageLayout pageLayout;
    private final double dateTabStop;
    private final RuleLine headingRule;

    private StyleRegistry(Map<StyleName, StyleDefinition> styles, PageLayout pageLayout,
                          double dateTabStop, RuleLine headingRule) {
        for (StyleName name : StyleName.values()) {
            if (!styles.containsKey(name)) {
                throw new IllegalArgumentException("Missing style definition: " + name);
            }
        }
        this.styles = Collections.unmodifiableMap(new EnumMap<>(styles));
        this.pageLayout = pageLayout;
        this.dateTabStop = dateTabStop;
        this.headingRule = headingRule;
    }

    /**
     * The catalogue used for every resume: Calibri, compact single spacing,
     * dates right-aligned six inches from the left margin.
     */
    public static StyleRegistry standard() {
        return STANDARD;
    }

    private static StyleRegistry createStandard() {
        Map<StyleName, StyleDefinition> styles = new EnumMap<>(StyleName.class);
        styles.put(StyleName.HEADING, StyleDefinition.builder()
                .typeface(TYPEFACE)
                .pointSize(12)
                .bold(true)
                .build());
        styles.put(StyleName.SUBHEADING, StyleDefinition.builder()
                .typeface(TYPEFACE)
                .pointSize(10)
                .bold(true)
                .build());
        styles.put(StyleName.BODY, StyleDefinition.builder()
                .typeface(TYPEFACE)
                .pointSize(10)
                .bold(false)
                .build());
        styles.put(StyleName.BULLET, StyleDefinition.builder()
                .typeface(TYPEFACE)
                .pointSize(9.5)
                .bold(false)
                .leftIndent(inches(0.3))
                .hangingIndent(inches(0.15))
                .justified(true)
                .build());

        PageLayout letter = PageLayout.builder()
                .width(inches(8.5))
                .height(inches(11))
                .topMargin(inches(0.75))
                .bottomMargin(inches(0.75))
                .leftMargin(inches(1.0))
                .rightMargin(inches(1.0))
                .build();

        return new StyleRegistry(styles, letter, inches(6.0), new RuleLine(6, 1));
    }

    public static double inches(double value) {
        return value * POINTS_PER_INCH;
    }

    public StyleDefinition get(StyleName name) {
        return styles.get(name);
    }

    public Map<StyleName, StyleDefinition> getStyles() {
        return styles;
    }

    public PageLayout getPageLayout() {
        return pageLayout;
    }

    /**
     * Position, in points from the left margin, of the right-aligned tab stop used for dates.
     */
    public double getDateTabStop() {
        return dateTabStop;
    }

    public RuleLine getHeadingRule() {
        return headingRule;
    }

    /**
     * Bottom border drawn under section headings.
     *
     * @param width Line width in eighths of a point
     * @param spacing Gap between text and line, in points
     */
    public record RuleLine(int width, int spacing) {}
}
