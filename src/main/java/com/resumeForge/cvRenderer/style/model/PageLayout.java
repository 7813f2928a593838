package com.resumeForge.cvRenderer.style.model;

import lombok.Builder;
import lombok.Value;

/**
 * Page size and margins, in points.
 */
@Value
@Builder
public class PageLayout {

    double width;

    double height;

    double topMargin;

    double bottomMargin;

    double leftMargin;

    double rightMargin;
}
