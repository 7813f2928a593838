package com.resumeForge.cvRenderer.document.model;

import lombok.Value;

/**
 * Paragraph tab stop; position is in points from the left margin.
 */
@Value
public class TabStop {

    double position;

    Kind kind;

    public static TabStop right(double position) {
        return new TabStop(position, Kind.RIGHT);
    }

    public enum Kind {
        LEFT,
        RIGHT
    }
}
