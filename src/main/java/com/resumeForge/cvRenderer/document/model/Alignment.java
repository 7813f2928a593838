package com.resumeForge.cvRenderer.document.model;

public enum Alignment {
    LEFT,
    CENTER,
    JUSTIFY
}
