package com.resumeForge.cvRenderer.schema.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A labelled group of skills, e.g. "Languages: Java, Go".
 */
@Value
@Builder
public class SkillCategory {

    String name;

    @Singular
    List<String> items;
}
