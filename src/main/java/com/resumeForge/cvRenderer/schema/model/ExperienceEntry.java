package com.resumeForge.cvRenderer.schema.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One position held, in the order the source listed it.
 */
@Value
@Builder
public class ExperienceEntry {

    @Builder.Default
    String company = "";

    @Builder.Default
    String location = "";

    @Builder.Default
    String dates = "";

    @Builder.Default
    String title = "";

    @Singular
    List<String> bulletPoints;
}
