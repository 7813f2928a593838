package com.resumeForge.cvRenderer.schema.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProjectEntry {

    @Builder.Default
    String name = "";

    @Singular("tech")
    List<String> techStack;

    @Singular
    List<String> bulletPoints;
}
