package com.resumeForge.cvRenderer.schema.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ExtracurricularEntry {

    @Builder.Default
    String organization = "";

    @Builder.Default
    String position = "";

    @Builder.Default
    String dates = "";

    @Singular
    List<String> bulletPoints;
}
