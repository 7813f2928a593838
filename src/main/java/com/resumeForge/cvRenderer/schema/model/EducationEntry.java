package com.resumeForge.cvRenderer.schema.model;

import com.resumeForge.cvRenderer.schema.util.TextValues;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder
public class EducationEntry {

    @Builder.Default
    String institution = "";

    @Builder.Default
    String degree = "";

    String cgpa;

    @Builder.Default
    String dates = "";

    public Optional<String> getCgpa() {
        return TextValues.present(cgpa);
    }
}
