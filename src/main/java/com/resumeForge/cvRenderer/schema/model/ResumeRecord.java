package com.resumeForge.cvRenderer.schema.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Canonical, validated resume consumed by the rendering engine.
 *
 * Every section is an immutable list in source order. An empty list means the
 * section was omitted or supplied empty; the two cases are not distinguished.
 */
@Value
@Builder
public class ResumeRecord {

    @Builder.Default
    PersonalInfo personalInfo = PersonalInfo.empty();

    @Singular("experienceEntry")
    List<ExperienceEntry> experience;

    @Singular("educationEntry")
    List<EducationEntry> education;

    @Singular
    List<SkillCategory> skillCategories;

    @Singular
    List<String> certifications;

    @Singular
    List<ExtracurricularEntry> extracurriculars;

    @Singular
    List<ProjectEntry> projects;
}
