package com.resumeForge.cvRenderer.render.model;

import com.resumeForge.cvRenderer.output.model.TargetFormat;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Per-request rendering settings, built once by the caller and passed down explicitly.
 */
@Value
@Builder
public class RenderOptions {

    /**
     * Skills to list under "Additional Relevant Skills" at the end of the Skills section.
     */
    @Singular
    List<String> extraSkills;

    /**
     * Fixed-layout format to convert the document to after saving; null means no conversion.
     */
    TargetFormat conversionFormat;

    public Optional<TargetFormat> getConversionFormat() {
        return Optional.ofNullable(conversionFormat);
    }

    public static RenderOptions defaults() {
        return RenderOptions.builder().build();
    }
}
