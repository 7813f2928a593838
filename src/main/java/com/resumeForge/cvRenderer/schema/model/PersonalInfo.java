package com.resumeForge.cvRenderer.schema.model;

import com.resumeForge.cvRenderer.schema.util.TextValues;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Identity and contact details shown at the top of the document.
 */
@Value
@Builder
public class PersonalInfo {

    @Builder.Default
    String name = "";

    @Builder.Default
    String phone = "";

    @Builder.Default
    String email = "";

    /**
     * Carried for completeness; the identity block does not print it.
     */
    @Builder.Default
    String location = "";

    String linkedin;

    String github;

    String visaStatus;

    public Optional<String> getLinkedin() {
        return TextValues.present(linkedin);
    }

    public Optional<String> getGithub() {
        return TextValues.present(github);
    }

    public Optional<String> getVisaStatus() {
        return TextValues.present(visaStatus);
    }

    public static PersonalInfo empty() {
        return PersonalInfo.builder().build();
    }
}
