package com.resumeForge.cvRenderer.pipeline.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating render IDs.
 *
 * A render ID scopes exactly one call to {@link ResumeRenderingService#render}: it is stamped on
 * every log line of that pass and returned on the {@code RenderResult}, so a caller can match a
 * result to its log trail. IDs are never reused across passes and carry nothing from the resume.
 */
@Service
public class RenderIdService {

    /**
     * Generates a unique render ID.
     *
     * @return A UUID-based render ID
     */
    public String generateRenderId() {
        return UUID.randomUUID().toString();
    }
}
