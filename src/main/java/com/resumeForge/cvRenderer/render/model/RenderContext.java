package com.resumeForge.cvRenderer.render.model;

import com.resumeForge.cvRenderer.style.model.StyleRegistry;
import lombok.Value;

/**
 * Read-only settings threaded through every section renderer of one pass.
 */
@Value
public class RenderContext {

    String renderId;

    StyleRegistry styles;

    RenderOptions options;
}
