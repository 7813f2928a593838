package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;

/**
 * Appends one resume section to the document being built.
 * Implementations only append; they never read other sections or edit earlier paragraphs.
 *
 * @param <S> Section data type
 */
public interface SectionRenderer<S> {

    void render(DocumentTree.Builder tree, S section, RenderContext context);
}
