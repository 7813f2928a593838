package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CertificationsRenderer implements SectionRenderer<List<String>> {

    public static final String TITLE = "Certifications";

    @Override
    public void render(DocumentTree.Builder tree, List<String> certifications, RenderContext context) {
        tree.append(Paragraphs.heading(TITLE));
        certifications.forEach(certification -> tree.append(Paragraphs.bullet(certification)));
    }
}
