package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.ExtracurricularEntry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExtracurricularsRenderer implements SectionRenderer<List<ExtracurricularEntry>> {

    public static final String TITLE = "Extracurricular Activities";

    @Override
    public void render(DocumentTree.Builder tree, List<ExtracurricularEntry> entries, RenderContext context) {
        tree.append(Paragraphs.heading(TITLE));

        for (ExtracurricularEntry entry : entries) {
            String role = entry.getOrganization() + " | " + entry.getPosition();
            tree.append(Paragraphs.datedSubheading(role, entry.getDates(), context.getStyles()));
            entry.getBulletPoints().forEach(point -> tree.append(Paragraphs.bullet(point)));
        }
    }
}
