package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.ExperienceEntry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExperienceRenderer implements SectionRenderer<List<ExperienceEntry>> {

    public static final String TITLE = "Work Experience";

    @Override
    public void render(DocumentTree.Builder tree, List<ExperienceEntry> entries, RenderContext context) {
        tree.append(Paragraphs.heading(TITLE));

        for (ExperienceEntry entry : entries) {
            String employer = entry.getCompany() + ", " + entry.getLocation();
            tree.append(Paragraphs.datedSubheading(employer, entry.getDates(), context.getStyles()));
            tree.append(Paragraphs.boldBody(entry.getTitle()));
            entry.getBulletPoints().forEach(point -> tree.append(Paragraphs.bullet(point)));
        }
    }
}
