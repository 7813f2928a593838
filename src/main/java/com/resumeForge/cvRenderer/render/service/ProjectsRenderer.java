package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.ProjectEntry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ProjectsRenderer implements SectionRenderer<List<ProjectEntry>> {

    public static final String TITLE = "Projects";

    @Override
    public void render(DocumentTree.Builder tree, List<ProjectEntry> projects, RenderContext context) {
        tree.append(Paragraphs.heading(TITLE));

        for (ProjectEntry project : projects) {
            tree.append(Paragraphs.subheading(project.getName()));
            if (!project.getTechStack().isEmpty()) {
                tree.append(Paragraphs.body("Tech Stack: " + String.join(", ", project.getTechStack())));
            }
            project.getBulletPoints().forEach(point -> tree.append(Paragraphs.bullet(point)));
        }
    }
}
