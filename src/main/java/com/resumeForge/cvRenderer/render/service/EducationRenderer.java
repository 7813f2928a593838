package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.EducationEntry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EducationRenderer implements SectionRenderer<List<EducationEntry>> {

    public static final String TITLE = "Education";

    @Override
    public void render(DocumentTree.Builder tree, List<EducationEntry> entries, RenderContext context) {
        tree.append(Paragraphs.heading(TITLE));

        for (EducationEntry entry : entries) {
            String program = entry.getInstitution() + " | " + entry.getDegree();
            tree.append(Paragraphs.datedSubheading(program, entry.getDates(), context.getStyles()));
            entry.getCgpa().ifPresent(cgpa -> tree.append(Paragraphs.body("CGPA: " + cgpa)));
        }
    }
}
