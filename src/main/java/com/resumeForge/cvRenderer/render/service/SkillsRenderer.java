package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.SkillCategory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One "Label: a, b, c" line per category, followed by any additional skills from the render options.
 * A category without items still prints its label.
 */
@Component
public class SkillsRenderer implements SectionRenderer<List<SkillCategory>> {

    public static final String TITLE = "Skills";
    public static final String ITEM_SEPARATOR = ", ";
    public static final String ADDITIONAL_SKILLS_LABEL = "Additional Relevant Skills:";

    @Override
    public void render(DocumentTree.Builder tree, List<SkillCategory> categories, RenderContext context) {
        tree.append(Paragraphs.heading(TITLE));

        for (SkillCategory category : categories) {
            tree.append(Paragraphs.labelValue(
                    category.getName() + ": ",
                    String.join(ITEM_SEPARATOR, category.getItems())));
        }

        List<String> extraSkills = context.getOptions().getExtraSkills();
        if (!extraSkills.isEmpty()) {
            tree.append(Paragraphs.body(ADDITIONAL_SKILLS_LABEL));
            extraSkills.forEach(skill -> tree.append(Paragraphs.bullet(skill)));
        }
    }
}
