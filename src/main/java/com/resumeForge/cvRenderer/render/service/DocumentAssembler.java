package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.ResumeRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the document tree for a validated resume.
 *
 * Section order is fixed:
 * IDENTITY -> EXPERIENCE -> EDUCATION -> SKILLS -> CERTIFICATIONS -> EXTRACURRICULARS -> PROJECTS
 *
 * Experience and Skills always get their heading. Education, Certifications,
 * Extracurriculars and Projects are left out entirely when they have no entries.
 * A blank spacer paragraph follows every section that was rendered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentAssembler {

    private final IdentityRenderer identityRenderer;
    private final ExperienceRenderer experienceRenderer;
    private final EducationRenderer educationRenderer;
    private final SkillsRenderer skillsRenderer;
    private final CertificationsRenderer certificationsRenderer;
    private final ExtracurricularsRenderer extracurricularsRenderer;
    private final ProjectsRenderer projectsRenderer;

    /**
     * Assembler wired with the standard section renderers.
     */
    public static DocumentAssembler standard() {
        return new DocumentAssembler(
                new IdentityRenderer(),
                new ExperienceRenderer(),
                new EducationRenderer(),
                new SkillsRenderer(),
                new CertificationsRenderer(),
                new ExtracurricularsRenderer(),
                new ProjectsRenderer());
    }

    /**
     * Renders every section of the record into a new document tree.
     *
     * @param record Validated resume
     * @param context Styles and options for this pass
     * @return Immutable document tree
     */
    public DocumentTree assemble(ResumeRecord record, RenderContext context) {
        String renderId = context.getRenderId();
        log.debug("Assembling document - renderId: {}", renderId);

        DocumentTree.Builder tree = DocumentTree.builder(context.getStyles())
                .title(record.getPersonalInfo().getName());

        renderSection(tree, "identity", record.getPersonalInfo(), identityRenderer, context);
        renderSection(tree, "experience", record.getExperience(), experienceRenderer, context);
        renderIfPresent(tree, "education", record.getEducation(), educationRenderer, context);
        renderSection(tree, "skills", record.getSkillCategories(), skillsRenderer, context);
        renderIfPresent(tree, "certifications", record.getCertifications(), certificationsRenderer, context);
        renderIfPresent(tree, "extracurriculars", record.getExtracurriculars(), extracurricularsRenderer, context);
        renderIfPresent(tree, "projects", record.getProjects(), projectsRenderer, context);

        DocumentTree document = tree.build();
        log.info("Document assembled - renderId: {}, paragraphs: {}, sections: {}",
                renderId, document.getParagraphs().size(), document.headings().size());
        return document;
    }

    private <S> void renderSection(DocumentTree.Builder tree, String section, S data,
                                   SectionRenderer<S> renderer, RenderContext context) {
        int before = tree.size();
        renderer.render(tree, data, context);
        tree.append(Paragraphs.spacer());
        log.debug("Rendered section {} - renderId: {}, paragraphs: {}",
                section, context.getRenderId(), tree.size() - before);
    }

    private <E> void renderIfPresent(DocumentTree.Builder tree, String section, List<E> entries,
                                     SectionRenderer<List<E>> renderer, RenderContext context) {
        if (entries.isEmpty()) {
            log.debug("Skipping empty section {} - renderId: {}", section, context.getRenderId());
            return;
        }
        renderSection(tree, section, entries, renderer, context);
    }
}
