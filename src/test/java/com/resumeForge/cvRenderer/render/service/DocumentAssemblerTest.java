package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.Alignment;
import com.resumeForge.cvRenderer.document.model.DocumentParagraph;
import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.document.model.TabStop;
import com.resumeForge.cvRenderer.document.model.TextRun;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.model.RenderOptions;
import com.resumeForge.cvRenderer.schema.model.ResumeRecord;
import com.resumeForge.cvRenderer.schema.service.ResumeSchemaValidator;
import com.resumeForge.cvRenderer.style.model.StyleName;
import com.resumeForge.cvRenderer.style.model.StyleRegistry;
import com.resumeForge.cvRenderer.support.ResumeInputs;
import com.resumeForge.cvRenderer.util.StructuredTextLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentAssemblerTest {

    private final ResumeSchemaValidator validator = new ResumeSchemaValidator();
    private final DocumentAssembler assembler = DocumentAssembler.standard();

    private DocumentTree assemble(Map<String, Object> input) {
        return assemble(input, RenderOptions.defaults());
    }

    private DocumentTree assemble(Map<String, Object> input, RenderOptions options) {
        ResumeRecord record = validator.validate(input);
        return assembler.assemble(record, new RenderContext("test-render", StyleRegistry.standard(), options));
    }

    private static List<DocumentParagraph> nonBlank(DocumentTree tree) {
        return tree.getParagraphs().stream().filter(p -> !p.isBlank()).toList();
    }

    @Test
    @DisplayName("Minimal record renders identity, experience and an empty Skills section only")
    void assemble_minimalScenario() {
        DocumentTree tree = assemble(ResumeInputs.minimal());

        List<DocumentParagraph> paragraphs = nonBlank(tree);

        DocumentParagraph name = paragraphs.get(0);
        assertThat(name.getText()).isEqualTo("A B");
        assertThat(name.getStyle()).isEqualTo(StyleName.HEADING);
        assertThat(name.getAlignment()).isEqualTo(Alignment.CENTER);
        assertThat(name.isBottomBorder()).isFalse();

        assertThat(paragraphs)
                .filteredOn(p -> p.getText().equals("Email: a@b.com"))
                .singleElement()
                .satisfies(p -> assertThat(p.getAlignment()).isEqualTo(Alignment.CENTER));

        assertThat(tree.headings()).containsExactly("Work Experience", "Skills");

        DocumentParagraph subheading = paragraphs.stream()
                .filter(p -> p.getStyle() == StyleName.SUBHEADING)
                .findFirst()
                .orElseThrow();
        assertThat(subheading.getRuns()).containsExactly(
                TextRun.plain("X, Y"), TextRun.tab(), TextRun.plain("Jan 2020 - Present"));
        assertThat(subheading.getTabStops()).containsExactly(TabStop.right(StyleRegistry.standard().getDateTabStop()));

        int subheadingIndex = paragraphs.indexOf(subheading);
        assertThat(paragraphs.get(subheadingIndex + 1).getRuns()).containsExactly(TextRun.bold("Eng"));
        assertThat(paragraphs.get(subheadingIndex + 2).getStyle()).isEqualTo(StyleName.BULLET);
        assertThat(paragraphs.get(subheadingIndex + 2).getText()).isEqualTo("Did thing");

        DocumentParagraph last = paragraphs.get(paragraphs.size() - 1);
        assertThat(last.getText()).isEqualTo("Skills");
    }

    @Test
    void assemble_shouldBeDeterministic() throws Exception {
        Map<String, Object> input = StructuredTextLoader.loadResourceMapping("fixtures/sample-resume.yaml");

        DocumentTree first = assemble(input);
        DocumentTree second = assemble(input);

        assertThat(first).isEqualTo(second);
        assertThat(first.getParagraphs()).isEqualTo(second.getParagraphs());
    }

    @Test
    void assemble_shouldTitleDocumentWithName() {
        assertThat(assemble(ResumeInputs.minimal()).getTitle()).isEqualTo("A B");
    }

    @Nested
    class SectionSuppression {

        @Test
        void emptySections_shouldEmitNoHeadingOrBody() {
            DocumentTree tree = assemble(ResumeInputs.minimal());

            assertThat(tree.headings())
                    .doesNotContain(EducationRenderer.TITLE, CertificationsRenderer.TITLE,
                            ExtracurricularsRenderer.TITLE, ProjectsRenderer.TITLE);
            assertThat(tree.textsInStyle(StyleName.BULLET)).containsExactly("Did thing");
        }

        @Test
        void experienceAndSkills_shouldAlwaysEmitHeadings() {
            DocumentTree tree = assemble(new LinkedHashMap<>());

            assertThat(tree.headings()).containsExactly(ExperienceRenderer.TITLE, SkillsRenderer.TITLE);
        }

        @Test
        void populatedSections_shouldAppearInFixedOrder() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("projects", List.of(ResumeInputs.project("P", List.of())));
            input.put("education", List.of(ResumeInputs.education("U", "BSc", null, "2018")));
            input.put("certifications", List.of("AWS"));
            input.put("extracurriculars", List.of(ResumeInputs.extracurricular("Club", "Lead", "2019")));

            DocumentTree tree = assemble(input);

            assertThat(tree.headings()).containsExactly(
                    "Work Experience", "Education", "Skills", "Certifications",
                    "Extracurricular Activities", "Projects");
        }

        @Test
        void everyRenderedSection_shouldBeFollowedBySpacer() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("certifications", List.of("AWS"));

            DocumentTree tree = assemble(input);
            List<DocumentParagraph> paragraphs = tree.getParagraphs();

            long spacers = paragraphs.stream().filter(DocumentParagraph::isBlank).count();
            // identity, experience, skills, certifications
            assertThat(spacers).isEqualTo(4);
            assertThat(paragraphs.get(paragraphs.size() - 1).isBlank()).isTrue();
        }
    }

    @Nested
    class OrderPreservation {

        @Test
        void experience_shouldKeepEntryAndBulletOrder() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("experience", List.of(
                    ResumeInputs.experience("Zeta", "Z", "2015", "Z title", "z1", "z2"),
                    ResumeInputs.experience("Alpha", "A", "2023", "A title", "a2", "a1"),
                    ResumeInputs.experience("Mid", "M", "2019", "M title")));

            DocumentTree tree = assemble(input);

            assertThat(tree.textsInStyle(StyleName.SUBHEADING))
                    .containsExactly("Zeta, Z\t2015", "Alpha, A\t2023", "Mid, M\t2019");
            assertThat(tree.textsInStyle(StyleName.BULLET)).containsExactly("z1", "z2", "a2", "a1");
        }

        @Test
        void datedSubheadings_shouldShareOneTabStop() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("experience", List.of(
                    ResumeInputs.experience("A very long company name indeed", "Somewhere far away", "2020", "T"),
                    ResumeInputs.experience("B", "C", "2021", "T")));
            input.put("education", List.of(ResumeInputs.education("U", "D", null, "2018")));
            input.put("extracurriculars", List.of(ResumeInputs.extracurricular("Org", "Pos", "2017")));

            DocumentTree tree = assemble(input);

            assertThat(tree.getParagraphs())
                    .filteredOn(p -> !p.getTabStops().isEmpty())
                    .hasSize(4)
                    .extracting(DocumentParagraph::getTabStops)
                    .containsOnly(List.of(TabStop.right(432.0)));
        }
    }

    @Nested
    class Identity {

        @Test
        void missingLinkedin_shouldProduceNoLinkedinLine() {
            DocumentTree tree = assemble(ResumeInputs.minimal());

            assertThat(tree.textsInStyle(StyleName.BODY)).noneMatch(text -> text.startsWith("LinkedIn:"));
        }

        @Test
        void optionalFields_shouldEachProduceExactlyOneLine() {
            Map<String, Object> input = ResumeInputs.minimal();
            @SuppressWarnings("unchecked")
            Map<String, Object> info = (Map<String, Object>) input.get("personal_info");
            info.put("linkedin", "linkedin.com/in/ab");
            info.put("github", "github.com/ab");
            info.put("visa_status", "Work permit");

            DocumentTree tree = assemble(input);

            assertThat(tree.textsInStyle(StyleName.BODY))
                    .containsOnlyOnce("LinkedIn: linkedin.com/in/ab", "GitHub: github.com/ab", "Work permit");
        }

        @Test
        void identityLines_shouldAllBeCentered() {
            Map<String, Object> input = ResumeInputs.minimal();
            @SuppressWarnings("unchecked")
            Map<String, Object> info = (Map<String, Object>) input.get("personal_info");
            info.put("phone", "555");

            DocumentTree tree = assemble(input);

            assertThat(tree.getParagraphs().subList(0, 3))
                    .extracting(DocumentParagraph::getAlignment)
                    .containsOnly(Alignment.CENTER);
            assertThat(tree.getParagraphs().get(1).getText()).isEqualTo("555");
        }
    }

    @Nested
    class Sections {

        @Test
        void skills_shouldPrintBoldLabelAndJoinedItems() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("skills", Map.of("categories", List.of(
                    ResumeInputs.category("Languages", "Java", "Go"),
                    ResumeInputs.category("Empty"))));

            DocumentTree tree = assemble(input);

            List<DocumentParagraph> lines = tree.getParagraphs().stream()
                    .filter(p -> !p.getRuns().isEmpty() && p.getRuns().get(0).isBold()
                            && p.getRuns().get(0).getText().endsWith(": "))
                    .toList();
            assertThat(lines).hasSize(2);
            assertThat(lines.get(0).getRuns()).containsExactly(TextRun.bold("Languages: "), TextRun.plain("Java, Go"));
            assertThat(lines.get(1).getRuns()).containsExactly(TextRun.bold("Empty: "), TextRun.plain(""));
        }

        @Test
        void extraSkills_shouldFollowCategoriesAsBullets() {
            RenderOptions options = RenderOptions.builder().extraSkill("Terraform").extraSkill("dbt").build();

            DocumentTree tree = assemble(ResumeInputs.minimal(), options);

            assertThat(tree.textsInStyle(StyleName.BODY)).contains(SkillsRenderer.ADDITIONAL_SKILLS_LABEL);
            assertThat(tree.textsInStyle(StyleName.BULLET)).containsExactly("Did thing", "Terraform", "dbt");
        }

        @Test
        void education_shouldAddCgpaLineOnlyWhenPresent() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("education", List.of(
                    ResumeInputs.education("Uni A", "BSc", "3.9", "2018"),
                    ResumeInputs.education("Uni B", "MSc", null, "2020")));

            DocumentTree tree = assemble(input);

            assertThat(tree.textsInStyle(StyleName.SUBHEADING))
                    .contains("Uni A | BSc\t2018", "Uni B | MSc\t2020");
            assertThat(tree.textsInStyle(StyleName.BODY)).containsOnlyOnce("CGPA: 3.9");
        }

        @Test
        void certifications_shouldRenderAsFlatBullets() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("certifications", List.of("AWS SAA", "CKA"));

            DocumentTree tree = assemble(input);

            assertThat(tree.textsInStyle(StyleName.BULLET)).containsExactly("Did thing", "AWS SAA", "CKA");
        }

        @Test
        void extracurriculars_shouldPairOrganizationAndPosition() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("extracurriculars", List.of(ResumeInputs.extracurricular("Chess Club", "President", "2016", "Ran events")));

            DocumentTree tree = assemble(input);

            assertThat(tree.textsInStyle(StyleName.SUBHEADING)).contains("Chess Club | President\t2016");
            assertThat(tree.textsInStyle(StyleName.BULLET)).endsWith("Ran events");
        }

        @Test
        void projects_shouldPrintTechStackOnlyWhenGiven() {
            Map<String, Object> input = ResumeInputs.minimal();
            input.put("projects", List.of(
                    ResumeInputs.project("Compiler", List.of("Java", "ANTLR"), "Parsed things"),
                    ResumeInputs.project("Site", List.of())));

            DocumentTree tree = assemble(input);

            assertThat(tree.textsInStyle(StyleName.SUBHEADING)).contains("Compiler", "Site");
            assertThat(tree.textsInStyle(StyleName.BODY)).containsOnlyOnce("Tech Stack: Java, ANTLR");
            assertThat(tree.textsInStyle(StyleName.BODY)).noneMatch(text -> text.equals("Tech Stack: "));
        }

        @Test
        void bullets_shouldBeJustified() {
            DocumentTree tree = assemble(ResumeInputs.minimal());

            assertThat(tree.getParagraphs())
                    .filteredOn(p -> p.getStyle() == StyleName.BULLET)
                    .extracting(DocumentParagraph::getAlignment)
                    .containsOnly(Alignment.JUSTIFY);
        }
    }
}
