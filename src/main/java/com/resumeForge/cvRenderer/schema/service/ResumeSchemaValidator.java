package com.resumeForge.cvRenderer.schema.service;

import com.resumeForge.cvRenderer.schema.exception.SchemaValidationException;
import com.resumeForge.cvRenderer.schema.model.EducationEntry;
import com.resumeForge.cvRenderer.schema.model.ExperienceEntry;
import com.resumeForge.cvRenderer.schema.model.ExtracurricularEntry;
import com.resumeForge.cvRenderer.schema.model.PersonalInfo;
import com.resumeForge.cvRenderer.schema.model.ProjectEntry;
import com.resumeForge.cvRenderer.schema.model.ResumeRecord;
import com.resumeForge.cvRenderer.schema.model.SkillCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Validates externally supplied resume data and converts it into a typed {@link ResumeRecord}.
 *
 * Rules:
 * - Missing or null top-level keys become empty sections (an empty personal block for personal_info)
 * - A value of the wrong shape anywhere is a {@link SchemaValidationException} naming the field path
 * - Text fields accept strings, numbers and booleans; mappings or sequences in their place are rejected
 * - Unknown keys are ignored
 *
 * Validation is all-or-nothing: either a complete record is returned or an exception is thrown.
 */
@Slf4j
@Service
public class ResumeSchemaValidator {

    static final String PERSONAL_INFO = "personal_info";
    static final String EXPERIENCE = "experience";
    static final String EDUCATION = "education";
    static final String SKILLS = "skills";
    static final String CERTIFICATIONS = "certifications";
    static final String EXTRACURRICULARS = "extracurriculars";
    static final String PROJECTS = "projects";

    /**
     * Validates a generic structured value.
     *
     * @param input Parsed input, expected to be a mapping with string keys
     * @return Fully typed resume record
     * @throws SchemaValidationException if any part of the input has the wrong shape
     */
    public ResumeRecord validate(Object input) {
        Map<String, Object> root = asMapping(input, "$");

        ResumeRecord record = ResumeRecord.builder()
                .personalInfo(readPersonalInfo(root.get(PERSONAL_INFO)))
                .experience(readSequence(root.get(EXPERIENCE), EXPERIENCE, this::readExperienceEntry))
                .education(readSequence(root.get(EDUCATION), EDUCATION, this::readEducationEntry))
                .skillCategories(readSkills(root.get(SKILLS)))
                .certifications(readTextSequence(root.get(CERTIFICATIONS), CERTIFICATIONS))
                .extracurriculars(readSequence(root.get(EXTRACURRICULARS), EXTRACURRICULARS, this::readExtracurricularEntry))
                .projects(readSequence(root.get(PROJECTS), PROJECTS, this::readProjectEntry))
                .build();

        log.debug("Resume record validated - experience: {}, education: {}, skillCategories: {}, certifications: {}, extracurriculars: {}, projects: {}",
                record.getExperience().size(),
                record.getEducation().size(),
                record.getSkillCategories().size(),
                record.getCertifications().size(),
                record.getExtracurriculars().size(),
                record.getProjects().size());
        return record;
    }

    private PersonalInfo readPersonalInfo(Object value) {
        if (value == null) {
            return PersonalInfo.empty();
        }
        Map<String, Object> info = asMapping(value, PERSONAL_INFO);
        return PersonalInfo.builder()
                .name(requiredText(info, "name", PERSONAL_INFO))
                .phone(requiredText(info, "phone", PERSONAL_INFO))
                .email(requiredText(info, "email", PERSONAL_INFO))
                .location(requiredText(info, "location", PERSONAL_INFO))
                .linkedin(optionalText(info, "linkedin", PERSONAL_INFO))
                .github(optionalText(info, "github", PERSONAL_INFO))
                .visaStatus(optionalText(info, "visa_status", PERSONAL_INFO))
                .build();
    }

    private ExperienceEntry readExperienceEntry(Object value, String path) {
        Map<String, Object> entry = asMapping(value, path);
        return ExperienceEntry.builder()
                .company(requiredText(entry, "company", path))
                .location(requiredText(entry, "location", path))
                .dates(requiredText(entry, "dates", path))
                .title(requiredText(entry, "title", path))
                .bulletPoints(readTextSequence(entry.get("bullet_points"), path + ".bullet_points"))
                .build();
    }

    private EducationEntry readEducationEntry(Object value, String path) {
        Map<String, Object> entry = asMapping(value, path);
        return EducationEntry.builder()
                .institution(requiredText(entry, "institution", path))
                .degree(requiredText(entry, "degree", path))
                .cgpa(optionalText(entry, "cgpa", path))
                .dates(requiredText(entry, "dates", path))
                .build();
    }

    private ExtracurricularEntry readExtracurricularEntry(Object value, String path) {
        Map<String, Object> entry = asMapping(value, path);
        return ExtracurricularEntry.builder()
                .organization(requiredText(entry, "organization", path))
                .position(requiredText(entry, "position", path))
                .dates(requiredText(entry, "dates", path))
                .bulletPoints(readTextSequence(entry.get("bullet_points"), path + ".bullet_points"))
                .build();
    }

    private ProjectEntry readProjectEntry(Object value, String path) {
        Map<String, Object> entry = asMapping(value, path);
        return ProjectEntry.builder()
                .name(requiredText(entry, "name", path))
                .techStack(readTextSequence(entry.get("tech_stack"), path + ".tech_stack"))
                .bulletPoints(readTextSequence(entry.get("bullet_points"), path + ".bullet_points"))
                .build();
    }

    /**
     * Skills come either as {categories: [...]} or directly as the category sequence.
     */
    private List<SkillCategory> readSkills(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Map) {
            Map<String, Object> skills = asMapping(value, SKILLS);
            return readSequence(skills.get("categories"), SKILLS + ".categories", this::readSkillCategory);
        }
        if (value instanceof List) {
            return readSequence(value, SKILLS, this::readSkillCategory);
        }
        throw new SchemaValidationException(SKILLS,
                "expected a mapping with 'categories' or a sequence of categories but got " + describe(value));
    }

    private SkillCategory readSkillCategory(Object value, String path) {
        Map<String, Object> category = asMapping(value, path);
        if (!category.containsKey("name") || category.get("name") == null) {
            throw new SchemaValidationException(path + ".name", "skill category requires a name");
        }
        return SkillCategory.builder()
                .name(requiredText(category, "name", path))
                .items(readTextSequence(category.get("items"), path + ".items"))
                .build();
    }

    private <T> List<T> readSequence(Object value, String path, BiFunction<Object, String, T> reader) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List<?> raw)) {
            throw new SchemaValidationException(path, "expected a sequence but got " + describe(value));
        }
        List<T> result = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String elementPath = path + "[" + i + "]";
            Object element = raw.get(i);
            if (element == null) {
                throw new SchemaValidationException(elementPath, "null entries are not allowed");
            }
            result.add(reader.apply(element, elementPath));
        }
        return result;
    }

    private List<String> readTextSequence(Object value, String path) {
        return readSequence(value, path, this::asText);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMapping(Object value, String path) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new SchemaValidationException(path, "expected a mapping but got " + describe(value));
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new SchemaValidationException(path, "mapping keys must be text but found " + describe(key));
            }
        }
        return (Map<String, Object>) map;
    }

    private String requiredText(Map<String, Object> source, String key, String path) {
        String text = optionalText(source, key, path);
        return text != null ? text : "";
    }

    private String optionalText(Map<String, Object> source, String key, String path) {
        Object value = source.get(key);
        if (value == null) {
            return null;
        }
        return asText(value, path + "." + key);
    }

    private String asText(Object value, String path) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw new SchemaValidationException(path, "expected text but got " + describe(value));
    }

    private String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "a mapping";
        }
        if (value instanceof List) {
            return "a sequence";
        }
        if (value instanceof String) {
            return "text";
        }
        return value.getClass().getSimpleName();
    }
}
