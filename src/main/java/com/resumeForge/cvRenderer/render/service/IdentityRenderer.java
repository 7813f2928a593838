package com.resumeForge.cvRenderer.render.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.util.Paragraphs;
import com.resumeForge.cvRenderer.schema.model.PersonalInfo;
import com.resumeForge.cvRenderer.style.model.StyleName;
import org.springframework.stereotype.Component;

/**
 * Centered header block: name, phone, email and the optional profile and visa lines.
 */
@Component
public class IdentityRenderer implements SectionRenderer<PersonalInfo> {

    @Override
    public void render(DocumentTree.Builder tree, PersonalInfo info, RenderContext context) {
        tree.append(Paragraphs.centered(StyleName.HEADING, info.getName()));
        tree.append(Paragraphs.centered(StyleName.BODY, info.getPhone()));
        tree.append(Paragraphs.centered(StyleName.BODY, "Email: " + info.getEmail()));

        info.getLinkedin().ifPresent(linkedin ->
                tree.append(Paragraphs.centered(StyleName.BODY, "LinkedIn: " + linkedin)));
        info.getGithub().ifPresent(github ->
                tree.append(Paragraphs.centered(StyleName.BODY, "GitHub: " + github)));
        info.getVisaStatus().ifPresent(visaStatus ->
                tree.append(Paragraphs.centered(StyleName.BODY, visaStatus)));
    }
}
