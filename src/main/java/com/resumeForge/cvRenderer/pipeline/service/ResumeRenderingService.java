package com.resumeForge.cvRenderer.pipeline.service;

import com.resumeForge.cvRenderer.document.model.DocumentTree;
import com.resumeForge.cvRenderer.output.exception.DocumentConversionException;
import com.resumeForge.cvRenderer.output.exception.DocumentWriteException;
import com.resumeForge.cvRenderer.output.model.TargetFormat;
import com.resumeForge.cvRenderer.output.service.DocumentConverter;
import com.resumeForge.cvRenderer.output.service.DocxDocumentSerializer;
import com.resumeForge.cvRenderer.output.util.ArtifactPaths;
import com.resumeForge.cvRenderer.pipeline.model.RenderResult;
import com.resumeForge.cvRenderer.render.model.RenderContext;
import com.resumeForge.cvRenderer.render.model.RenderOptions;
import com.resumeForge.cvRenderer.render.service.DocumentAssembler;
import com.resumeForge.cvRenderer.schema.exception.SchemaValidationException;
import com.resumeForge.cvRenderer.schema.model.ResumeRecord;
import com.resumeForge.cvRenderer.schema.service.ResumeSchemaValidator;
import com.resumeForge.cvRenderer.style.model.StyleRegistry;
import com.resumeForge.cvRenderer.util.StructuredTextLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Entry point of the rendering engine.
 *
 * Workflow: VALIDATE -> ASSEMBLE -> SERIALIZE -> (IF REQUESTED) CONVERT
 *
 * Schema and write failures abort the pass. A conversion failure does not: the
 * saved document stays in place and the failure is reported on the {@link RenderResult}.
 * The service keeps no state between calls, so independent passes may run concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeRenderingService {

    private final ResumeSchemaValidator schemaValidator;
    private final DocumentAssembler documentAssembler;
    private final DocxDocumentSerializer documentSerializer;
    private final DocumentConverter documentConverter;
    private final StyleRegistry styleRegistry;
    private final RenderIdService renderIdService;

    @Value("${cv-renderer.output.directory:./generated}")
    private String outputDirectory;

    /**
     * Renders resume data to a document at the given path.
     *
     * @param input Generic structured value, usually a Map parsed from YAML or JSON
     * @param destination Path of the .docx file to write
     * @param options Extra skills and optional conversion format; null means {@link RenderOptions#defaults()}
     * @return Paths of the produced artifacts and any conversion failure
     * @throws SchemaValidationException if the input does not match the resume schema
     * @throws DocumentWriteException if the document cannot be written
     */
    public RenderResult render(Object input, Path destination, RenderOptions options) {
        RenderOptions effectiveOptions = options != null ? options : RenderOptions.defaults();
        String renderId = renderIdService.generateRenderId();
        log.info("Render started - renderId: {}, destination: {}", renderId, destination);

        ResumeRecord record;
        try {
            record = schemaValidator.validate(input);
        } catch (SchemaValidationException e) {
            log.warn("Render rejected - renderId: {}, field: {}, reason: {}", renderId, e.getFieldPath(), e.getMessage());
            throw e;
        }

        RenderContext context = new RenderContext(renderId, styleRegistry, effectiveOptions);
        DocumentTree tree = documentAssembler.assemble(record, context);
        documentSerializer.serialize(tree, destination);

        RenderResult.RenderResultBuilder result = RenderResult.builder()
                .renderId(renderId)
                .documentPath(destination);

        Optional<TargetFormat> format = effectiveOptions.getConversionFormat();
        if (format.isPresent()) {
            convert(destination, format.get(), renderId, result);
        }

        log.info("Render completed - renderId: {}, document: {}", renderId, destination);
        return result.build();
    }

    /**
     * Parses YAML or JSON text and renders it.
     *
     * @throws SchemaValidationException if the text is malformed or does not match the schema
     */
    public RenderResult renderSource(String source, Path destination, RenderOptions options) {
        return render(StructuredTextLoader.parse(source), destination, options);
    }

    /**
     * Renders into the configured output directory under a name derived from {@code generationId}.
     */
    public RenderResult renderToOutputDirectory(Object input, String generationId, RenderOptions options) {
        Path destination = resolveArtifact(ArtifactPaths.generatedFileName(generationId));
        return render(input, destination, options);
    }

    /**
     * Resolves a generated artifact's file name inside the output directory.
     *
     * @throws IllegalArgumentException if the name could point outside the output directory
     */
    public Path resolveArtifact(String fileName) {
        return ArtifactPaths.resolveWithin(Path.of(outputDirectory), fileName);
    }

    private void convert(Path document, TargetFormat format, String renderId, RenderResult.RenderResultBuilder result) {
        try {
            Path converted = documentConverter.convert(document, format);
            result.convertedPath(converted);
            log.info("Conversion completed - renderId: {}, output: {}", renderId, converted);
        } catch (DocumentConversionException e) {
            log.warn("Conversion failed, document kept - renderId: {}, document: {}", renderId, document, e);
            result.conversionError(e.getMessage());
        }
    }
}
