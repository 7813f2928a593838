package com.resumeForge.cvRenderer.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.UntypedObjectDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.resumeForge.cvRenderer.schema.exception.SchemaValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Utility class for reading resume data written as YAML (or JSON, which YAML accepts)
 * into a generic mapping ready for schema validation.
 *
 * Unquoted scalars are kept as the text they were written as: YAML 1.1 would otherwise read
 * {@code visa_status: No} as a boolean, {@code phone: 0123} as the number 83 and
 * {@code cgpa: 8.50} as 8.5. Only mappings, sequences, strings and nulls reach the validator.
 */
public class StructuredTextLoader {

    private static final ObjectMapper yamlMapper = YAMLMapper.builder()
            .addModule(new SimpleModule("verbatim-scalars")
                    .addDeserializer(Object.class, new VerbatimScalarDeserializer()))
            .build();

    private static final TypeReference<Object> ANY = new TypeReference<>() {};

    /**
     * Parses structured text.
     *
     * @param text YAML or JSON document
     * @return The parsed top-level value, normally a Map
     * @throws SchemaValidationException if the text is not well-formed
     */
    public static Object parse(String text) {
        try {
            return yamlMapper.readValue(text, ANY);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("$", "input is not well-formed structured text: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses structured text that must contain a mapping at the top level.
     *
     * @param text YAML or JSON document
     * @return The top-level mapping
     * @throws SchemaValidationException if the text is malformed or not a mapping
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseMapping(String text) {
        Object value = parse(text);
        if (!(value instanceof Map)) {
            throw new SchemaValidationException("$", "expected a mapping at the top level");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Reads and parses a UTF-8 file.
     *
     * @param file Path to the YAML or JSON file
     * @return The top-level mapping
     * @throws IOException if the file cannot be read
     */
    public static Map<String, Object> loadMapping(Path file) throws IOException {
        return parseMapping(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Loads a file from the classpath as a String.
     *
     * @param resourcePath The path to the resource (e.g., "fixtures/sample-resume.yaml")
     * @return The content as a String
     * @throws IOException if the resource cannot be read or doesn't exist
     */
    public static String loadResourceAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = StructuredTextLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a classpath resource and parses it as a mapping.
     *
     * @param resourcePath The path to the resource
     * @return The top-level mapping
     * @throws IOException if the resource cannot be read or doesn't exist
     */
    public static Map<String, Object> loadResourceMapping(String resourcePath) throws IOException {
        return parseMapping(loadResourceAsString(resourcePath));
    }

    /**
     * Untyped deserializer that returns booleans and numbers as their source text.
     */
    static class VerbatimScalarDeserializer extends UntypedObjectDeserializer {

        VerbatimScalarDeserializer() {
            super(null, null);
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_TRUE || token == JsonToken.VALUE_FALSE
                    || token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                return p.getText();
            }
            return super.deserialize(p, ctxt);
        }
    }
}
