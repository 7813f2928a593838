package com.resumeForge.cvRenderer.output.service;

import com.resumeForge.cvRenderer.output.exception.DocumentConversionException;
import com.resumeForge.cvRenderer.output.model.TargetFormat;
import com.resumeForge.cvRenderer.output.util.ArtifactPaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Converts documents by running an office suite in headless mode as a child process.
 *
 * The process is given a hard timeout; when it expires the process is killed and the
 * conversion reported as failed. The converter's console output is kept only for error messages.
 * Each conversion runs against its own throwaway user profile, so concurrent conversions
 * never hand off to one another's running office instance.
 */
@Slf4j
@Service
public class LibreOfficeDocumentConverter implements DocumentConverter {

    private static final int MAX_OUTPUT_CHARS = 500;
    static final String USER_INSTALLATION_OPTION = "-env:UserInstallation=";

    private final String command;
    private final Duration timeout;

    public LibreOfficeDocumentConverter(
            @Value("${cv-renderer.conversion.command:soffice}") String command,
            @Value("${cv-renderer.conversion.timeout:60s}") Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    @Override
    public Path convert(Path source, TargetFormat format) {
        Path document = source.toAbsolutePath().normalize();
        if (!Files.isRegularFile(document)) {
            throw new DocumentConversionException(source, format, "source document does not exist");
        }
        Path target = ArtifactPaths.withExtension(document, format.getExtension());

        Path consoleLog = null;
        Path profile = null;
        try {
            Files.deleteIfExists(target);
            consoleLog = Files.createTempFile("cv-renderer-convert-", ".log");
            profile = Files.createTempDirectory("cv-renderer-profile-");

            List<String> commandLine = List.of(
                    command,
                    USER_INSTALLATION_OPTION + profile.toUri(),
                    "--headless",
                    "--convert-to", format.getExtension(),
                    "--outdir", document.getParent().toString(),
                    document.toString());

            log.debug("Starting conversion - source: {}, format: {}, timeout: {}", document, format, timeout);
            Process process = new ProcessBuilder(commandLine)
                    .redirectErrorStream(true)
                    .redirectOutput(consoleLog.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new DocumentConversionException(source, format,
                        "converter did not finish within " + timeout);
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new DocumentConversionException(source, format,
                        "converter exited with code " + exitCode + ": " + tail(consoleLog));
            }
            if (!Files.isRegularFile(target)) {
                throw new DocumentConversionException(source, format,
                        "converter produced no output at " + target + ": " + tail(consoleLog));
            }

            log.info("Conversion completed - source: {}, target: {}", document, target);
            return target;

        } catch (IOException e) {
            throw new DocumentConversionException(source, format, "could not run '" + command + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentConversionException(source, format, "interrupted while waiting for converter", e);
        } finally {
            deleteQuietly(consoleLog);
            deleteQuietly(profile);
        }
    }

    String tail(Path consoleLog) {
        String output;
        try {
            output = Files.readString(consoleLog, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            log.warn("Could not read converter output {}", consoleLog, e);
            return "";
        }
        if (output.length() > MAX_OUTPUT_CHARS) {
            return output.substring(output.length() - MAX_OUTPUT_CHARS);
        }
        return output;
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(file);
        } catch (IOException e) {
            log.warn("Could not delete converter scratch file {}", file, e);
        }
    }
}
