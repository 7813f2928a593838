package com.resumeForge.cvRenderer.output.service;

import com.resumeForge.cvRenderer.output.exception.DocumentConversionException;
import com.resumeForge.cvRenderer.output.model.TargetFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LibreOfficeDocumentConverterTest {

    @TempDir
    Path directory;

    private Path document;

    @BeforeEach
    void setUp() throws IOException {
        Path documents = Files.createDirectories(directory.resolve("documents"));
        document = documents.resolve("resume.docx");
        Files.writeString(document, "placeholder");
    }

    private Path script(String name, String body) throws IOException {
        Path script = directory.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    private LibreOfficeDocumentConverter converter(Path command, Duration timeout) {
        return new LibreOfficeDocumentConverter(command.toString(), timeout);
    }

    private Path expectedPdf() {
        return document.resolveSibling("resume.pdf");
    }

    @Test
    void convert_shouldRejectMissingSource() {
        LibreOfficeDocumentConverter converter = new LibreOfficeDocumentConverter("soffice", Duration.ofSeconds(5));
        Path missing = directory.resolve("missing.docx");

        assertThatThrownBy(() -> converter.convert(missing, TargetFormat.PDF))
                .isInstanceOf(DocumentConversionException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void convert_shouldReportUnavailableConverter() {
        LibreOfficeDocumentConverter converter = converter(directory.resolve("no-such-converter"), Duration.ofSeconds(5));

        assertThatThrownBy(() -> converter.convert(document, TargetFormat.PDF))
                .isInstanceOf(DocumentConversionException.class)
                .satisfies(e -> {
                    DocumentConversionException failure = (DocumentConversionException) e;
                    assertThat(failure.getSource()).isEqualTo(document);
                    assertThat(failure.getFormat()).isEqualTo(TargetFormat.PDF);
                });

        assertThat(document).exists();
        assertThat(expectedPdf()).doesNotExist();
    }

    @Test
    void tail_shouldFallBackToEmptyWhenOutputIsUnreadable() {
        LibreOfficeDocumentConverter converter = new LibreOfficeDocumentConverter("soffice", Duration.ofSeconds(5));

        assertThat(converter.tail(directory.resolve("vanished.log"))).isEmpty();
    }

    @Test
    void tail_shouldKeepOnlyTheEndOfLongOutput() throws IOException {
        LibreOfficeDocumentConverter converter = new LibreOfficeDocumentConverter("soffice", Duration.ofSeconds(5));
        Path consoleLog = directory.resolve("console.log");
        Files.writeString(consoleLog, "x".repeat(2000) + "last line");

        assertThat(converter.tail(consoleLog)).hasSize(500).endsWith("last line");
    }

    @Nested
    @DisabledOnOs(OS.WINDOWS)
    class ConverterProcess {

        @Test
        void convert_shouldKillConverterThatOverrunsTimeout() throws IOException {
            Path command = script("slow.sh", "sleep 10");
            long started = System.nanoTime();

            assertThatThrownBy(() -> converter(command, Duration.ofSeconds(1)).convert(document, TargetFormat.PDF))
                    .isInstanceOf(DocumentConversionException.class)
                    .hasMessageContaining("did not finish within PT1S");

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(8));
            assertThat(document).exists();
        }

        @Test
        void convert_shouldReportExitCodeWithConsoleOutput() throws IOException {
            Path command = script("failing.sh", "echo boom\nexit 3");

            assertThatThrownBy(() -> converter(command, Duration.ofSeconds(10)).convert(document, TargetFormat.PDF))
                    .isInstanceOf(DocumentConversionException.class)
                    .hasMessageContaining("exited with code 3")
                    .hasMessageContaining("boom")
                    .hasMessageNotContaining("could not run");
        }

        @Test
        void convert_shouldReportSuccessfulExitWithoutOutput() throws IOException {
            Path command = script("noop.sh", "exit 0");

            assertThatThrownBy(() -> converter(command, Duration.ofSeconds(10)).convert(document, TargetFormat.PDF))
                    .isInstanceOf(DocumentConversionException.class)
                    .hasMessageContaining("produced no output at " + expectedPdf());
        }

        @Test
        void convert_shouldReturnDerivedPathWhenConverterWritesIt() throws IOException {
            Path arguments = directory.resolve("arguments.txt");
            Path command = script("convert.sh",
                    "printf '%s\\n' \"$@\" > '" + arguments + "'\n"
                            + "touch '" + expectedPdf() + "'");

            Path converted = converter(command, Duration.ofSeconds(10)).convert(document, TargetFormat.PDF);

            assertThat(converted).isEqualTo(expectedPdf()).isRegularFile();
            List<String> commandLine = Files.readAllLines(arguments);
            assertThat(commandLine).containsSubsequence(
                    "--headless", "--convert-to", "pdf", "--outdir", document.getParent().toString(), document.toString());
        }

        @Test
        void convert_shouldGiveEachConversionItsOwnProfile() throws IOException {
            Path arguments = directory.resolve("arguments.txt");
            Path command = script("convert.sh",
                    "printf '%s\\n' \"$1\" >> '" + arguments + "'\n"
                            + "touch '" + expectedPdf() + "'");
            LibreOfficeDocumentConverter converter = converter(command, Duration.ofSeconds(10));

            converter.convert(document, TargetFormat.PDF);
            converter.convert(document, TargetFormat.PDF);

            List<String> profiles = Files.readAllLines(arguments);
            assertThat(profiles).hasSize(2).doesNotHaveDuplicates()
                    .allSatisfy(option -> assertThat(option)
                            .startsWith(LibreOfficeDocumentConverter.USER_INSTALLATION_OPTION + "file:"));
            for (String option : profiles) {
                URI profile = URI.create(option.substring(LibreOfficeDocumentConverter.USER_INSTALLATION_OPTION.length()));
                assertThat(Path.of(profile)).doesNotExist();
            }
        }
    }
}
