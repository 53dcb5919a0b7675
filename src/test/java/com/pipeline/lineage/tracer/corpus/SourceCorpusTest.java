package com.pipeline.lineage.tracer.corpus;

import com.pipeline.lineage.tracer.model.TraceDiagnostics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SourceCorpusTest {

    @TempDir
    Path tempDir;

    @Test
    void testListsOnlyPipelineSourcesInPathOrder() throws IOException {
        Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(tempDir.resolve("b/job.PY"), "x = 1");
        Files.writeString(tempDir.resolve("a.sql"), "select 1");
        Files.writeString(tempDir.resolve("c.sas"), "data _null_; run;");
        Files.writeString(tempDir.resolve("notes.txt"), "ignored");

        SourceCorpus corpus = SourceCorpus.scan(tempDir, new TraceDiagnostics());

        assertThat(corpus.getFiles()).extracting(corpus::relativize)
                .containsExactly("a.sql", "b/job.PY", "c.sas");
    }

    @Test
    void testFallsBackToLatin1ForInvalidUtf8() throws IOException {
        Path file = tempDir.resolve("legacy.sas");
        Files.write(file, "* café;".getBytes(StandardCharsets.ISO_8859_1));

        SourceCorpus corpus = SourceCorpus.scan(tempDir, new TraceDiagnostics());

        assertThat(corpus.text(file)).contains("* café;");
        assertThat(corpus.lowerCaseText(file)).contains("* café;");
    }

    @Test
    void testUnreadableFileIsWarnedAndSkipped() throws IOException {
        Path missing = tempDir.resolve("gone.py");
        TraceDiagnostics diagnostics = new TraceDiagnostics();
        SourceCorpus corpus = new SourceCorpus(tempDir, List.of(missing), new SourceFileReader(), diagnostics);

        assertThat(corpus.text(missing)).isEmpty();
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("gone.py");
        assertThat(diagnostics.hasErrors()).isFalse();
    }
}
