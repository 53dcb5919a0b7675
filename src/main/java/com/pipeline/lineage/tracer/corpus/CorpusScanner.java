package com.pipeline.lineage.tracer.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.pipeline.lineage.tracer.model.WriterKind;

import lombok.NoArgsConstructor;

/**
 * Lists pipeline source files (.py, .sql, .sas) under a corpus root, recursively.
 */
@NoArgsConstructor
public class CorpusScanner {

    public List<Path> listSourceFiles(Path root) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSourceFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isSourceFile(Path path) {
        return WriterKind.forFile(path).isPresent();
    }
}
