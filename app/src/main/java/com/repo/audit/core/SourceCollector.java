package com.repo.audit.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Finds the Java sources to audit under a directory.
 * Results are sorted by path so every run visits files in the same order.
 */
public class SourceCollector {

    private static final String EXTENSION = ".java";

    // Declaration-only files with no behaviour to measure
    private static final Set<String> SKIPPED_FILES = Set.of("package-info.java", "module-info.java");

    public List<Path> collect(Path directory, PolicyConfig policy) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .filter(path -> !SKIPPED_FILES.contains(path.getFileName().toString()))
                    .filter(path -> !policy.isExcluded(directory.relativize(path)))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        }
    }
}
