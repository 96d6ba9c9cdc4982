package com.contractflow.analyzer.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

final class OutputPaths {

    private OutputPaths() {}

    /**
     * Resolves {@code fileName} under {@code outputDir} unless it is absolute, and
     * creates both the output directory and the file's parent directory.
     */
    static Path prepare(Path outputDir, String fileName) throws IOException {
        Files.createDirectories(outputDir);
        Path name = Paths.get(fileName);
        Path target = name.isAbsolute() ? name : outputDir.resolve(name);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return target;
    }
}
