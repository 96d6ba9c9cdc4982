package com.contractflow.analyzer.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the structured output document. Array order is fixed by the analysis
 * (registry ids, call order, ICFG ids), so identical input gives byte-identical
 * output.
 */
public class JsonExporter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    public String toJson(ExportModel.ExportRoot root) {
        return GSON.toJson(root);
    }

    /**
     * Writes {@code root} to {@code fileName}, resolved under {@code outputDir}
     * when relative. Directories are created as needed.
     *
     * @return the written file
     */
    public Path write(ExportModel.ExportRoot root, Path outputDir, String fileName) {
        Path target;
        try {
            target = OutputPaths.prepare(outputDir, fileName);
        } catch (IOException e) {
            throw new ExportException("Could not create output directory for: " + fileName, e);
        }
        try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new ExportException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        System.err.println("[contract-flow] JSON written: " + target);
        return target;
    }
}
