package com.contractflow.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class AnalysisConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes the config file at the given path.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public AnalysisConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            AnalysisConfig config = GSON.fromJson(reader, AnalysisConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            if (config.getExpressionLabelLimit() <= 0 || config.getIrLabelLimit() <= 0) {
                throw new ConfigReadException("Label limits must be positive: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config file: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
