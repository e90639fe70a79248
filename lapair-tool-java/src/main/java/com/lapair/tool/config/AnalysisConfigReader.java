package com.lapair.tool.config;

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
     * Reads, deserializes and validates the config file at {@code configPath}.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds invalid values
     */
    public AnalysisConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        AnalysisConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, AnalysisConfig.class);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty: " + configPath);
        }
        validate(config, configPath);
        return config;
    }

    private void validate(AnalysisConfig config, Path configPath) {
        for (String analysis : config.getAnalyses()) {
            if (!AnalysisConfig.KNOWN_ANALYSES.contains(analysis)) {
                throw new ConfigReadException("Unknown analysis '" + analysis + "' in " + configPath
                        + " (expected one of " + AnalysisConfig.KNOWN_ANALYSES + ")");
            }
        }
        try {
            config.getExecutionConfig();
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException("Invalid symbolic section in " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
