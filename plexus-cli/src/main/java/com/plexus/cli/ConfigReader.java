package com.plexus.cli;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates a plexus.json options file.
     *
     * @throws ConfigReadException if the file is missing, malformed or holds an invalid value
     */
    public PlexusConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        PlexusConfig config;
        try (FileReader reader = new FileReader(configPath.toFile())) {
            config = GSON.fromJson(reader, PlexusConfig.class);
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
        }
        try {
            config.toCompilerOptions();
            config.toDecompilerOptions();
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException("Invalid config " + configPath + ": " + e.getMessage(), e);
        }
        return config;
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
