package com.solicfg.builder.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads a build configuration file.
     *
     * @throws ConfigReadException if the file is missing, empty, malformed or holds negative limits
     */
    public BuildConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            BuildConfig config = GSON.fromJson(reader, BuildConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            validate(config, configPath);
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    private void validate(BuildConfig config, Path configPath) {
        if (config.getMaxNodes() < 0 || config.getMaxEdges() < 0) {
            throw new ConfigReadException("max_nodes and max_edges must be >= 0 in " + configPath);
        }
        if (config.getDotReprMaxLength() < 0) {
            throw new ConfigReadException("dot_repr_max_length must be >= 0 in " + configPath);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
