package com.solicfg.builder.frontend;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ProjectModelReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a project model JSON file.
     *
     * @throws ModelReadException if the file is missing, empty or malformed
     */
    public ProjectModel.ModelRoot read(Path modelPath) {
        if (!modelPath.toFile().exists()) {
            throw new ModelReadException("Project model not found: " + modelPath);
        }
        try (Reader reader = Files.newBufferedReader(modelPath, StandardCharsets.UTF_8)) {
            ProjectModel.ModelRoot root = GSON.fromJson(reader, ProjectModel.ModelRoot.class);
            if (root == null) {
                throw new ModelReadException("Project model is empty or invalid JSON: " + modelPath);
            }
            if (root.contracts == null) {
                throw new ModelReadException("Project model has no \"contracts\" array: " + modelPath);
            }
            return root;
        } catch (FileNotFoundException e) {
            throw new ModelReadException("Project model not found: " + modelPath, e);
        } catch (JsonParseException e) {
            throw new ModelReadException("Malformed project model " + modelPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelReadException("Failed to read project model: " + modelPath + ": " + e.getMessage(), e);
        }
    }

    public static class ModelReadException extends RuntimeException {
        public ModelReadException(String message) { super(message); }
        public ModelReadException(String message, Throwable cause) { super(message, cause); }
    }
}
