package com.glassbox.calc.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.spec.ModelSpec;

/**
 * JSON reading and writing of model specifications and recipes.
 */
public final class ModelJson {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ModelJson() {
    }

    public static ModelSpec readSpec(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return readSpec(in);
        }
    }

    public static ModelSpec readSpec(InputStream in) throws IOException {
        return MAPPER.readValue(in, ModelSpec.class);
    }

    public static ModelSpec parseSpec(String json) throws IOException {
        return MAPPER.readValue(json, ModelSpec.class);
    }

    /**
     * Reads a specification from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static ModelSpec readSpecResource(String resource) throws IOException {
        try (InputStream in = ModelJson.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            return readSpec(in);
        }
    }

    public static Recipe readRecipe(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, Recipe.class);
        }
    }

    public static Recipe parseRecipe(String json) throws IOException {
        return MAPPER.readValue(json, Recipe.class);
    }

    public static void writeRecipe(Recipe recipe, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), recipe);
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
