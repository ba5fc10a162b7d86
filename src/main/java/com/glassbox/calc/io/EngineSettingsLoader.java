package com.glassbox.calc.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/** Reads {@link EngineSettings} from JSON. */
@Log4j2
public final class EngineSettingsLoader {
    public static final String RESOURCE = "glassbox-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EngineSettingsLoader() {
    }

    /** Settings from the classpath resource {@value #RESOURCE}, or defaults when it is absent. */
    public static EngineSettings load() {
        try (InputStream in = EngineSettingsLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", RESOURCE);
                return new EngineSettings();
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static EngineSettings load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static EngineSettings load(InputStream in) throws IOException {
        EngineSettings settings = MAPPER.readValue(in, EngineSettings.class);
        log.debug("Loaded engine settings: {}", settings);
        return settings;
    }
}
