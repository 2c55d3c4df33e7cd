package com.example.groceryopt.storage;

import com.example.groceryopt.services.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;

/**
 * Settings come from the bundled {@code grocery-optimizer.json}, overlaid by the user's
 * {@code ~/.grocery-optimizer/settings.json} when that file exists.
 */
public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);
    static final String DEFAULTS_RESOURCE = "/grocery-optimizer.json";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path dir;
    private final Path file;

    public SettingsStorage() { this(Path.of(System.getProperty("user.home"), ".grocery-optimizer")); }

    public SettingsStorage(Path dir) {
        this.dir = dir;
        this.file = dir.resolve("settings.json");
    }

    public Settings load() {
        Settings s = new Settings();
        try (InputStream in = getClass().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) s = mapper.readerForUpdating(s).readValue(in);
        } catch (IOException ex) {
            throw new ConfigurationException("Bundled settings " + DEFAULTS_RESOURCE + " are unreadable.", ex);
        }
        if (!Files.exists(file)) return s;
        try (InputStream in = Files.newInputStream(file)) {
            s = mapper.readerForUpdating(s).readValue(in);
            log.debug("Loaded user settings from {}", file);
            return s;
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read settings from " + file, ex);
        }
    }

    public void save(Settings s) throws IOException {
        if (!Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
    }
}
