package com.smartbottle.tracker.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.smartbottle.tracker.Constants;
import com.smartbottle.tracker.data.Setting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Loads and caches the session {@link Setting}. Lookup order: the JSON file handed to the
 * constructor, then the bundled {@code smartbottle-settings.json}, then compiled-in defaults.
 */
public class SettingsManager {
    private static final Logger log = LoggerFactory.getLogger(SettingsManager.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @Nullable
    private final Path file;
    private volatile Setting cachedSetting;

    public SettingsManager(@Nullable Path file) {
        this.file = file;
        this.cachedSetting = load();
    }

    /** Settings from the bundled resource only. */
    public static SettingsManager fromClasspath() {
        return new SettingsManager(null);
    }

    @Nonnull
    public Setting getSetting() {
        Setting s = cachedSetting;
        if (s == null) {
            log.error("Cached setting is null. Returning emergency defaults.");
            return new Setting();
        }
        return s;
    }

    /** Replaces the cached setting and writes it back when file-backed. */
    public void upsert(@Nonnull Setting setting) throws IOException {
        cachedSetting = setting;
        if (file == null) {
            log.info("Setting updated in memory only (no backing file)");
            return;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(setting, writer);
        }
        log.info("Setting saved to " + file + ": " + setting);
    }

    /** Re-reads the backing file, e.g. after an external edit. */
    public Setting reload() {
        cachedSetting = load();
        return cachedSetting;
    }

    private Setting load() {
        if (file != null && Files.exists(file)) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                Setting s = gson.fromJson(reader, Setting.class);
                if (s != null) {
                    log.info("Loaded settings from " + file);
                    return s;
                }
                log.warn("Settings file " + file + " is empty; falling back");
            } catch (IOException | JsonParseException e) {
                log.warn("Could not read settings file " + file + "; falling back", e);
            }
        }
        Setting bundled = loadBundled();
        if (bundled != null) return bundled;
        log.info("No settings found, using defaults.");
        return new Setting();
    }

    @Nullable
    private Setting loadBundled() {
        InputStream in = SettingsManager.class.getClassLoader().getResourceAsStream(Constants.SETTINGS_RESOURCE);
        if (in == null) return null;
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, Setting.class);
        } catch (IOException | JsonParseException e) {
            log.warn("Bundled settings resource is unreadable", e);
            return null;
        }
    }
}
