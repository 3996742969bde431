package com.smartbottle.tracker.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Keeps every subject's calibration in one JSON document, {@code {subjectId: calibration}}.
 * Writes go to a sibling temp file and are moved into place so a crash never leaves a
 * half-written store behind.
 */
public final class JsonFileCalibrationStore implements CalibrationStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileCalibrationStore.class);

    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Calibration>>() {}.getType();

    private final Path file;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Object fileLock = new Object();

    public JsonFileCalibrationStore(@Nonnull Path file) {
        this.file = file;
    }

    @Nullable
    @Override
    public Calibration load(@Nonnull String subjectId) throws IOException {
        synchronized (fileLock) {
            Calibration stored = readAll().get(subjectId);
            if (stored == null) return null;
            if (stored.complete && !stored.isComplete()) {
                log.warn("Stored calibration for " + subjectId + " violates empty > full; loading as incomplete");
            }
            return new Calibration(stored.emptyBaselineMm, stored.fullBaselineMm, stored.bottleCapacityMl,
                    stored.calibratedAtMs, stored.isComplete());
        }
    }

    @Override
    public void save(@Nonnull String subjectId, @Nonnull Calibration calibration) throws IOException {
        synchronized (fileLock) {
            Map<String, Calibration> all = readAll();
            all.put(subjectId, calibration);
            writeAll(all);
            log.info("Saved calibration for " + subjectId + ": " + calibration);
        }
    }

    @Override
    public void clear(@Nonnull String subjectId) throws IOException {
        synchronized (fileLock) {
            Map<String, Calibration> all = readAll();
            if (all.remove(subjectId) != null) {
                writeAll(all);
                log.info("Cleared calibration for " + subjectId);
            }
        }
    }

    private Map<String, Calibration> readAll() throws IOException {
        if (!Files.exists(file)) return new LinkedHashMap<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, Calibration> all = gson.fromJson(reader, MAP_TYPE);
            return all != null ? all : new LinkedHashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Corrupt calibration store " + file, e);
        }
    }

    private void writeAll(Map<String, Calibration> all) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            gson.toJson(all, MAP_TYPE, writer);
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
