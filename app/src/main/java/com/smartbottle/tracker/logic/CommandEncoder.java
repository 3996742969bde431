package com.smartbottle.tracker.logic;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.smartbottle.tracker.Constants;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import javax.annotation.Nonnull;

/** Builds the JSON control envelopes written to the bottle's control characteristic. */
public final class CommandEncoder {

    private static final Gson GSON = new Gson();

    private CommandEncoder() {}

    public static byte[] deepSleep(int durationMinutes, long timestampMs) {
        if (durationMinutes <= 0) throw new IllegalArgumentException("durationMinutes must be positive");
        JsonObject root = envelope(Constants.ACTION_DEEP_SLEEP);
        root.addProperty("duration_minutes", durationMinutes);
        root.addProperty("timestamp", timestampMs);
        return bytes(root);
    }

    public static byte[] wake(long timestampMs) {
        JsonObject root = envelope(Constants.ACTION_WAKE);
        root.addProperty("timestamp", timestampMs);
        return bytes(root);
    }

    public static byte[] calibrationStep(@Nonnull CalibrationStep step, long timestampMs) {
        return calibration(step.wireName, timestampMs);
    }

    public static byte[] calibrationComplete(long timestampMs) {
        return calibration(Constants.STEP_COMPLETE, timestampMs);
    }

    public static byte[] configUpdate(@Nonnull Map<String, ?> config, long timestampMs) {
        JsonObject root = envelope(Constants.ACTION_CONFIG_UPDATE);
        JsonElement body = GSON.toJsonTree(config);
        root.add("config", body);
        root.addProperty("timestamp", timestampMs);
        return bytes(root);
    }

    /** Caller-supplied command, sent as-is. */
    public static byte[] raw(@Nonnull String command) {
        return command.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] calibration(String step, long timestampMs) {
        JsonObject root = envelope(Constants.ACTION_CALIBRATION);
        root.addProperty("step", step);
        root.addProperty("timestamp", timestampMs);
        return bytes(root);
    }

    private static JsonObject envelope(String action) {
        JsonObject root = new JsonObject();
        root.addProperty("action", action);
        return root;
    }

    private static byte[] bytes(JsonObject root) {
        return root.toString().getBytes(StandardCharsets.UTF_8);
    }
}
