package com.smartbottle.tracker.logic;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import javax.annotation.Nullable;

/** Lenient JSON field access shared by the object-shaped payload parsers. */
final class JsonPayloads {

    private JsonPayloads() {}

    @Nullable
    static JsonObject parseObject(String text) {
        if (text.isEmpty() || text.charAt(0) != '{') return null;
        try {
            JsonElement root = JsonParser.parseString(text);
            return root.isJsonObject() ? root.getAsJsonObject() : null;
        } catch (JsonParseException | IllegalStateException e) {
            return null;
        }
    }

    /**
     * Reads {@code key} as a finite number. Numeric strings ("123") are accepted since some
     * firmware quotes everything; NaN and infinities count as absent.
     */
    @Nullable
    static Double finiteNumber(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        if (el == null || !el.isJsonPrimitive()) return null;
        JsonPrimitive p = el.getAsJsonPrimitive();
        double v;
        try {
            if (p.isNumber()) {
                v = p.getAsDouble();
            } else if (p.isString()) {
                v = Double.parseDouble(p.getAsString().trim());
            } else {
                return null;
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return (Double.isNaN(v) || Double.isInfinite(v)) ? null : v;
    }

    @Nullable
    static String string(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        if (el == null || !el.isJsonPrimitive()) return null;
        String s = el.getAsString();
        return (s == null || s.trim().isEmpty()) ? null : s.trim();
    }

    static Double clampPercent(@Nullable Double pct) {
        if (pct == null) return null;
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
