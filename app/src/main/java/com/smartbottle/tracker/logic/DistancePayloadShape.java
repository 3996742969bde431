package com.smartbottle.tracker.logic;

import com.google.gson.JsonObject;
import com.smartbottle.tracker.data.SensorReading;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Older firmware: {@code {"distance": mm, "waterLevel": pct, "device": id, "status": ...}}.
 * Only {@code distance} is required. {@code level} is accepted as an alias for the
 * percentage and {@code device} overrides the link id as the reading's source.
 */
public class DistancePayloadShape implements PayloadShape {

    @Nullable
    @Override
    public SensorReading tryParse(@Nonnull String text, @Nonnull String sourceId, long timestampMs) {
        JsonObject obj = JsonPayloads.parseObject(text);
        if (obj == null) return null;
        Double distance = JsonPayloads.finiteNumber(obj, "distance");
        if (distance == null || distance < 0) return null;

        Double pct = JsonPayloads.finiteNumber(obj, "waterLevel");
        if (pct == null) pct = JsonPayloads.finiteNumber(obj, "level");

        String device = JsonPayloads.string(obj, "device");
        return new SensorReading(distance, JsonPayloads.clampPercent(pct), timestampMs,
                device != null ? device : sourceId);
    }
}
