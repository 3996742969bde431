package com.smartbottle.tracker.logic;

import com.google.gson.JsonObject;
import com.smartbottle.tracker.data.SensorReading;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Current firmware: {@code {"p": percent, "d": distance_mm}}. {@code p} may be missing. */
public class CompactPayloadShape implements PayloadShape {

    @Nullable
    @Override
    public SensorReading tryParse(@Nonnull String text, @Nonnull String sourceId, long timestampMs) {
        JsonObject obj = JsonPayloads.parseObject(text);
        if (obj == null) return null;
        Double distance = JsonPayloads.finiteNumber(obj, "d");
        if (distance == null || distance < 0) return null;
        Double pct = JsonPayloads.clampPercent(JsonPayloads.finiteNumber(obj, "p"));
        return new SensorReading(distance, pct, timestampMs, sourceId);
    }
}
