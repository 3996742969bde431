package com.smartbottle.tracker.logic;

import com.smartbottle.tracker.data.SensorReading;

import java.util.regex.Pattern;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** First firmware revision: the distance in mm as plain ASCII, e.g. {@code "118"}. */
public class BareNumberPayloadShape implements PayloadShape {

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?");

    @Nullable
    @Override
    public SensorReading tryParse(@Nonnull String text, @Nonnull String sourceId, long timestampMs) {
        if (!NUMBER.matcher(text).matches()) return null;
        double distance;
        try {
            distance = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
        if (Double.isInfinite(distance)) return null;
        return SensorReading.ofDistance(distance, timestampMs, sourceId);
    }
}
