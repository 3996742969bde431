package com.smartbottle.tracker.logic;

import com.smartbottle.tracker.data.SensorReading;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** One firmware payload format. Implementations never throw on foreign input. */
public interface PayloadShape {

    /**
     * @param text     payload decoded as UTF-8 and trimmed
     * @param sourceId id of the link the payload arrived on
     * @return a reading, or null when {@code text} is not in this shape
     */
    @Nullable
    SensorReading tryParse(@Nonnull String text, @Nonnull String sourceId, long timestampMs);

    default String getName() { return this.getClass().getSimpleName(); }
}
