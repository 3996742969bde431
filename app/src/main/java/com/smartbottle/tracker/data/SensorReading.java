package com.smartbottle.tracker.data;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One decoded notification from the bottle.
 * Readings are never mutated after the decoder builds them; calibration and
 * observers all see the same instance.
 */
public final class SensorReading {
    public final double distanceMm;
    /** Fill level the firmware computed itself, 0..100, when the payload carried one. */
    @Nullable
    public final Double rawLevelPct;
    public final long timestampMs;
    @Nonnull
    public final String sourceId;

    public SensorReading(double distanceMm, @Nullable Double rawLevelPct, long timestampMs, @Nonnull String sourceId) {
        this.distanceMm = distanceMm;
        this.rawLevelPct = rawLevelPct;
        this.timestampMs = timestampMs;
        this.sourceId = sourceId;
    }

    public static SensorReading ofDistance(double distanceMm, long timestampMs, @Nonnull String sourceId) {
        return new SensorReading(distanceMm, null, timestampMs, sourceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SensorReading)) return false;
        SensorReading that = (SensorReading) o;
        return Double.compare(that.distanceMm, distanceMm) == 0
                && timestampMs == that.timestampMs
                && java.util.Objects.equals(rawLevelPct, that.rawLevelPct)
                && sourceId.equals(that.sourceId);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(distanceMm, rawLevelPct, timestampMs, sourceId);
    }

    @Override
    public String toString() {
        return "SensorReading{" +
                "distanceMm=" + distanceMm +
                ", rawLevelPct=" + rawLevelPct +
                ", timestampMs=" + timestampMs +
                ", sourceId='" + sourceId + '\'' +
                '}';
    }
}
