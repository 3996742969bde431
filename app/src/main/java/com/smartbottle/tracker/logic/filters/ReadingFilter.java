package com.smartbottle.tracker.logic.filters;

public interface ReadingFilter {
    /** @return false when the distance cannot come from water in a bottle */
    boolean shouldAccept(long timestampMs, double distanceMm);
}
