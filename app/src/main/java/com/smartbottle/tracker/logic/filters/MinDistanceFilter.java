package com.smartbottle.tracker.logic.filters;

public class MinDistanceFilter implements ReadingFilter {
    private final double minDistanceMm;

    public MinDistanceFilter(double minDistanceMm) {
        this.minDistanceMm = minDistanceMm;
    }

    @Override public boolean shouldAccept(long timestampMs, double distanceMm) {
        return distanceMm >= minDistanceMm;
    }

    public double getMinDistanceMm() {
        return minDistanceMm;
    }
}
