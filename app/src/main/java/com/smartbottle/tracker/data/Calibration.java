package com.smartbottle.tracker.data;

import java.util.Locale;

/**
 * Two-point baseline for one subject's bottle. The sensor looks down from the cap, so
 * the distance shrinks as the bottle fills: a usable calibration has
 * {@code emptyBaselineMm > fullBaselineMm > 0}.
 *
 * <p>Instances are immutable, so the level functions are safe to call from any thread.
 */
public final class Calibration {

    public final double emptyBaselineMm;
    public final double fullBaselineMm;
    public final int bottleCapacityMl;
    public final long calibratedAtMs;
    public final boolean complete;

    public Calibration(double emptyBaselineMm, double fullBaselineMm, int bottleCapacityMl,
                       long calibratedAtMs, boolean complete) {
        this.emptyBaselineMm = emptyBaselineMm;
        this.fullBaselineMm = fullBaselineMm;
        this.bottleCapacityMl = bottleCapacityMl;
        this.calibratedAtMs = calibratedAtMs;
        this.complete = complete;
    }

    /** Builds a calibration whose completeness is derived from the baselines. */
    public static Calibration of(double emptyBaselineMm, double fullBaselineMm, int bottleCapacityMl, long calibratedAtMs) {
        return new Calibration(emptyBaselineMm, fullBaselineMm, bottleCapacityMl, calibratedAtMs,
                baselinesValid(emptyBaselineMm, fullBaselineMm));
    }

    /** Blank starting point for a ritual with no previous baselines. */
    public static Calibration blank(int bottleCapacityMl) {
        return new Calibration(0.0, 0.0, bottleCapacityMl, 0L, false);
    }

    public static boolean baselinesValid(double emptyBaselineMm, double fullBaselineMm) {
        return emptyBaselineMm > fullBaselineMm && fullBaselineMm > 0.0;
    }

    public boolean hasEmptyBaseline() {
        return emptyBaselineMm > 0.0;
    }

    public boolean hasFullBaseline() {
        return fullBaselineMm > 0.0;
    }

    /** Completeness re-checked against the invariant; a stored flag alone is not trusted. */
    public boolean isComplete() {
        return complete && baselinesValid(emptyBaselineMm, fullBaselineMm);
    }

    public Calibration withEmptyBaseline(double mm, long atMs) {
        return Calibration.of(mm, fullBaselineMm, bottleCapacityMl, atMs);
    }

    public Calibration withFullBaseline(double mm, long atMs) {
        return Calibration.of(emptyBaselineMm, mm, bottleCapacityMl, atMs);
    }

    public Calibration withCapacity(int capacityMl) {
        return new Calibration(emptyBaselineMm, fullBaselineMm, capacityMl, calibratedAtMs, complete);
    }

    public void requireComplete() throws BottleException {
        if (!isComplete()) {
            throw new BottleException(ErrorKind.CALIBRATION_INVALID, String.format(Locale.US,
                    "Empty baseline (%.1fmm) must be greater than full baseline (%.1fmm)",
                    emptyBaselineMm, fullBaselineMm));
        }
    }

    /**
     * Fill level in percent: 100 at or above the water line of a full bottle, 0 at or
     * beyond the empty distance, linear in between.
     */
    public double computeLevelPct(double distanceMm) {
        if (distanceMm <= fullBaselineMm) return 100.0;
        if (distanceMm >= emptyBaselineMm) return 0.0;
        return ((emptyBaselineMm - distanceMm) / (emptyBaselineMm - fullBaselineMm)) * 100.0;
    }

    public double computeLevelPct(SensorReading reading) {
        return computeLevelPct(reading.distanceMm);
    }

    public double computeVolumeMl(SensorReading reading) {
        return computeLevelPct(reading) / 100.0 * bottleCapacityMl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Calibration)) return false;
        Calibration that = (Calibration) o;
        return Double.compare(that.emptyBaselineMm, emptyBaselineMm) == 0
                && Double.compare(that.fullBaselineMm, fullBaselineMm) == 0
                && bottleCapacityMl == that.bottleCapacityMl
                && calibratedAtMs == that.calibratedAtMs
                && complete == that.complete;
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(emptyBaselineMm, fullBaselineMm, bottleCapacityMl, calibratedAtMs, complete);
    }

    @Override
    public String toString() {
        return "Calibration{" +
                "emptyBaselineMm=" + emptyBaselineMm +
                ", fullBaselineMm=" + fullBaselineMm +
                ", bottleCapacityMl=" + bottleCapacityMl +
                ", calibratedAtMs=" + calibratedAtMs +
                ", complete=" + complete +
                '}';
    }
}
