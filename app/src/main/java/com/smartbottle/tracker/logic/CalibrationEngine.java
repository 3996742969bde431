package com.smartbottle.tracker.logic;

import com.smartbottle.tracker.data.BottleException;
import com.smartbottle.tracker.data.Calibration;
import com.smartbottle.tracker.data.SensorReading;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Runs the empty-then-full calibration ritual and converts distances to fill level.
 *
 * <pre>
 * IDLE --begin(EMPTY)--> COLLECTING_EMPTY --N readings--> IDLE (draft has empty baseline)
 * IDLE --begin(FULL)---> COLLECTING_FULL  --N readings--> IDLE (draft has full baseline, maybe complete)
 * </pre>
 *
 * The empty step keeps the maximum distance and the full step the minimum. Something
 * briefly in front of the sensor can only shorten the echo, so the extreme on the far
 * side of each step is the one noise cannot fake.
 *
 * <p>The ritual works on a draft. The active calibration, the one levels are computed
 * from, only changes when a full step completes with {@code empty > full}; a failed ritual
 * leaves it untouched. All buffer access happens under one lock so a reading lands in
 * exactly one step.
 */
public class CalibrationEngine {
    private static final Logger log = LoggerFactory.getLogger(CalibrationEngine.class);

    public enum Mode {
        IDLE,
        COLLECTING_EMPTY,
        COLLECTING_FULL
    }

    /** Outcome of a completed step. {@code error} is set only for an invalid full step. */
    public static final class StepResult {
        public final CalibrationStep step;
        public final double baselineMm;
        public final int sampleCount;
        public final double spreadMm;
        @Nonnull
        public final Calibration draft;
        @Nullable
        public final BottleException error;

        StepResult(CalibrationStep step, double baselineMm, int sampleCount, double spreadMm,
                   @Nonnull Calibration draft, @Nullable BottleException error) {
            this.step = step;
            this.baselineMm = baselineMm;
            this.sampleCount = sampleCount;
            this.spreadMm = spreadMm;
            this.draft = draft;
            this.error = error;
        }

        public boolean isRitualComplete() {
            return step == CalibrationStep.FULL && error == null;
        }

        @Override
        public String toString() {
            return "StepResult{" +
                    "step=" + step +
                    ", baselineMm=" + baselineMm +
                    ", sampleCount=" + sampleCount +
                    ", spreadMm=" + spreadMm +
                    ", draft=" + draft +
                    ", error=" + error +
                    '}';
        }
    }

    private final Object lock = new Object();
    private final int samplesPerStep;
    private final double[] buffer;
    private final int defaultCapacityMl;

    private int count = 0;
    private Mode mode = Mode.IDLE;
    @Nullable
    private Calibration draft;
    @Nullable
    private volatile Calibration active;

    public CalibrationEngine(int samplesPerStep, int defaultCapacityMl) {
        if (samplesPerStep <= 0) throw new IllegalArgumentException("samplesPerStep must be positive");
        this.samplesPerStep = samplesPerStep;
        this.buffer = new double[samplesPerStep];
        this.defaultCapacityMl = defaultCapacityMl;
    }

    /** Clears the buffer and arms the engine for the next {@code samplesPerStep} readings. */
    public void begin(@Nonnull CalibrationStep step) {
        synchronized (lock) {
            if (mode != Mode.IDLE) {
                log.info("Restarting calibration: " + mode + " abandoned for " + step);
            }
            Arrays.fill(buffer, 0.0);
            count = 0;
            if (draft == null) {
                Calibration current = active;
                draft = current != null ? current : Calibration.blank(defaultCapacityMl);
            }
            mode = (step == CalibrationStep.EMPTY) ? Mode.COLLECTING_EMPTY : Mode.COLLECTING_FULL;
            log.info("Calibration " + step + " armed, collecting " + samplesPerStep + " readings");
        }
    }

    /**
     * Disarms without writing a baseline. Partial buffers are discarded.
     * @return true if a step was armed
     */
    public boolean cancel() {
        synchronized (lock) {
            if (mode == Mode.IDLE) return false;
            log.info("Calibration " + mode + " cancelled after " + count + " of " + samplesPerStep + " readings");
            mode = Mode.IDLE;
            count = 0;
            return true;
        }
    }

    /**
     * Feeds one reading to the armed step.
     * @return the step result when this reading completed the step, otherwise null
     */
    @Nullable
    public StepResult offer(@Nonnull SensorReading reading) {
        synchronized (lock) {
            if (mode == Mode.IDLE) return null;
            buffer[count++] = reading.distanceMm;
            if (count < samplesPerStep) return null;
            return reduce(reading.timestampMs);
        }
    }

    private StepResult reduce(long atMs) {
        double[] samples = Arrays.copyOf(buffer, count);
        double spread = new StandardDeviation().evaluate(samples);
        CalibrationStep step;
        double baseline;
        Calibration base = draft != null ? draft : Calibration.blank(defaultCapacityMl);
        BottleException error = null;

        if (mode == Mode.COLLECTING_EMPTY) {
            step = CalibrationStep.EMPTY;
            baseline = StatUtils.max(samples);
            draft = base.withEmptyBaseline(baseline, atMs);
            log.info(String.format(Locale.US, "Empty calibration: max distance = %.1fmm from %d readings (sd %.2f)",
                    baseline, samples.length, spread));
        } else {
            step = CalibrationStep.FULL;
            baseline = StatUtils.min(samples);
            draft = base.withFullBaseline(baseline, atMs);
            log.info(String.format(Locale.US, "Full calibration: min distance = %.1fmm from %d readings (sd %.2f)",
                    baseline, samples.length, spread));
            try {
                draft.requireComplete();
                active = draft;
                log.info("Calibration complete: " + draft);
            } catch (BottleException e) {
                error = e;
                log.error("Invalid calibration: " + e.getMessage());
            }
        }

        mode = Mode.IDLE;
        count = 0;
        return new StepResult(step, baseline, samples.length, spread, draft, error);
    }

    /**
     * Rebinds the engine to another subject's stored calibration (or none). Any armed step
     * and the draft belong to the previous subject and are dropped.
     */
    public void setActive(@Nullable Calibration calibration) {
        synchronized (lock) {
            mode = Mode.IDLE;
            count = 0;
            draft = null;
            active = calibration;
        }
    }

    /**
     * Refreshes the active calibration for the same subject. An armed step and the draft
     * are kept, so a ritual survives a reconnect.
     */
    public void replaceActive(@Nullable Calibration calibration) {
        synchronized (lock) {
            active = calibration;
        }
    }

    /** Capacity change on the active calibration; returns the updated value or null if none. */
    @Nullable
    public Calibration updateCapacity(int capacityMl) {
        synchronized (lock) {
            if (draft != null) draft = draft.withCapacity(capacityMl);
            Calibration current = active;
            if (current == null) return null;
            active = current.withCapacity(capacityMl);
            return active;
        }
    }

    @Nullable
    public Calibration getActive() {
        return active;
    }

    @Nullable
    public Calibration getDraft() {
        synchronized (lock) {
            return draft;
        }
    }

    public Mode getMode() {
        synchronized (lock) {
            return mode;
        }
    }

    public boolean isArmed() {
        return getMode() != Mode.IDLE;
    }

    /** Readings collected so far in the armed step. */
    public int getCollectedCount() {
        synchronized (lock) {
            return count;
        }
    }

    public int getSamplesPerStep() {
        return samplesPerStep;
    }

    public boolean isCalibrated() {
        Calibration c = active;
        return c != null && c.isComplete();
    }

    public boolean isEmptyCalibrated() {
        Calibration c = latest();
        return c != null && c.hasEmptyBaseline();
    }

    public boolean isFullCalibrated() {
        Calibration c = latest();
        return c != null && c.hasFullBaseline();
    }

    /**
     * Fill level from the active calibration.
     * @throws IllegalStateException when no complete calibration is active
     */
    public double computeLevelPct(@Nonnull SensorReading reading) {
        return requireActive().computeLevelPct(reading);
    }

    public double computeVolumeMl(@Nonnull SensorReading reading) {
        return requireActive().computeVolumeMl(reading);
    }

    private Calibration requireActive() {
        Calibration c = active;
        if (c == null || !c.isComplete()) {
            throw new IllegalStateException("No complete calibration is active");
        }
        return c;
    }

    @Nullable
    private Calibration latest() {
        synchronized (lock) {
            return draft != null ? draft : active;
        }
    }
}
