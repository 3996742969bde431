package com.smartbottle.tracker.data;

import java.io.IOException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Persistence collaborator for calibrations, keyed by subject id (the user, or a
 * caretaker-monitored patient).
 */
public interface CalibrationStore {

    /** @return the stored calibration, or null when the subject was never calibrated */
    @Nullable
    Calibration load(@Nonnull String subjectId) throws IOException;

    void save(@Nonnull String subjectId, @Nonnull Calibration calibration) throws IOException;

    void clear(@Nonnull String subjectId) throws IOException;
}
