package com.smartbottle.tracker.logic;

import java.util.Locale;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Fill level computed for one reading, with its provenance. */
public final class LevelEstimate {
    public final double levelPct;
    public final double volumeMl;
    @Nonnull
    public final LevelSource source;
    /** Subject the reading was attributed to, null when none was bound. */
    @Nullable
    public final String subjectId;

    public LevelEstimate(double levelPct, double volumeMl, @Nonnull LevelSource source, @Nullable String subjectId) {
        this.levelPct = levelPct;
        this.volumeMl = volumeMl;
        this.source = source;
        this.subjectId = subjectId;
    }

    public boolean isCalibrated() {
        return source == LevelSource.CALIBRATED;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "LevelEstimate{%.1f%%, %.0fml, %s, subject=%s}",
                levelPct, volumeMl, source, subjectId);
    }
}
