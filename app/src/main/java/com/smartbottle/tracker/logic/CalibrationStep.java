package com.smartbottle.tracker.logic;

import com.smartbottle.tracker.Constants;

public enum CalibrationStep {
    /** Bottle on the base with no water: keep the farthest echo. */
    EMPTY(Constants.STEP_START_EMPTY),
    /** Bottle filled to the brim: keep the closest echo. */
    FULL(Constants.STEP_START_FULL);

    /** Value of {@code step} in the calibration control envelope. */
    public final String wireName;

    CalibrationStep(String wireName) {
        this.wireName = wireName;
    }
}
