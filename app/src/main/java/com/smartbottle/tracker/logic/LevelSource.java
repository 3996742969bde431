package com.smartbottle.tracker.logic;

/** Where a reported fill level came from. Observers should treat anything but CALIBRATED as low confidence. */
public enum LevelSource {
    /** Computed from this subject's two-point calibration. */
    CALIBRATED,
    /** No calibration yet; the firmware's own percentage, which may assume different baselines. */
    DEVICE_REPORTED,
    /** Distance below the validity floor: the bottle is off the sensor. Level forced to 0. */
    NO_BOTTLE,
    /** Neither a calibration nor a firmware percentage. Level reported as 0. */
    UNAVAILABLE
}
