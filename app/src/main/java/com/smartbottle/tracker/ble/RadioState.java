package com.smartbottle.tracker.ble;

public enum RadioState {
    POWERED_ON,
    POWERED_OFF,
    /** Scan/connect permission not granted to the app. */
    UNAUTHORIZED,
    UNSUPPORTED,
    /** Adapter resetting or state not yet reported. */
    UNKNOWN
}
