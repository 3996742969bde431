package com.smartbottle.tracker;

import java.util.UUID;

public class Constants {
    // GATT layout advertised by the bottle firmware
    public static final UUID SERVICE_UUID = UUID.fromString("4fafc201-1fb5-459e-8fcc-c5c9c331914b");
    public static final UUID CHARACTERISTIC_UUID = UUID.fromString("beb5483e-36e1-4688-b7f5-ea07361b26a8");
    public static final String DEVICE_NAME = "SmartWaterBottle";

    // Control envelope actions
    public static final String ACTION_DEEP_SLEEP = "deep_sleep";
    public static final String ACTION_WAKE = "wake";
    public static final String ACTION_CALIBRATION = "calibration";
    public static final String ACTION_CONFIG_UPDATE = "config_update";

    public static final String STEP_START_EMPTY = "start_empty";
    public static final String STEP_START_FULL = "start_full";
    public static final String STEP_COMPLETE = "complete";

    public static final String SETTINGS_RESOURCE = "smartbottle-settings.json";
}
