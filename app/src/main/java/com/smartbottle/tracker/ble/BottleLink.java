package com.smartbottle.tracker.ble;

import java.util.UUID;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Connection handle returned by {@link BleTransport#connect}: which device is linked and
 * which characteristics were resolved on it.
 */
public final class BottleLink {
    @Nonnull
    public final String deviceId;
    @Nonnull
    public final UUID serviceUuid;
    @Nonnull
    public final UUID dataCharacteristic;
    /** Null when the resolved service exposes nothing writable. */
    @Nullable
    public final UUID controlCharacteristic;
    /** True when the expected service/characteristic was missing and a fallback was used. */
    public final boolean fallback;
    public final long connectedAtMs;

    public BottleLink(@Nonnull String deviceId, @Nonnull UUID serviceUuid, @Nonnull UUID dataCharacteristic,
                      @Nullable UUID controlCharacteristic, boolean fallback, long connectedAtMs) {
        this.deviceId = deviceId;
        this.serviceUuid = serviceUuid;
        this.dataCharacteristic = dataCharacteristic;
        this.controlCharacteristic = controlCharacteristic;
        this.fallback = fallback;
        this.connectedAtMs = connectedAtMs;
    }

    @Override
    public String toString() {
        return "BottleLink{" +
                "deviceId='" + deviceId + '\'' +
                ", service=" + serviceUuid +
                ", data=" + dataCharacteristic +
                ", control=" + controlCharacteristic +
                ", fallback=" + fallback +
                '}';
    }
}
