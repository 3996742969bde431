package com.smartbottle.tracker.ble;

import java.util.UUID;

import javax.annotation.Nonnull;

/** A characteristic as reported by service discovery. Property bits use the standard GATT flag values. */
public final class GattCharacteristicInfo {
    public static final int PROPERTY_READ = 0x02;
    public static final int PROPERTY_WRITE_NO_RESPONSE = 0x04;
    public static final int PROPERTY_WRITE = 0x08;
    public static final int PROPERTY_NOTIFY = 0x10;
    public static final int PROPERTY_INDICATE = 0x20;

    @Nonnull
    public final UUID uuid;
    public final int properties;

    public GattCharacteristicInfo(@Nonnull UUID uuid, int properties) {
        this.uuid = uuid;
        this.properties = properties;
    }

    public boolean isNotifiable() {
        return (properties & (PROPERTY_NOTIFY | PROPERTY_INDICATE)) != 0;
    }

    public boolean isReadable() {
        return (properties & PROPERTY_READ) != 0;
    }

    public boolean isWritable() {
        return (properties & (PROPERTY_WRITE | PROPERTY_WRITE_NO_RESPONSE)) != 0;
    }

    @Override
    public String toString() {
        return "Characteristic{" + uuid + ", props=0x" + Integer.toHexString(properties) + '}';
    }
}
