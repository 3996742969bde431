package com.smartbottle.tracker.ble;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public final class GattServiceInfo {
    @Nonnull
    public final UUID uuid;
    @Nonnull
    public final List<GattCharacteristicInfo> characteristics;

    public GattServiceInfo(@Nonnull UUID uuid, @Nonnull List<GattCharacteristicInfo> characteristics) {
        this.uuid = uuid;
        this.characteristics = Collections.unmodifiableList(new ArrayList<>(characteristics));
    }

    @Nullable
    public GattCharacteristicInfo find(@Nonnull UUID characteristicUuid) {
        for (GattCharacteristicInfo c : characteristics) {
            if (c.uuid.equals(characteristicUuid)) return c;
        }
        return null;
    }

    @Override
    public String toString() {
        return "Service{" + uuid + ", " + characteristics + '}';
    }
}
