package com.smartbottle.tracker.data;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A peripheral seen during one scan session. Handles are only meaningful until the
 * scan stops or a connection attempt resolves.
 */
public final class PeripheralHandle {
    @Nonnull
    public final String id;
    @Nullable
    public final String name;
    public final int rssi;
    /** True when the advertisement carried the bottle service UUID. */
    public final boolean advertisesService;

    public PeripheralHandle(@Nonnull String id, @Nullable String name, int rssi, boolean advertisesService) {
        this.id = id;
        this.name = name;
        this.rssi = rssi;
        this.advertisesService = advertisesService;
    }

    public static PeripheralHandle unresolved(@Nonnull String id) {
        return new PeripheralHandle(id, null, 0, false);
    }

    public PeripheralHandle withRssi(int newRssi) {
        return new PeripheralHandle(id, name, newRssi, advertisesService);
    }

    public String displayLabel() {
        return (name != null && !name.isEmpty()) ? name + " (" + id + ")" : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeripheralHandle)) return false;
        return id.equals(((PeripheralHandle) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "PeripheralHandle{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", rssi=" + rssi +
                ", advertisesService=" + advertisesService +
                '}';
    }
}
