package com.smartbottle.tracker.ble;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Boundary to the platform BLE stack. Everything above this interface is plain Java; a
 * mobile build implements it over its Bluetooth API.
 *
 * <p>Callbacks may arrive on any thread, concurrently with calls into the transport.
 */
public interface RadioDriver {

    interface ScanSink {
        void onAdvertisement(@Nonnull String deviceId, @Nullable String name, int rssi,
                             @Nonnull List<UUID> serviceUuids);

        void onScanFailed(int errorCode);
    }

    interface LinkEvents {
        /** Link dropped after {@link #connect} completed, by the peripheral or the radio. */
        void onDisconnected(@Nullable Throwable cause);
    }

    @Nonnull
    RadioState getRadioState();

    /**
     * Starts an unfiltered scan. Filtering happens in the transport so that named
     * peripherals can be offered when nothing advertises the bottle service.
     * @throws SecurityException when the scan permission is missing
     */
    void startScan(@Nonnull ScanSink sink);

    void stopScan();

    /**
     * Begins connecting. If the returned future is cancelled, the implementation must
     * abandon the attempt and release whatever radio resource it holds for it.
     */
    CompletableFuture<GattLink> connect(@Nonnull String deviceId, @Nonnull LinkEvents events);

    /** Releases the platform radio handle. No further calls follow. */
    void close();
}
