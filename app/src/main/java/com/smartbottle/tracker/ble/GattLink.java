package com.smartbottle.tracker.ble;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import javax.annotation.Nonnull;

/**
 * An established radio link as exposed by the platform driver. Futures may complete on
 * any thread; the transport applies its own timeouts.
 */
public interface GattLink {

    @Nonnull
    String getDeviceId();

    CompletableFuture<List<GattServiceInfo>> discoverServices();

    /** Subscribes {@code sink} to value changes; completes once the CCC descriptor is written. */
    CompletableFuture<Void> enableNotifications(@Nonnull UUID service, @Nonnull UUID characteristic,
                                                @Nonnull Consumer<byte[]> sink);

    CompletableFuture<Void> write(@Nonnull UUID service, @Nonnull UUID characteristic, @Nonnull byte[] value);

    /**
     * Drops the link and frees the platform handle. Must not block and must tolerate
     * repeat calls; the future completes when the platform confirms the disconnect.
     */
    CompletableFuture<Void> close();
}
