package com.smartbottle.tracker.ble;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public interface TransportListener {
    /** One notification payload. Called on the radio's callback thread; keep it short. */
    void onNotification(@Nonnull String deviceId, @Nonnull byte[] payload);

    /** The peripheral or radio dropped an established link. Cleanup has already run. */
    void onLinkLost(@Nonnull String deviceId, @Nullable Throwable cause);
}
