package com.smartbottle.tracker.service;

import com.smartbottle.tracker.data.ConnectionState;

import javax.annotation.Nonnull;

public interface ConnectionObserver {
    void onConnectionState(@Nonnull ConnectionState state);
}
