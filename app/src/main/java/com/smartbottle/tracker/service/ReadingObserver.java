package com.smartbottle.tracker.service;

import com.smartbottle.tracker.data.SensorReading;
import com.smartbottle.tracker.logic.LevelEstimate;

import javax.annotation.Nonnull;

public interface ReadingObserver {
    void onReading(@Nonnull SensorReading reading, @Nonnull LevelEstimate level);
}
