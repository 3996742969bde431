package com.smartbottle.tracker.service;

import com.smartbottle.tracker.logic.LevelSource;

import javax.annotation.Nonnull;

/**
 * Consumption-accounting collaborator. Receives the volume currently in the bottle for
 * each attributed reading; working out how much was drunk is up to the implementation.
 */
public interface ConsumptionSink {
    void onVolume(@Nonnull String subjectId, double volumeMl, long timestampMs, @Nonnull LevelSource source);
}
