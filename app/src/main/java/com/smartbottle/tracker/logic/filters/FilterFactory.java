package com.smartbottle.tracker.logic.filters;

import com.smartbottle.tracker.data.Setting;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

/**
 * Builds the physical-sanity chain a reading must pass before its distance is turned
 * into a level. A rejected reading is reported as "no bottle" (level 0).
 */
public final class FilterFactory {

    private FilterFactory() {}

    @Nonnull
    public static List<ReadingFilter> build(@Nonnull Setting s) {
        List<ReadingFilter> list = new ArrayList<>(2);
        list.add(new MinDistanceFilter(s.minValidDistanceMm()));
        return list;
    }

    public static boolean acceptsAll(@Nonnull List<ReadingFilter> filters, long timestampMs, double distanceMm) {
        for (ReadingFilter f : filters) {
            if (!f.shouldAccept(timestampMs, distanceMm)) return false;
        }
        return true;
    }
}
