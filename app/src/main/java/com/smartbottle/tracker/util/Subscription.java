package com.smartbottle.tracker.util;

/**
 * Handle returned by every subscribe call. Unsubscribing is idempotent and safe while an
 * event is being delivered; the observer sees no further events once it returns.
 */
public interface Subscription {
    void unsubscribe();

    boolean isActive();
}
