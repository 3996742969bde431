package com.smartbottle.tracker.data;

// Completion signal for work that finishes on the session worker thread
public interface ResultCallback<T> {
    void onSuccess(T result);
    void onError(Exception e);
}
