package com.smartbottle.tracker.data;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public class BottleException extends Exception {

    @Nonnull
    private final ErrorKind kind;

    public BottleException(@Nonnull ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BottleException(@Nonnull ErrorKind kind, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "BottleException{" + kind + ": " + getMessage() + '}';
    }
}
