package com.smartbottle.tracker.data;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Lifecycle of the single physical link. Instances are immutable snapshots; the
 * session coordinator swaps them under its state lock.
 */
public final class ConnectionState {

    public enum Phase {
        IDLE,
        SCANNING,
        CONNECTING,
        CONNECTED,
        DISCONNECTING,
        FAULTED
    }

    private static final ConnectionState IDLE = new ConnectionState(Phase.IDLE, null, null, null);
    private static final ConnectionState SCANNING = new ConnectionState(Phase.SCANNING, null, null, null);
    private static final ConnectionState DISCONNECTING = new ConnectionState(Phase.DISCONNECTING, null, null, null);

    @Nonnull
    public final Phase phase;
    /** Set for CONNECTING and CONNECTED. */
    @Nullable
    public final PeripheralHandle peripheral;
    /** Set for FAULTED. */
    @Nullable
    public final ErrorKind fault;
    @Nullable
    public final String faultMessage;

    private ConnectionState(@Nonnull Phase phase, @Nullable PeripheralHandle peripheral,
                            @Nullable ErrorKind fault, @Nullable String faultMessage) {
        this.phase = phase;
        this.peripheral = peripheral;
        this.fault = fault;
        this.faultMessage = faultMessage;
    }

    public static ConnectionState idle() { return IDLE; }
    public static ConnectionState scanning() { return SCANNING; }
    public static ConnectionState disconnecting() { return DISCONNECTING; }

    public static ConnectionState connecting(@Nonnull PeripheralHandle peripheral) {
        return new ConnectionState(Phase.CONNECTING, peripheral, null, null);
    }

    public static ConnectionState connected(@Nonnull PeripheralHandle peripheral) {
        return new ConnectionState(Phase.CONNECTED, peripheral, null, null);
    }

    public static ConnectionState faulted(@Nonnull ErrorKind kind, @Nullable String message) {
        return new ConnectionState(Phase.FAULTED, null, kind, message);
    }

    public boolean isConnected() {
        return phase == Phase.CONNECTED;
    }

    @Override
    public String toString() {
        switch (phase) {
            case CONNECTING:
            case CONNECTED:
                return phase + "(" + (peripheral != null ? peripheral.displayLabel() : "?") + ")";
            case FAULTED:
                return phase + "(" + fault + (faultMessage != null ? ": " + faultMessage : "") + ")";
            default:
                return phase.name();
        }
    }
}
