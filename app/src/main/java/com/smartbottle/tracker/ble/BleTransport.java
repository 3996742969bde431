package com.smartbottle.tracker.ble;

import com.smartbottle.tracker.Constants;
import com.smartbottle.tracker.data.BottleException;
import com.smartbottle.tracker.data.ErrorKind;
import com.smartbottle.tracker.data.PeripheralHandle;
import com.smartbottle.tracker.data.Setting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Owns the one radio link. Scans for the bottle, connects with a bounded wait, resolves
 * the telemetry and control characteristics, and writes control commands.
 *
 * <p>Every teardown (caller disconnect, peripheral drop, failed setup, shutdown) runs
 * through {@link #releaseLink}, which clears the link references under the lock before
 * anyone is told about it. After a failed connect the adapter is always back to idle.
 */
public class BleTransport {
    private static final Logger log = LoggerFactory.getLogger(BleTransport.class);

    enum LinkState {
        IDLE,
        CONNECTING,
        CONNECTED
    }

    /** Orders scan results: bottle-service advertisers first, then strongest signal. */
    static final Comparator<PeripheralHandle> DEVICE_ORDER =
            Comparator.comparing((PeripheralHandle p) -> !p.advertisesService)
                    .thenComparing(p -> -p.rssi);

    private final RadioDriver driver;
    private final Setting setting;
    private final Object lock = new Object();

    @Nullable
    private volatile TransportListener listener;

    // scan state, guarded by lock
    private boolean scanning = false;
    private final Map<String, PeripheralHandle> seen = new LinkedHashMap<>();
    @Nullable
    private CountDownLatch scanDone;
    @Nullable
    private Integer scanFailure;
    @Nullable
    private DeviceListListener deviceListener;

    // link state, guarded by lock
    private LinkState linkState = LinkState.IDLE;
    private int attempt = 0;
    @Nullable
    private CompletableFuture<GattLink> pendingConnect;
    @Nullable
    private GattLink link;
    @Nullable
    private BottleLink current;

    public BleTransport(@Nonnull RadioDriver driver, @Nonnull Setting setting) {
        this.driver = driver;
        this.setting = setting;
    }

    public void setListener(@Nullable TransportListener listener) {
        this.listener = listener;
    }

    public RadioState getRadioState() {
        return driver.getRadioState();
    }

    // ---------------------------------------------------------------------------------
    // Scanning
    // ---------------------------------------------------------------------------------

    /**
     * Scans for up to {@code timeoutMs} and returns what was seen. Blocks the calling
     * thread. Running out of time is the normal way a scan ends, so it is not an error.
     * Calling this while another scan runs returns the current list immediately.
     *
     * @param onUpdate optional, receives the full list whenever it changes
     * @throws BottleException RADIO_UNAVAILABLE or PERMISSION_DENIED
     */
    public List<PeripheralHandle> scan(long timeoutMs, @Nullable DeviceListListener onUpdate) throws BottleException {
        CountDownLatch done;
        synchronized (lock) {
            if (scanning) {
                log.debug("Scan already running, returning snapshot");
                return snapshotLocked();
            }
            checkRadio();
            scanning = true;
            seen.clear();
            scanFailure = null;
            deviceListener = onUpdate;
            done = scanDone = new CountDownLatch(1);
        }

        try {
            driver.startScan(scanSink);
        } catch (SecurityException se) {
            finishScan();
            throw new BottleException(ErrorKind.PERMISSION_DENIED, "Missing scan permission", se);
        } catch (RuntimeException e) {
            finishScan();
            throw new BottleException(ErrorKind.RADIO_UNAVAILABLE, "Scan could not start: " + e.getMessage(), e);
        }
        log.info("Scan started (" + timeoutMs + "ms window)");

        try {
            if (!done.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.info("Scan window elapsed");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.info("Scan interrupted");
        }

        Integer failure;
        synchronized (lock) {
            failure = scanFailure;
        }
        List<PeripheralHandle> found = finishScan();
        if (failure != null && found.isEmpty()) {
            throw new BottleException(ErrorKind.RADIO_UNAVAILABLE, "Scan failed with error code: " + failure);
        }
        log.info("Scan finished with " + found.size() + " device(s)");
        return found;
    }

    /** Ends a running scan early; the blocked {@link #scan} call returns its list. */
    public void stopScan() {
        CountDownLatch done;
        synchronized (lock) {
            done = scanning ? scanDone : null;
        }
        if (done != null) done.countDown();
    }

    public boolean isScanning() {
        synchronized (lock) {
            return scanning;
        }
    }

    /** Devices seen by the current or most recent scan. */
    public List<PeripheralHandle> getSeenDevices() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    private List<PeripheralHandle> finishScan() {
        List<PeripheralHandle> result;
        boolean wasScanning;
        synchronized (lock) {
            wasScanning = scanning;
            scanning = false;
            deviceListener = null;
            if (scanDone != null) scanDone.countDown();
            scanDone = null;
            result = snapshotLocked();
        }
        if (wasScanning) {
            try {
                driver.stopScan();
            } catch (SecurityException se) {
                log.error("SecurityException stopping scan: " + se.getMessage(), se);
            } catch (RuntimeException e) {
                log.error("Error stopping scan: " + e.getMessage(), e);
            }
        }
        return result;
    }

    private List<PeripheralHandle> snapshotLocked() {
        List<PeripheralHandle> list = new ArrayList<>(seen.values());
        list.sort(DEVICE_ORDER);
        return list;
    }

    private final RadioDriver.ScanSink scanSink = new RadioDriver.ScanSink() {
        @Override
        public void onAdvertisement(@Nonnull String deviceId, @Nullable String name, int rssi,
                                    @Nonnull List<UUID> serviceUuids) {
            handleAdvertisement(deviceId, name, rssi, serviceUuids);
        }

        @Override
        public void onScanFailed(int errorCode) {
            log.error("Scan failed with error code: " + errorCode);
            CountDownLatch done;
            synchronized (lock) {
                scanFailure = errorCode;
                done = scanDone;
            }
            if (done != null) done.countDown();
        }
    };

    private void handleAdvertisement(String deviceId, @Nullable String name, int rssi, List<UUID> serviceUuids) {
        boolean bottle = serviceUuids.contains(Constants.SERVICE_UUID) || Constants.DEVICE_NAME.equals(name);
        boolean named = name != null && !name.trim().isEmpty();
        if (!bottle && !(named && setting.includeNamedDevices())) return;

        List<PeripheralHandle> update = null;
        DeviceListListener target;
        synchronized (lock) {
            if (!scanning) return;
            target = deviceListener;
            PeripheralHandle before = seen.get(deviceId);
            if (before == null) {
                seen.put(deviceId, new PeripheralHandle(deviceId, name, rssi, bottle));
                log.info("Found " + (bottle ? "bottle " : "named device ") + name + " (" + deviceId + ") rssi " + rssi);
                update = snapshotLocked();
            } else if (before.rssi != rssi) {
                seen.put(deviceId, before.withRssi(rssi));
                update = snapshotLocked();
            }
        }
        if (update != null && target != null) {
            try {
                target.onDevicesChanged(update);
            } catch (RuntimeException e) {
                log.error("Device list listener threw", e);
            }
        }
    }

    // ---------------------------------------------------------------------------------
    // Link
    // ---------------------------------------------------------------------------------

    /**
     * Connects, discovers services, resolves the characteristics and enables
     * notifications, all inside {@code timeoutMs}. Notifications start flowing to the
     * listener as soon as they are enabled.
     *
     * @throws BottleException RADIO_UNAVAILABLE, PERMISSION_DENIED, CONNECT_TIMEOUT,
     *         CONNECT_FAILED, SERVICE_NOT_FOUND, CHARACTERISTIC_NOT_FOUND, or CANCELLED
     *         when {@link #disconnect} ran meanwhile
     * @throws IllegalStateException when a link is already up or being set up
     */
    public BottleLink connect(@Nonnull String deviceId, long timeoutMs) throws BottleException {
        final int myAttempt;
        synchronized (lock) {
            if (linkState != LinkState.IDLE) {
                throw new IllegalStateException("Link busy (" + linkState + ")");
            }
            checkRadio();
            linkState = LinkState.CONNECTING;
            myAttempt = ++attempt;
        }
        stopScan();

        long deadline = System.currentTimeMillis() + timeoutMs;
        try {
            CompletableFuture<GattLink> future;
            try {
                future = driver.connect(deviceId, cause -> onPeripheralDisconnected(myAttempt, deviceId, cause));
            } catch (SecurityException se) {
                throw new BottleException(ErrorKind.PERMISSION_DENIED, "Missing connect permission", se);
            }
            boolean stale;
            synchronized (lock) {
                stale = attempt != myAttempt || linkState != LinkState.CONNECTING;
                if (!stale) pendingConnect = future;
            }
            if (stale) {
                future.cancel(true);
                throw new BottleException(ErrorKind.CANCELLED, "Connect to " + deviceId + " cancelled");
            }
            log.info("Connecting to " + deviceId);

            GattLink gl = await(future, remaining(deadline), ErrorKind.CONNECT_TIMEOUT, ErrorKind.CONNECT_FAILED,
                    "connect to " + deviceId);
            synchronized (lock) {
                pendingConnect = null;
                if (attempt != myAttempt || linkState != LinkState.CONNECTING) {
                    gl.close();
                    throw new BottleException(ErrorKind.CANCELLED, "Connect to " + deviceId + " cancelled");
                }
                link = gl;
            }

            List<GattServiceInfo> services = await(gl.discoverServices(), remaining(deadline),
                    ErrorKind.CONNECT_TIMEOUT, ErrorKind.SERVICE_NOT_FOUND, "service discovery");
            BottleLink resolved = resolve(deviceId, services);

            await(gl.enableNotifications(resolved.serviceUuid, resolved.dataCharacteristic,
                            bytes -> deliver(myAttempt, deviceId, bytes)),
                    remaining(deadline), ErrorKind.CONNECT_TIMEOUT, ErrorKind.CHARACTERISTIC_NOT_FOUND,
                    "enable notifications");

            synchronized (lock) {
                requireAttempt(myAttempt);
                current = resolved;
                linkState = LinkState.CONNECTED;
            }
            log.info("Connected: " + resolved);
            return resolved;
        } catch (BottleException e) {
            log.warn("Connect to " + deviceId + " failed: " + e.getMessage());
            releaseAttempt(myAttempt, "connect failed");
            throw e;
        } catch (RuntimeException e) {
            releaseAttempt(myAttempt, "connect failed");
            throw new BottleException(ErrorKind.CONNECT_FAILED, "Connect to " + deviceId + " failed: " + e, e);
        }
    }

    /**
     * Writes one command to the control characteristic of {@code target}.
     * @throws BottleException WRITE_FAILED when the link is gone, has no writable
     *         characteristic, or the write does not complete within the write timeout
     */
    public void write(@Nonnull BottleLink target, @Nonnull byte[] value) throws BottleException {
        GattLink gl;
        synchronized (lock) {
            if (linkState != LinkState.CONNECTED || current != target || link == null) {
                throw new BottleException(ErrorKind.WRITE_FAILED, "Not connected to " + target.deviceId);
            }
            gl = link;
        }
        UUID control = target.controlCharacteristic;
        if (control == null) {
            throw new BottleException(ErrorKind.WRITE_FAILED, "No writable characteristic on " + target.deviceId);
        }
        await(gl.write(target.serviceUuid, control, value), setting.writeTimeoutMs(),
                ErrorKind.WRITE_FAILED, ErrorKind.WRITE_FAILED, "write");
        if (log.isDebugEnabled()) {
            log.debug("Wrote " + value.length + " bytes to " + target.deviceId);
        }
    }

    /**
     * Drops the link or aborts a connect in progress. Safe in any state. Waits up to the
     * disconnect timeout for the platform to confirm.
     */
    public void disconnect() {
        CompletableFuture<Void> closing = releaseLink("caller disconnect", null, false);
        if (closing == null) return;
        try {
            closing.get(setting.disconnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Disconnect not confirmed within " + setting.disconnectTimeoutMs() + "ms");
        } catch (ExecutionException e) {
            log.warn("Disconnect reported failure: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Nullable
    public BottleLink getCurrentLink() {
        synchronized (lock) {
            return current;
        }
    }

    public boolean isLinked() {
        synchronized (lock) {
            return linkState == LinkState.CONNECTED;
        }
    }

    LinkState getLinkState() {
        synchronized (lock) {
            return linkState;
        }
    }

    /** Stops scanning, drops the link and closes the driver. */
    public void shutdown() {
        stopScan();
        releaseLink("shutdown", null, false);
        try {
            driver.close();
        } catch (RuntimeException e) {
            log.error("Error closing radio driver", e);
        }
        log.info("Transport shut down");
    }

    private void onPeripheralDisconnected(int forAttempt, String deviceId, @Nullable Throwable cause) {
        synchronized (lock) {
            if (forAttempt != attempt || linkState == LinkState.IDLE) return;
        }
        log.warn("Link to " + deviceId + " lost" + (cause != null ? ": " + cause.getMessage() : ""));
        releaseLink("peripheral disconnected", cause, true);
    }

    private void deliver(int forAttempt, String deviceId, byte[] payload) {
        synchronized (lock) {
            if (forAttempt != attempt || linkState == LinkState.IDLE) return;
        }
        TransportListener l = listener;
        if (l == null) return;
        try {
            l.onNotification(deviceId, payload);
        } catch (RuntimeException e) {
            log.error("Notification listener threw", e);
        }
    }

    private void releaseAttempt(int forAttempt, String reason) {
        synchronized (lock) {
            if (forAttempt != attempt) return;
        }
        releaseLink(reason, null, false);
    }

    /**
     * The single teardown path. References are cleared under the lock first, then the
     * pending connect is cancelled and the link closed, then the listener is told.
     *
     * @return the close confirmation, or null when there was nothing to release
     */
    @Nullable
    private CompletableFuture<Void> releaseLink(String reason, @Nullable Throwable cause, boolean notify) {
        GattLink toClose;
        CompletableFuture<GattLink> pending;
        String deviceId;
        boolean wasConnected;
        synchronized (lock) {
            if (linkState == LinkState.IDLE && link == null && pendingConnect == null) return null;
            toClose = link;
            pending = pendingConnect;
            deviceId = current != null ? current.deviceId : (toClose != null ? toClose.getDeviceId() : null);
            wasConnected = linkState == LinkState.CONNECTED;
            link = null;
            current = null;
            pendingConnect = null;
            linkState = LinkState.IDLE;
            // stale callbacks from the released attempt are ignored from here on
            attempt++;
        }

        if (pending != null) pending.cancel(true);
        CompletableFuture<Void> closing = CompletableFuture.completedFuture(null);
        if (toClose != null) {
            try {
                closing = toClose.close();
            } catch (RuntimeException e) {
                log.error("Error closing link: " + e.getMessage(), e);
            }
        }
        log.info("Link released (" + reason + ")" + (deviceId != null ? " for " + deviceId : ""));

        TransportListener l = listener;
        if (notify && wasConnected && deviceId != null && l != null) {
            try {
                l.onLinkLost(deviceId, cause);
            } catch (RuntimeException e) {
                log.error("Link-lost listener threw", e);
            }
        }
        return closing;
    }

    private void requireAttempt(int forAttempt) throws BottleException {
        if (forAttempt != attempt || linkState != LinkState.CONNECTING) {
            throw new BottleException(ErrorKind.CANCELLED, "Connect cancelled");
        }
    }

    private void checkRadio() throws BottleException {
        RadioState state = driver.getRadioState();
        switch (state) {
            case POWERED_ON:
                return;
            case UNAUTHORIZED:
                throw new BottleException(ErrorKind.PERMISSION_DENIED, "Bluetooth permission not granted");
            default:
                throw new BottleException(ErrorKind.RADIO_UNAVAILABLE, "Bluetooth " + state);
        }
    }

    /**
     * Picks the data and control characteristics. The bottle service and characteristic
     * are preferred; otherwise the first notifiable, then the first readable
     * characteristic is used so older firmware still streams.
     */
    static BottleLink resolve(String deviceId, List<GattServiceInfo> services) throws BottleException {
        GattServiceInfo service = null;
        for (GattServiceInfo s : services) {
            if (s.uuid.equals(Constants.SERVICE_UUID)) {
                service = s;
                break;
            }
        }

        GattCharacteristicInfo data;
        boolean fallback = false;
        if (service != null) {
            data = service.find(Constants.CHARACTERISTIC_UUID);
            if (data == null) {
                data = firstUsable(service);
                fallback = true;
            }
            if (data == null) {
                throw new BottleException(ErrorKind.CHARACTERISTIC_NOT_FOUND,
                        "Bottle service on " + deviceId + " has no readable characteristic");
            }
        } else {
            data = null;
            for (GattServiceInfo s : services) {
                GattCharacteristicInfo candidate = firstUsable(s);
                if (candidate == null) continue;
                if (data == null || (candidate.isNotifiable() && !data.isNotifiable())) {
                    service = s;
                    data = candidate;
                }
                if (data.isNotifiable()) break;
            }
            if (service == null || data == null) {
                throw new BottleException(ErrorKind.SERVICE_NOT_FOUND,
                        "Bottle service not found on " + deviceId + " (" + services.size() + " services)");
            }
            fallback = true;
        }
        if (fallback) {
            log.warn("Using fallback characteristic " + data.uuid + " in service " + service.uuid);
        }

        UUID control = null;
        if (data.isWritable()) {
            control = data.uuid;
        } else {
            for (GattCharacteristicInfo c : service.characteristics) {
                if (c.isWritable()) {
                    control = c.uuid;
                    break;
                }
            }
        }
        return new BottleLink(deviceId, service.uuid, data.uuid, control, fallback, System.currentTimeMillis());
    }

    @Nullable
    private static GattCharacteristicInfo firstUsable(GattServiceInfo service) {
        for (GattCharacteristicInfo c : service.characteristics) {
            if (c.isNotifiable()) return c;
        }
        for (GattCharacteristicInfo c : service.characteristics) {
            if (c.isReadable()) return c;
        }
        return null;
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.currentTimeMillis());
    }

    private static <T> T await(CompletableFuture<T> future, long timeoutMs, ErrorKind onTimeout,
                               ErrorKind onFailure, String what) throws BottleException {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BottleException(onTimeout, what + " timed out after " + timeoutMs + "ms", e);
        } catch (CancellationException e) {
            throw new BottleException(ErrorKind.CANCELLED, what + " cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SecurityException) {
                throw new BottleException(ErrorKind.PERMISSION_DENIED, what + ": " + cause.getMessage(), cause);
            }
            if (cause instanceof CancellationException) {
                throw new BottleException(ErrorKind.CANCELLED, what + " cancelled", cause);
            }
            throw new BottleException(onFailure, what + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BottleException(ErrorKind.CANCELLED, what + " interrupted", e);
        }
    }
}
