package com.smartbottle.tracker.service;

import com.smartbottle.tracker.ble.BleTransport;
import com.smartbottle.tracker.ble.BottleLink;
import com.smartbottle.tracker.ble.DeviceListListener;
import com.smartbottle.tracker.ble.TransportListener;
import com.smartbottle.tracker.data.BottleException;
import com.smartbottle.tracker.data.Calibration;
import com.smartbottle.tracker.data.CalibrationStore;
import com.smartbottle.tracker.data.ConnectionState;
import com.smartbottle.tracker.data.ErrorKind;
import com.smartbottle.tracker.data.PeripheralHandle;
import com.smartbottle.tracker.data.ResultCallback;
import com.smartbottle.tracker.data.SensorReading;
import com.smartbottle.tracker.data.Setting;
import com.smartbottle.tracker.logic.CalibrationEngine;
import com.smartbottle.tracker.logic.CalibrationStep;
import com.smartbottle.tracker.logic.CommandEncoder;
import com.smartbottle.tracker.logic.LevelEstimate;
import com.smartbottle.tracker.logic.LevelSource;
import com.smartbottle.tracker.logic.TelemetryDecoder;
import com.smartbottle.tracker.logic.filters.FilterFactory;
import com.smartbottle.tracker.logic.filters.ReadingFilter;
import com.smartbottle.tracker.util.ObserverRegistry;
import com.smartbottle.tracker.util.Subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Root of the bottle session. Owns the {@link ConnectionState}, routes decoded readings
 * to calibration and observers, attributes them to the active subject, and exposes the
 * commands the UI layer drives.
 *
 * <p>Threads:
 * <ul>
 *   <li>callers: connect/disconnect/commands, serialized against each other by {@code stateLock}</li>
 *   <li>"bottle-session-worker": decodes and dispatches notifications in arrival order, runs sleep timers</li>
 *   <li>"bottle-scan": runs the blocking scan</li>
 *   <li>the delivery executor: observer callbacks, one mailbox per observer</li>
 * </ul>
 * The radio callback thread only enqueues onto the worker.
 */
public class SessionCoordinator implements TransportListener {
    private static final Logger log = LoggerFactory.getLogger(SessionCoordinator.class);

    private final BleTransport transport;
    private final CalibrationStore store;
    private final Setting setting;

    private final TelemetryDecoder decoder = new TelemetryDecoder();
    private final CalibrationEngine engine;
    private final List<ReadingFilter> filters;

    private final ScheduledExecutorService worker;
    private final ExecutorService scanExecutor;
    @Nullable
    private final ExecutorService ownedDeliveryExecutor;

    private final ObserverRegistry<ReadingObserver> readingObservers;
    private final ObserverRegistry<ConnectionObserver> connectionObservers;
    private final ObserverRegistry<DeviceListListener> deviceObservers;
    private final ObserverRegistry<ConsumptionSink> consumers;

    private final Object stateLock = new Object();
    private ConnectionState state = ConnectionState.idle();
    private boolean connectInFlight = false;
    /** Bumped whenever the current link or connect attempt is abandoned. */
    private int generation = 0;
    @Nullable
    private BottleLink link;
    @Nullable
    private ScheduledFuture<?> pendingSleep;

    @Nullable
    private volatile String activeSubject;
    @Nullable
    private ResultCallback<Calibration> calibrationCallback;
    /** Subject the armed ritual belongs to. */
    @Nullable
    private String calibrationSubject;

    private volatile long lastReadingAtMs = 0L;
    @Nullable
    private volatile LevelEstimate lastEstimate;
    private final AtomicLong readingsWithoutSubject = new AtomicLong();

    private volatile boolean shutdown = false;

    /** Observer callbacks run on a private pool; each observer is delivered to in order. */
    public SessionCoordinator(@Nonnull BleTransport transport, @Nonnull CalibrationStore store,
                              @Nullable ConsumptionSink sink, @Nonnull Setting setting) {
        this(transport, store, sink, setting, null);
    }

    public SessionCoordinator(@Nonnull BleTransport transport, @Nonnull CalibrationStore store,
                              @Nullable ConsumptionSink sink, @Nonnull Setting setting,
                              @Nullable Executor deliveryExecutor) {
        this.transport = transport;
        this.store = store;
        this.setting = setting;
        this.engine = new CalibrationEngine(setting.calibrationSampleCount(), setting.defaultBottleCapacityMl());
        this.filters = FilterFactory.build(setting);

        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bottle-session-worker");
            t.setDaemon(true);
            return t;
        });
        this.scanExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bottle-scan");
            t.setDaemon(true);
            return t;
        });
        Executor delivery = deliveryExecutor;
        if (delivery == null) {
            // at most one drain task per observer, so a stuck observer only holds its own thread
            final AtomicInteger observerThreads = new AtomicInteger();
            ownedDeliveryExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "bottle-observers-" + observerThreads.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            delivery = ownedDeliveryExecutor;
        } else {
            ownedDeliveryExecutor = null;
        }

        int limit = setting.observerQueueLimit();
        this.readingObservers = new ObserverRegistry<>("readings", delivery, limit);
        this.connectionObservers = new ObserverRegistry<>("connection", delivery, limit);
        this.deviceObservers = new ObserverRegistry<>("devices", delivery, limit);
        this.consumers = new ObserverRegistry<>("consumption", delivery, limit);
        if (sink != null) consumers.subscribe(sink);

        transport.setListener(this);
        log.info("Session coordinator created with " + setting);
    }

    // ---------------------------------------------------------------------------------
    // Observers
    // ---------------------------------------------------------------------------------

    public Subscription subscribe(@Nonnull ReadingObserver observer) {
        return readingObservers.subscribe(observer);
    }

    /** The observer first receives the current state, then every transition. */
    public Subscription subscribeConnection(@Nonnull ConnectionObserver observer) {
        synchronized (stateLock) {
            Subscription s = connectionObservers.subscribe(observer);
            ConnectionState now = state;
            // replay only to this observer
            connectionObservers.publishTo(s, o -> o.onConnectionState(now));
            return s;
        }
    }

    public Subscription subscribeDevices(@Nonnull DeviceListListener observer) {
        return deviceObservers.subscribe(observer);
    }

    public Subscription subscribeConsumption(@Nonnull ConsumptionSink sink) {
        return consumers.subscribe(sink);
    }

    // ---------------------------------------------------------------------------------
    // Scanning
    // ---------------------------------------------------------------------------------

    /**
     * Starts a background scan bounded by {@code scan_timeout_ms}. The device list is
     * published to device observers as it grows. Clears a previous fault.
     *
     * @return false when a link is up or being set up
     */
    public boolean startScan() {
        synchronized (stateLock) {
            requireRunning();
            switch (state.phase) {
                case SCANNING:
                    return true;
                case CONNECTING:
                case CONNECTED:
                case DISCONNECTING:
                    log.warn("Scan refused while " + state);
                    return false;
                case FAULTED:
                    log.info("Clearing " + state + " for new scan");
                    break;
                default:
                    break;
            }
            setStateLocked(ConnectionState.scanning());
        }
        try {
            scanExecutor.execute(this::runScan);
        } catch (RejectedExecutionException e) {
            log.error("Scan executor rejected work", e);
            synchronized (stateLock) {
                if (state.phase == ConnectionState.Phase.SCANNING) setStateLocked(ConnectionState.idle());
            }
            return false;
        }
        return true;
    }

    public void stopScan() {
        transport.stopScan();
    }

    private void runScan() {
        try {
            List<PeripheralHandle> found = transport.scan(setting.scanTimeoutMs(), this::publishDevices);
            publishDevices(found);
            synchronized (stateLock) {
                if (state.phase == ConnectionState.Phase.SCANNING) setStateLocked(ConnectionState.idle());
            }
        } catch (BottleException e) {
            log.error("Scan failed: " + e.getMessage());
            synchronized (stateLock) {
                if (state.phase == ConnectionState.Phase.SCANNING) {
                    setStateLocked(ConnectionState.faulted(e.getKind(), e.getMessage()));
                }
            }
        } catch (RuntimeException e) {
            log.error("Scan crashed", e);
            synchronized (stateLock) {
                if (state.phase == ConnectionState.Phase.SCANNING) {
                    setStateLocked(ConnectionState.faulted(ErrorKind.RADIO_UNAVAILABLE, e.toString()));
                }
            }
        }
    }

    private void publishDevices(List<PeripheralHandle> devices) {
        List<PeripheralHandle> copy = Collections.unmodifiableList(devices);
        deviceObservers.publish(o -> o.onDevicesChanged(copy));
    }

    public List<PeripheralHandle> getAvailableDevices() {
        return transport.getSeenDevices();
    }

    // ---------------------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------------------

    /**
     * Connects to {@code deviceId} and blocks until the link is up or has failed. A call
     * made while another connect is in flight, or while connected, is rejected rather
     * than queued. A previous fault is cleared first.
     *
     * @return true when connected, false when the call was rejected
     * @throws BottleException the transport failure; the state is then FAULTED, except
     *         for CANCELLED which means {@link #disconnect} won the race
     */
    public boolean connect(@Nonnull String deviceId) throws BottleException {
        PeripheralHandle target;
        int gen;
        synchronized (stateLock) {
            requireRunning();
            if (connectInFlight
                    || state.phase == ConnectionState.Phase.CONNECTED
                    || state.phase == ConnectionState.Phase.DISCONNECTING) {
                log.warn("Connect to " + deviceId + " rejected while " + state
                        + (connectInFlight ? " (attempt in flight)" : ""));
                return false;
            }
            if (state.phase == ConnectionState.Phase.FAULTED) {
                log.info("Clearing " + state + " for new connect");
            }
            connectInFlight = true;
            gen = ++generation;
            target = findDevice(deviceId);
            setStateLocked(ConnectionState.connecting(target));
        }

        BottleLink established;
        try {
            established = transport.connect(deviceId, setting.connectTimeoutMs());
        } catch (BottleException e) {
            synchronized (stateLock) {
                if (gen == generation) {
                    connectInFlight = false;
                    if (e.getKind() == ErrorKind.CANCELLED) {
                        setStateLocked(ConnectionState.idle());
                    } else {
                        setStateLocked(ConnectionState.faulted(e.getKind(), e.getMessage()));
                    }
                }
            }
            throw e;
        } catch (RuntimeException e) {
            synchronized (stateLock) {
                if (gen == generation) {
                    connectInFlight = false;
                    setStateLocked(ConnectionState.faulted(ErrorKind.CONNECT_FAILED, e.toString()));
                }
            }
            throw e;
        }

        synchronized (stateLock) {
            if (gen != generation) {
                // disconnect() ran while the transport was finishing; it already released the link
                throw new BottleException(ErrorKind.CANCELLED, "Connect to " + deviceId + " cancelled");
            }
            connectInFlight = false;
            if (transport.getCurrentLink() != established) {
                // dropped between setup and here; the transport did not report it as a lost link
                setStateLocked(ConnectionState.faulted(ErrorKind.CONNECT_FAILED, "Link dropped during setup"));
                throw new BottleException(ErrorKind.CONNECT_FAILED, "Link to " + deviceId + " dropped during setup");
            }
            link = established;
            lastReadingAtMs = 0L;
            lastEstimate = null;
            setStateLocked(ConnectionState.connected(target));
        }
        refreshCalibration(activeSubject);
        return true;
    }

    /**
     * Drops the link, aborts a connect in progress, or does nothing. Safe from any state
     * and any thread. An armed calibration step is cancelled without writing a baseline.
     */
    public void disconnect() {
        int gen;
        boolean active;
        synchronized (stateLock) {
            gen = ++generation;
            connectInFlight = false;
            cancelPendingSleepLocked();
            active = link != null
                    || state.phase == ConnectionState.Phase.CONNECTING
                    || state.phase == ConnectionState.Phase.CONNECTED
                    || state.phase == ConnectionState.Phase.DISCONNECTING;
            link = null;
            if (active) setStateLocked(ConnectionState.disconnecting());
        }
        cancelArmedStep("disconnect");
        transport.disconnect();
        synchronized (stateLock) {
            lastReadingAtMs = 0L;
            if (active && gen == generation) setStateLocked(ConnectionState.idle());
        }
    }

    @Override
    public void onLinkLost(@Nonnull String deviceId, @Nullable Throwable cause) {
        synchronized (stateLock) {
            if (link == null || !link.deviceId.equals(deviceId)) return;
            generation++;
            link = null;
            lastReadingAtMs = 0L;
            cancelPendingSleepLocked();
            setStateLocked(ConnectionState.idle());
        }
        log.info("Bottle " + deviceId + " dropped the link");
        cancelArmedStep("link lost");
    }

    public ConnectionState getState() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isConnected() {
        return getState().isConnected();
    }

    // ---------------------------------------------------------------------------------
    // Subjects and calibration
    // ---------------------------------------------------------------------------------

    /**
     * Rebinds readings to {@code subjectId} (null unbinds) and loads that subject's
     * calibration. A step armed for the previous subject is cancelled.
     */
    public void setActiveSubject(@Nullable String subjectId) {
        synchronized (stateLock) {
            String previous = activeSubject;
            if (previous == null ? subjectId == null : previous.equals(subjectId)) return;
            activeSubject = subjectId;
        }
        log.info("Active subject is now " + subjectId);
        cancelArmedStep("subject switch");
        reloadCalibration(subjectId);
    }

    @Nullable
    public String getActiveSubject() {
        return activeSubject;
    }

    /**
     * Arms {@code step}. The callback receives the draft calibration when the step
     * completes (the saved calibration after the full step), or CALIBRATION_INVALID,
     * STORAGE_FAILED or CANCELLED. Arming again replaces and cancels the previous callback.
     *
     * @throws BottleException NO_ACTIVE_SUBJECT
     */
    public void beginCalibration(@Nonnull CalibrationStep step, @Nonnull ResultCallback<Calibration> callback)
            throws BottleException {
        String subject = activeSubject;
        if (subject == null) {
            throw new BottleException(ErrorKind.NO_ACTIVE_SUBJECT, "Select a subject before calibrating");
        }
        ResultCallback<Calibration> replaced;
        // arming and installing the callback are one step for feedReadingToCalibration
        synchronized (stateLock) {
            replaced = calibrationCallback;
            calibrationCallback = callback;
            calibrationSubject = subject;
            engine.begin(step);
        }
        if (replaced != null && replaced != callback) {
            fail(replaced, new BottleException(ErrorKind.CANCELLED, "Calibration restarted"));
        }
        if (!isConnected()) {
            log.warn("Calibration " + step + " armed while not connected; waiting for readings");
        }
        sendBestEffort(CommandEncoder.calibrationStep(step, System.currentTimeMillis()), "calibration " + step.wireName);
    }

    /**
     * Offers a reading to the armed step; no-op when nothing is armed. Completing the full
     * step with valid baselines persists the calibration for the active subject.
     */
    public void feedReadingToCalibration(@Nonnull SensorReading reading) {
        CalibrationEngine.StepResult result;
        ResultCallback<Calibration> cb;
        String subject;
        synchronized (stateLock) {
            result = engine.offer(reading);
            if (result == null) return;
            cb = calibrationCallback;
            subject = calibrationSubject;
            calibrationCallback = null;
            calibrationSubject = null;
        }
        if (result.error != null) {
            fail(cb, result.error);
            return;
        }
        if (result.step == CalibrationStep.FULL) {
            if (subject != null && !subject.equals(activeSubject)) {
                log.warn("Calibration for " + subject + " finished after a subject switch, discarded");
                reloadCalibration(activeSubject);
                fail(cb, new BottleException(ErrorKind.CANCELLED, "Calibration cancelled: subject switch"));
                return;
            }
            if (subject != null) {
                try {
                    store.save(subject, result.draft);
                    log.info("Calibration saved for " + subject);
                } catch (IOException e) {
                    log.error("Could not save calibration for " + subject, e);
                    fail(cb, new BottleException(ErrorKind.STORAGE_FAILED, "Calibration not saved: " + e.getMessage(), e));
                    return;
                }
            }
            sendBestEffort(CommandEncoder.calibrationComplete(System.currentTimeMillis()), "calibration complete");
        }
        if (cb != null) {
            try {
                cb.onSuccess(result.draft);
            } catch (RuntimeException e) {
                log.error("Calibration callback threw", e);
            }
        }
    }

    /** @return true if a step was armed */
    public boolean cancelCalibration() {
        return cancelArmedStep("cancelled by caller");
    }

    /**
     * Forgets the active subject's calibration, in memory and in the store.
     * @throws BottleException NO_ACTIVE_SUBJECT or STORAGE_FAILED
     */
    public void clearCalibration() throws BottleException {
        String subject = requireSubject();
        cancelArmedStep("calibration cleared");
        engine.setActive(null);
        try {
            store.clear(subject);
        } catch (IOException e) {
            throw new BottleException(ErrorKind.STORAGE_FAILED, "Could not clear calibration: " + e.getMessage(), e);
        }
        log.info("Calibration cleared for " + subject);
    }

    /**
     * Changes the capacity used for volume and persists it when a calibration exists.
     * @return the updated calibration, or null when the subject is not calibrated yet
     * @throws BottleException NO_ACTIVE_SUBJECT or STORAGE_FAILED
     */
    @Nullable
    public Calibration updateBottleCapacity(int capacityMl) throws BottleException {
        if (capacityMl <= 0) throw new IllegalArgumentException("capacityMl must be positive");
        String subject = requireSubject();
        Calibration updated = engine.updateCapacity(capacityMl);
        if (updated == null) return null;
        try {
            store.save(subject, updated);
        } catch (IOException e) {
            throw new BottleException(ErrorKind.STORAGE_FAILED, "Could not save capacity: " + e.getMessage(), e);
        }
        log.info("Bottle capacity for " + subject + " set to " + capacityMl + "ml");
        return updated;
    }

    @Nullable
    public Calibration getCalibration() {
        return engine.getActive();
    }

    public CalibrationEngine.Mode getCalibrationMode() {
        return engine.getMode();
    }

    public boolean isEmptyCalibrated() {
        return engine.isEmptyCalibrated();
    }

    public boolean isFullCalibrated() {
        return engine.isFullCalibrated();
    }

    /** Binds the engine to {@code subject}'s stored calibration. Any armed step is dropped. */
    private void reloadCalibration(@Nullable String subject) {
        Calibration loaded = null;
        try {
            loaded = loadCalibration(subject);
        } catch (IOException e) {
            log.error("Could not load calibration for " + subject + ", continuing uncalibrated", e);
        }
        engine.setActive(loaded);
        log.info("Calibration for " + subject + ": " + (loaded != null ? loaded : "none"));
    }

    /**
     * Re-reads the stored calibration for the subject already bound. An armed step and
     * the ritual draft stay as they are; on a storage error the current calibration is kept.
     */
    private void refreshCalibration(@Nullable String subject) {
        try {
            Calibration loaded = loadCalibration(subject);
            engine.replaceActive(loaded);
            log.info("Calibration for " + subject + " refreshed: " + (loaded != null ? loaded : "none"));
        } catch (IOException e) {
            log.warn("Could not refresh calibration for " + subject + ", keeping " + engine.getActive(), e);
        }
    }

    @Nullable
    private Calibration loadCalibration(@Nullable String subject) throws IOException {
        return subject != null ? store.load(subject) : null;
    }

    private boolean cancelArmedStep(String reason) {
        boolean wasArmed;
        ResultCallback<Calibration> cb;
        synchronized (stateLock) {
            wasArmed = engine.cancel();
            cb = calibrationCallback;
            calibrationCallback = null;
            calibrationSubject = null;
        }
        if (cb != null) {
            fail(cb, new BottleException(ErrorKind.CANCELLED, "Calibration cancelled: " + reason));
        }
        return wasArmed;
    }

    private String requireSubject() throws BottleException {
        String subject = activeSubject;
        if (subject == null) throw new BottleException(ErrorKind.NO_ACTIVE_SUBJECT, "No active subject");
        return subject;
    }

    private static void fail(@Nullable ResultCallback<Calibration> cb, Exception error) {
        if (cb == null) return;
        try {
            cb.onError(error);
        } catch (RuntimeException e) {
            log.error("Calibration callback threw", e);
        }
    }

    // ---------------------------------------------------------------------------------
    // Readings
    // ---------------------------------------------------------------------------------

    @Override
    public void onNotification(@Nonnull String deviceId, @Nonnull byte[] payload) {
        long receivedAt = System.currentTimeMillis();
        try {
            worker.execute(() -> handlePayload(deviceId, payload, receivedAt));
        } catch (RejectedExecutionException e) {
            log.debug("Notification after shutdown dropped");
        }
    }

    private void handlePayload(String deviceId, byte[] payload, long receivedAt) {
        SensorReading reading = decoder.decode(payload, deviceId, receivedAt);
        if (reading == null) return;
        // sampled before feeding: the reading that completes a step still belongs to it
        boolean calibrating = engine.isArmed();
        feedReadingToCalibration(reading);
        publishReading(reading, calibrating);
    }

    /**
     * Computes the level for one reading and fans it out. Distances under the validity
     * floor report 0% as NO_BOTTLE whatever the calibration says. Without a calibration
     * the firmware percentage is passed on as DEVICE_REPORTED. The consumption sinks only
     * see CALIBRATED and DEVICE_REPORTED volumes for a bound subject, and nothing while a
     * calibration step is collecting.
     */
    public LevelEstimate onReading(@Nonnull SensorReading reading) {
        return publishReading(reading, engine.isArmed());
    }

    private LevelEstimate publishReading(SensorReading reading, boolean calibrating) {
        String subject = activeSubject;
        LevelEstimate estimate;
        if (!FilterFactory.acceptsAll(filters, reading.timestampMs, reading.distanceMm)) {
            estimate = new LevelEstimate(0.0, 0.0, LevelSource.NO_BOTTLE, subject);
        } else {
            Calibration cal = engine.getActive();
            if (cal != null && cal.isComplete()) {
                estimate = new LevelEstimate(cal.computeLevelPct(reading), cal.computeVolumeMl(reading),
                        LevelSource.CALIBRATED, subject);
            } else if (reading.rawLevelPct != null) {
                int capacity = cal != null ? cal.bottleCapacityMl : setting.defaultBottleCapacityMl();
                double pct = reading.rawLevelPct;
                estimate = new LevelEstimate(pct, pct / 100.0 * capacity, LevelSource.DEVICE_REPORTED, subject);
            } else {
                estimate = new LevelEstimate(0.0, 0.0, LevelSource.UNAVAILABLE, subject);
            }
        }

        lastReadingAtMs = System.currentTimeMillis();
        lastEstimate = estimate;
        final LevelEstimate published = estimate;
        readingObservers.publish(o -> o.onReading(reading, published));

        if (subject == null) {
            long n = readingsWithoutSubject.incrementAndGet();
            if (log.isDebugEnabled()) log.debug(ErrorKind.NO_ACTIVE_SUBJECT + ": reading not attributed (#" + n + ")");
        } else if ((estimate.source == LevelSource.CALIBRATED || estimate.source == LevelSource.DEVICE_REPORTED)
                && !calibrating) {
            consumers.publish(c -> c.onVolume(subject, published.volumeMl, reading.timestampMs, published.source));
        }
        return estimate;
    }

    /** Milliseconds since the last reading on the current link, or -1 if none yet. */
    public long getLastReadingAgeMs() {
        long at = lastReadingAtMs;
        return at == 0L ? -1L : Math.max(0L, System.currentTimeMillis() - at);
    }

    public boolean isDataFresh() {
        long age = getLastReadingAgeMs();
        return age >= 0 && age <= setting.dataFreshMs();
    }

    @Nullable
    public LevelEstimate getLastEstimate() {
        return lastEstimate;
    }

    // ---------------------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------------------

    /**
     * Asks the bottle to deep-sleep. After {@code sleep_grace_ms} the state moves to
     * DISCONNECTING on the assumption the bottle drops the link itself; if it has not
     * within {@code disconnect_timeout_ms} more, the link is released from this side.
     */
    public void enterSleep(int durationMinutes) throws BottleException {
        byte[] command = CommandEncoder.deepSleep(durationMinutes, System.currentTimeMillis());
        sendCommand(command, "deep_sleep " + durationMinutes + "min");
        synchronized (stateLock) {
            cancelPendingSleepLocked();
            final int gen = generation;
            pendingSleep = worker.schedule(() -> sleepGraceElapsed(gen), setting.sleepGraceMs(), TimeUnit.MILLISECONDS);
        }
    }

    private void sleepGraceElapsed(int gen) {
        synchronized (stateLock) {
            if (gen != generation || state.phase != ConnectionState.Phase.CONNECTED) return;
            setStateLocked(ConnectionState.disconnecting());
            pendingSleep = worker.schedule(() -> sleepDisconnectOverdue(gen),
                    setting.disconnectTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        log.info("Sleep grace elapsed, expecting the bottle to drop the link");
    }

    private void sleepDisconnectOverdue(int gen) {
        synchronized (stateLock) {
            if (gen != generation) return;
            generation++;
            link = null;
            pendingSleep = null;
        }
        log.warn("Bottle still linked after sleep command, disconnecting");
        cancelArmedStep("sleep");
        transport.disconnect();
        synchronized (stateLock) {
            lastReadingAtMs = 0L;
            if (state.phase == ConnectionState.Phase.DISCONNECTING) setStateLocked(ConnectionState.idle());
        }
    }

    public void wake() throws BottleException {
        sendCommand(CommandEncoder.wake(System.currentTimeMillis()), "wake");
    }

    public void sendRawCommand(@Nonnull String command) throws BottleException {
        sendCommand(CommandEncoder.raw(command), "raw command");
    }

    public void sendConfigUpdate(@Nonnull Map<String, ?> config) throws BottleException {
        sendCommand(CommandEncoder.configUpdate(config, System.currentTimeMillis()), "config_update");
    }

    /**
     * Writes a command the caller asked for. A failed write tears the link down and
     * leaves the state FAULTED(WRITE_FAILED).
     */
    private void sendCommand(byte[] command, String what) throws BottleException {
        BottleLink target;
        int gen;
        synchronized (stateLock) {
            target = link;
            gen = generation;
        }
        if (target == null) {
            throw new BottleException(ErrorKind.WRITE_FAILED, "Cannot send " + what + ": not connected");
        }
        try {
            transport.write(target, command);
            log.info("Sent " + what + " to " + target.deviceId);
        } catch (BottleException e) {
            log.error("Sending " + what + " failed: " + e.getMessage());
            boolean release;
            synchronized (stateLock) {
                release = gen == generation;
                if (release) {
                    generation++;
                    link = null;
                    cancelPendingSleepLocked();
                    setStateLocked(ConnectionState.faulted(e.getKind(), e.getMessage()));
                }
            }
            if (release) {
                cancelArmedStep("write failed");
                transport.disconnect();
            }
            throw e;
        }
    }

    /** Calibration step commands are informational for the firmware; failures are only logged. */
    private void sendBestEffort(byte[] command, String what) {
        BottleLink target;
        synchronized (stateLock) {
            target = link;
        }
        if (target == null) return;
        try {
            transport.write(target, command);
            log.info("Sent " + what);
        } catch (BottleException e) {
            log.warn("Could not send " + what + ": " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------------------------
    // Diagnostics and lifecycle
    // ---------------------------------------------------------------------------------

    public long getUnparseableCount() {
        return decoder.getUnparseableCount();
    }

    public long getReadingsWithoutSubject() {
        return readingsWithoutSubject.get();
    }

    public String getDiagnostics() {
        ConnectionState s = getState();
        BottleLink l = transport.getCurrentLink();
        Calibration cal = engine.getActive();
        StringBuilder sb = new StringBuilder(512);
        sb.append("=== Smart bottle diagnostics ===\n");
        sb.append("Radio: ").append(transport.getRadioState()).append('\n');
        sb.append("Connection: ").append(s).append('\n');
        if (l != null) {
            sb.append("Device: ").append(l.deviceId).append('\n');
            sb.append("Service: ").append(l.serviceUuid).append('\n');
            sb.append("Data characteristic: ").append(l.dataCharacteristic)
                    .append(l.fallback ? " (fallback)" : "").append('\n');
            sb.append("Control characteristic: ")
                    .append(l.controlCharacteristic != null ? l.controlCharacteristic : "none").append('\n');
        }
        sb.append("Subject: ").append(activeSubject != null ? activeSubject : "none").append('\n');
        if (cal != null) {
            sb.append(String.format(Locale.US, "Calibration: empty=%.1fmm full=%.1fmm capacity=%dml complete=%s%n",
                    cal.emptyBaselineMm, cal.fullBaselineMm, cal.bottleCapacityMl, cal.isComplete()));
        } else {
            sb.append("Calibration: none\n");
        }
        sb.append("Calibration step: ").append(engine.getMode());
        if (engine.isArmed()) {
            sb.append(" (").append(engine.getCollectedCount()).append('/').append(engine.getSamplesPerStep()).append(')');
        }
        sb.append('\n');
        sb.append("Unparseable payloads: ").append(decoder.getUnparseableCount()).append('\n');
        sb.append("Readings without subject: ").append(readingsWithoutSubject.get()).append('\n');
        sb.append("Dropped observer events: ").append(readingObservers.getDroppedEvents()
                + connectionObservers.getDroppedEvents() + deviceObservers.getDroppedEvents()
                + consumers.getDroppedEvents()).append('\n');
        long age = getLastReadingAgeMs();
        sb.append("Last reading: ").append(age < 0 ? "never" : age + "ms ago")
                .append(isDataFresh() ? " (fresh)" : " (stale)").append('\n');
        LevelEstimate last = lastEstimate;
        if (last != null) sb.append("Last level: ").append(last).append('\n');
        return sb.toString();
    }

    /**
     * Blocks until work queued on the session worker before this call has run, or 5s.
     * Observer delivery on a caller-supplied executor is not covered.
     */
    public void drain() {
        final CountDownLatch latch = new CountDownLatch(1);
        try {
            worker.execute(latch::countDown);
        } catch (RejectedExecutionException e) {
            return;
        }
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /** Disconnects, stops the threads, drops all observers and releases the radio. */
    public void shutdown() {
        if (shutdown) return;
        disconnect();
        shutdown = true;
        transport.setListener(null);
        transport.shutdown();
        worker.shutdownNow();
        scanExecutor.shutdownNow();
        readingObservers.clear();
        connectionObservers.clear();
        deviceObservers.clear();
        consumers.clear();
        if (ownedDeliveryExecutor != null) ownedDeliveryExecutor.shutdown();
        log.info("Session coordinator shut down");
    }

    private void requireRunning() {
        if (shutdown) throw new IllegalStateException("Session coordinator is shut down");
    }

    private PeripheralHandle findDevice(String deviceId) {
        for (PeripheralHandle p : transport.getSeenDevices()) {
            if (p.id.equals(deviceId)) return p;
        }
        return PeripheralHandle.unresolved(deviceId);
    }

    private void cancelPendingSleepLocked() {
        if (pendingSleep != null) {
            pendingSleep.cancel(false);
            pendingSleep = null;
        }
    }

    private void setStateLocked(ConnectionState next) {
        if (next == state) return;
        log.info("Connection " + state + " -> " + next);
        state = next;
        connectionObservers.publish(o -> o.onConnectionState(next));
    }
}
