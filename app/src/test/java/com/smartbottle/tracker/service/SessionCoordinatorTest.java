package com.smartbottle.tracker.service;

import com.smartbottle.tracker.ble.BleTransport;
import com.smartbottle.tracker.ble.DeviceListListener;
import com.smartbottle.tracker.ble.FakeRadioDriver;
import com.smartbottle.tracker.ble.RadioState;
import com.smartbottle.tracker.data.BottleException;
import com.smartbottle.tracker.data.Calibration;
import com.smartbottle.tracker.data.CalibrationStore;
import com.smartbottle.tracker.data.ConnectionState;
import com.smartbottle.tracker.data.ErrorKind;
import com.smartbottle.tracker.data.ResultCallback;
import com.smartbottle.tracker.data.SensorReading;
import com.smartbottle.tracker.data.Setting;
import com.smartbottle.tracker.logic.CalibrationEngine;
import com.smartbottle.tracker.logic.CalibrationStep;
import com.smartbottle.tracker.logic.LevelEstimate;
import com.smartbottle.tracker.logic.LevelSource;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SessionCoordinatorTest {

    private static final String BOTTLE = "AA:BB:CC:DD:EE:FF";
    private static final int[] EMPTY_READINGS = {120, 121, 119, 118, 122, 117, 116, 123, 121, 119};
    private static final int[] FULL_READINGS = {30, 32, 29, 31, 28, 33, 27, 34, 30, 29};

    private FakeRadioDriver driver;
    private Setting setting;
    private BleTransport transport;
    private CalibrationStore store;
    private ConsumptionSink sink;
    private ReadingObserver observer;
    private SessionCoordinator coordinator;
    private ExecutorService background;

    @Before
    public void setUp() {
        driver = new FakeRadioDriver();
        setting = new Setting();
        setting.connect_timeout_ms = 1_000L;
        setting.write_timeout_ms = 200L;
        setting.disconnect_timeout_ms = 200L;
        setting.sleep_grace_ms = 50L;
        setting.scan_timeout_ms = 50L;
        transport = new BleTransport(driver, setting);
        store = mock(CalibrationStore.class);
        sink = mock(ConsumptionSink.class);
        observer = mock(ReadingObserver.class);
        // deliver observer callbacks inline so drain() covers them
        coordinator = new SessionCoordinator(transport, store, sink, setting, Runnable::run);
        coordinator.subscribe(observer);
        background = Executors.newCachedThreadPool();
    }

    @After
    public void tearDown() {
        coordinator.shutdown();
        background.shutdownNow();
    }

    private static void waitFor(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) fail("timed out waiting for " + what);
            Thread.sleep(5);
        }
    }

    private FakeRadioDriver.FakeLink connect() throws BottleException {
        assertTrue(coordinator.connect(BOTTLE));
        return driver.lastLink();
    }

    private void push(FakeRadioDriver.FakeLink link, String... payloads) {
        for (String p : payloads) link.push(p);
        coordinator.drain();
    }

    private void pushDistances(FakeRadioDriver.FakeLink link, int... distances) {
        for (int d : distances) link.push(Integer.toString(d));
        coordinator.drain();
    }

    private LevelEstimate lastEstimate() {
        ArgumentCaptor<LevelEstimate> captor = ArgumentCaptor.forClass(LevelEstimate.class);
        verify(observer, atLeastOnce()).onReading(any(SensorReading.class), captor.capture());
        return captor.getValue();
    }

    @SuppressWarnings("unchecked")
    private static ResultCallback<Calibration> callback() {
        return mock(ResultCallback.class);
    }

    private static BottleException errorOf(ResultCallback<Calibration> cb) {
        ArgumentCaptor<Exception> captor = ArgumentCaptor.forClass(Exception.class);
        verify(cb).onError(captor.capture());
        assertTrue(captor.getValue() instanceof BottleException);
        return (BottleException) captor.getValue();
    }

    // ---- connection lifecycle ----

    @Test
    public void connect_reachesConnected_andLoadsSubjectCalibration() throws Exception {
        Calibration stored = Calibration.of(140.0, 20.0, 1000, 1L);
        when(store.load("alice")).thenReturn(stored);
        List<ConnectionState.Phase> phases = new CopyOnWriteArrayList<>();
        coordinator.subscribeConnection(s -> phases.add(s.phase));
        coordinator.setActiveSubject("alice");

        connect();

        assertTrue(coordinator.isConnected());
        assertEquals(stored, coordinator.getCalibration());
        verify(store, times(2)).load("alice");
        assertEquals(ConnectionState.Phase.IDLE, phases.get(0));
        assertEquals(ConnectionState.Phase.CONNECTING, phases.get(1));
        assertEquals(ConnectionState.Phase.CONNECTED, phases.get(2));
    }

    @Test
    public void concurrentConnect_onlyOneAttemptReachesTransport() throws Exception {
        driver.connectMode = FakeRadioDriver.ConnectMode.HANG;
        Future<Boolean> first = background.submit(() -> coordinator.connect(BOTTLE));
        FakeRadioDriver.await(driver.connectRequested);

        assertFalse(coordinator.connect(BOTTLE));
        assertFalse(coordinator.connect("11:22:33:44:55:66"));

        driver.completePendingConnect(BOTTLE);
        assertTrue(first.get(2, TimeUnit.SECONDS));
        assertEquals(1, driver.connectCalls.get());
        assertTrue(coordinator.isConnected());
        assertFalse(coordinator.connect(BOTTLE));
    }

    @Test
    public void connectFailure_faults_thenNextConnectClearsIt() throws Exception {
        driver.radioState = RadioState.UNAUTHORIZED;
        try {
            coordinator.connect(BOTTLE);
            fail();
        } catch (BottleException e) {
            assertEquals(ErrorKind.PERMISSION_DENIED, e.getKind());
        }
        ConnectionState faulted = coordinator.getState();
        assertEquals(ConnectionState.Phase.FAULTED, faulted.phase);
        assertEquals(ErrorKind.PERMISSION_DENIED, faulted.fault);

        driver.radioState = RadioState.POWERED_ON;
        connect();
        assertTrue(coordinator.isConnected());
    }

    @Test
    public void connectTimeout_faultsWithConnectTimeout() throws Exception {
        setting.connect_timeout_ms = 50L;
        driver.connectMode = FakeRadioDriver.ConnectMode.HANG;
        try {
            coordinator.connect(BOTTLE);
            fail();
        } catch (BottleException e) {
            assertEquals(ErrorKind.CONNECT_TIMEOUT, e.getKind());
        }
        assertEquals(ErrorKind.CONNECT_TIMEOUT, coordinator.getState().fault);
        assertFalse(transport.isLinked());
    }

    @Test
    public void disconnect_duringConnect_cancelsWithoutFault() throws Exception {
        driver.connectMode = FakeRadioDriver.ConnectMode.HANG;
        Future<Boolean> attempt = background.submit(() -> coordinator.connect(BOTTLE));
        FakeRadioDriver.await(driver.connectRequested);

        coordinator.disconnect();

        try {
            attempt.get(2, TimeUnit.SECONDS);
            fail();
        } catch (java.util.concurrent.ExecutionException e) {
            assertEquals(ErrorKind.CANCELLED, ((BottleException) e.getCause()).getKind());
        }
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
        waitFor("abandoned connect", () -> driver.abandonedConnects.get() == 1);
    }

    @Test
    public void disconnect_fromAnyState_isSafe() throws Exception {
        coordinator.disconnect();
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
        FakeRadioDriver.FakeLink link = connect();
        coordinator.disconnect();
        coordinator.disconnect();
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
        assertTrue(link.isClosed());
    }

    @Test
    public void peripheralDrop_goesIdle_andResetsFreshness() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        pushDistances(link, 80);
        assertTrue(coordinator.isDataFresh());
        assertTrue(coordinator.getLastReadingAgeMs() >= 0);

        link.drop();

        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
        assertEquals(-1L, coordinator.getLastReadingAgeMs());
        assertFalse(coordinator.isDataFresh());
    }

    // ---- readings ----

    @Test
    public void garbagePayloads_areDropped_withoutStateChange() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        ConnectionState before = coordinator.getState();

        push(link, "garbage", "{\"foo\": 1}");

        verify(observer, never()).onReading(any(), any());
        assertSame(before, coordinator.getState());
        assertEquals(2, coordinator.getUnparseableCount());
    }

    @Test
    public void calibratedReading_reportsLevelAndVolume() throws Exception {
        when(store.load("alice")).thenReturn(Calibration.of(140.0, 20.0, 1000, 1L));
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();

        pushDistances(link, 80);

        LevelEstimate level = lastEstimate();
        assertEquals(LevelSource.CALIBRATED, level.source);
        assertEquals(50.0, level.levelPct, 0.0);
        assertEquals(500.0, level.volumeMl, 1e-9);
        assertEquals("alice", level.subjectId);
        verify(sink).onVolume(eq("alice"), eq(500.0), anyLong(), eq(LevelSource.CALIBRATED));
    }

    @Test
    public void readingBelowFloor_isZeroWhateverTheCalibration() throws Exception {
        when(store.load("alice")).thenReturn(Calibration.of(140.0, 20.0, 1000, 1L));
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();

        pushDistances(link, 30);

        LevelEstimate level = lastEstimate();
        assertEquals(0.0, level.levelPct, 0.0);
        assertEquals(LevelSource.NO_BOTTLE, level.source);
        verify(sink, never()).onVolume(anyString(), anyDouble(), anyLong(), any());
    }

    @Test
    public void readingBelowFloor_withoutCalibration_ignoresDevicePercent() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        push(link, "{\"p\":80,\"d\":30}");
        LevelEstimate level = lastEstimate();
        assertEquals(0.0, level.levelPct, 0.0);
        assertEquals(LevelSource.NO_BOTTLE, level.source);
    }

    @Test
    public void uncalibrated_reportsDevicePercentAsSuch() throws Exception {
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();

        push(link, "{\"p\":42,\"d\":118}");

        LevelEstimate level = lastEstimate();
        assertEquals(LevelSource.DEVICE_REPORTED, level.source);
        assertFalse(level.isCalibrated());
        assertEquals(42.0, level.levelPct, 0.0);
        assertEquals(420.0, level.volumeMl, 1e-9);
        verify(sink).onVolume(eq("alice"), eq(420.0), anyLong(), eq(LevelSource.DEVICE_REPORTED));
    }

    @Test
    public void uncalibrated_bareDistance_isUnavailable() throws Exception {
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();

        pushDistances(link, 118);

        assertEquals(LevelSource.UNAVAILABLE, lastEstimate().source);
        verify(sink, never()).onVolume(anyString(), anyDouble(), anyLong(), any());
    }

    @Test
    public void noSubject_readingReachesObservers_butNotAccounting() throws Exception {
        FakeRadioDriver.FakeLink link = connect();

        push(link, "{\"p\":50,\"d\":90}");

        LevelEstimate level = lastEstimate();
        assertNull(level.subjectId);
        verify(sink, never()).onVolume(anyString(), anyDouble(), anyLong(), any());
        assertEquals(1, coordinator.getReadingsWithoutSubject());
    }

    @Test
    public void throwingObserver_doesNotStopDelivery() throws Exception {
        coordinator.subscribe((r, l) -> {
            throw new IllegalStateException("bad observer");
        });
        FakeRadioDriver.FakeLink link = connect();

        pushDistances(link, 80, 81);

        verify(observer, times(2)).onReading(any(), any());
        assertTrue(coordinator.isConnected());
    }

    // ---- calibration ----

    @Test
    public void fullRitual_savesCalibration_andTellsTheBottle() throws Exception {
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();

        ResultCallback<Calibration> emptyCb = callback();
        coordinator.beginCalibration(CalibrationStep.EMPTY, emptyCb);
        pushDistances(link, EMPTY_READINGS);
        ArgumentCaptor<Calibration> emptyDraft = ArgumentCaptor.forClass(Calibration.class);
        verify(emptyCb).onSuccess(emptyDraft.capture());
        assertEquals(123.0, emptyDraft.getValue().emptyBaselineMm, 0.0);
        assertTrue(coordinator.isEmptyCalibrated());

        ResultCallback<Calibration> fullCb = callback();
        coordinator.beginCalibration(CalibrationStep.FULL, fullCb);
        pushDistances(link, FULL_READINGS);

        ArgumentCaptor<Calibration> saved = ArgumentCaptor.forClass(Calibration.class);
        verify(store).save(eq("alice"), saved.capture());
        assertEquals(123.0, saved.getValue().emptyBaselineMm, 0.0);
        assertEquals(27.0, saved.getValue().fullBaselineMm, 0.0);
        assertTrue(saved.getValue().isComplete());
        verify(fullCb).onSuccess(saved.getValue());
        assertEquals(saved.getValue(), coordinator.getCalibration());

        List<String> writes = link.writtenStrings();
        assertTrue(writes.get(0).contains("\"start_empty\""));
        assertTrue(writes.get(1).contains("\"start_full\""));
        assertTrue(writes.get(2).contains("\"complete\""));
        // no consumption booked while the bottle was being filled for calibration
        verify(sink, never()).onVolume(anyString(), anyDouble(), anyLong(), any());
    }

    @Test
    public void invertedRitual_isCalibrationInvalid_andKeepsStoredCalibration() throws Exception {
        Calibration previous = Calibration.of(150.0, 25.0, 1000, 1L);
        when(store.load("alice")).thenReturn(previous);
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();

        coordinator.beginCalibration(CalibrationStep.EMPTY, callback());
        pushDistances(link, 20, 20, 20, 20, 20, 20, 20, 20, 20, 20);
        ResultCallback<Calibration> fullCb = callback();
        coordinator.beginCalibration(CalibrationStep.FULL, fullCb);
        pushDistances(link, 140, 140, 140, 140, 140, 140, 140, 140, 140, 140);

        assertEquals(ErrorKind.CALIBRATION_INVALID, errorOf(fullCb).getKind());
        verify(store, never()).save(anyString(), any());
        assertSame(previous, coordinator.getCalibration());
    }

    @Test
    public void disconnect_duringCalibration_writesNoBaseline() throws Exception {
        Calibration previous = Calibration.of(150.0, 25.0, 1000, 1L);
        when(store.load("alice")).thenReturn(previous);
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();
        ResultCallback<Calibration> cb = callback();
        coordinator.beginCalibration(CalibrationStep.FULL, cb);
        pushDistances(link, 30, 31, 29, 28, 30);

        coordinator.disconnect();

        assertEquals(ErrorKind.CANCELLED, errorOf(cb).getKind());
        assertEquals(CalibrationEngine.Mode.IDLE, coordinator.getCalibrationMode());
        assertSame(previous, coordinator.getCalibration());
        verify(store, never()).save(anyString(), any());
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
    }

    @Test
    public void subjectSwitch_reloadsCalibration_andCancelsArmedStep() throws Exception {
        Calibration alice = Calibration.of(140.0, 20.0, 1000, 1L);
        Calibration bob = Calibration.of(200.0, 40.0, 750, 2L);
        when(store.load("alice")).thenReturn(alice);
        when(store.load("bob")).thenReturn(bob);
        coordinator.setActiveSubject("alice");
        connect();
        ResultCallback<Calibration> cb = callback();
        coordinator.beginCalibration(CalibrationStep.EMPTY, cb);

        coordinator.setActiveSubject("bob");

        assertEquals(ErrorKind.CANCELLED, errorOf(cb).getKind());
        assertEquals(bob, coordinator.getCalibration());
        assertEquals("bob", coordinator.getActiveSubject());
        assertEquals(CalibrationEngine.Mode.IDLE, coordinator.getCalibrationMode());
    }

    @Test
    public void beginCalibration_withoutSubject_isNoActiveSubject() {
        try {
            coordinator.beginCalibration(CalibrationStep.EMPTY, callback());
            fail();
        } catch (BottleException e) {
            assertEquals(ErrorKind.NO_ACTIVE_SUBJECT, e.getKind());
        }
        assertEquals(CalibrationEngine.Mode.IDLE, coordinator.getCalibrationMode());
    }

    @Test
    public void storageFailure_isReportedToRitualCaller() throws Exception {
        coordinator.setActiveSubject("alice");
        doThrow(new IOException("disk full")).when(store).save(eq("alice"), any());
        FakeRadioDriver.FakeLink link = connect();
        coordinator.beginCalibration(CalibrationStep.EMPTY, callback());
        pushDistances(link, EMPTY_READINGS);
        ResultCallback<Calibration> fullCb = callback();
        coordinator.beginCalibration(CalibrationStep.FULL, fullCb);
        pushDistances(link, FULL_READINGS);

        assertEquals(ErrorKind.STORAGE_FAILED, errorOf(fullCb).getKind());
    }

    @Test
    public void clearCalibration_andCapacityUpdate_goThroughStore() throws Exception {
        when(store.load("alice")).thenReturn(Calibration.of(140.0, 20.0, 1000, 1L));
        coordinator.setActiveSubject("alice");

        Calibration updated = coordinator.updateBottleCapacity(750);
        assertNotNull(updated);
        assertEquals(750, updated.bottleCapacityMl);
        verify(store).save("alice", updated);

        coordinator.clearCalibration();
        verify(store).clear("alice");
        assertNull(coordinator.getCalibration());
        assertNull(coordinator.updateBottleCapacity(500));
    }

    // ---- commands ----

    @Test
    public void enterSleep_sendsCommand_thenDisconnecting_thenIdleWhenBottleDrops() throws Exception {
        FakeRadioDriver.FakeLink link = connect();

        coordinator.enterSleep(30);

        assertTrue(link.writtenStrings().get(0).contains("\"deep_sleep\""));
        assertTrue(link.writtenStrings().get(0).contains("\"duration_minutes\":30"));
        waitFor("DISCONNECTING", () -> coordinator.getState().phase == ConnectionState.Phase.DISCONNECTING);
        link.drop();
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
    }

    @Test
    public void enterSleep_bottleNeverDrops_linkReleasedAnyway() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        coordinator.enterSleep(5);
        waitFor("IDLE", () -> coordinator.getState().phase == ConnectionState.Phase.IDLE);
        assertTrue(link.isClosed());
        assertFalse(transport.isLinked());
    }

    @Test
    public void commands_whenNotConnected_areWriteFailed() {
        try {
            coordinator.wake();
            fail();
        } catch (BottleException e) {
            assertEquals(ErrorKind.WRITE_FAILED, e.getKind());
        }
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
    }

    @Test
    public void writeFailure_faultsAndReleasesLink() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        driver.failWrites = true;
        try {
            coordinator.sendRawCommand("PING");
            fail();
        } catch (BottleException e) {
            assertEquals(ErrorKind.WRITE_FAILED, e.getKind());
        }
        assertEquals(ErrorKind.WRITE_FAILED, coordinator.getState().fault);
        assertTrue(link.isClosed());
        assertFalse(transport.isLinked());
    }

    @Test
    public void wakeAndConfigUpdate_areWritten() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        coordinator.wake();
        coordinator.sendConfigUpdate(java.util.Collections.singletonMap("interval_ms", 2000));
        coordinator.sendRawCommand("RESET");
        List<String> writes = link.writtenStrings();
        assertTrue(writes.get(0).contains("\"wake\""));
        assertTrue(writes.get(1).contains("\"config_update\""));
        assertEquals("RESET", writes.get(2));
    }

    // ---- scanning and diagnostics ----

    @Test
    public void startScan_publishesDevices_andReturnsToIdle() throws Exception {
        driver.addAdvertisement(BOTTLE, "SmartWaterBottle", -55);
        DeviceListListener devices = mock(DeviceListListener.class);
        coordinator.subscribeDevices(devices);

        assertTrue(coordinator.startScan());

        waitFor("scan end", () -> coordinator.getState().phase == ConnectionState.Phase.IDLE);
        verify(devices, atLeastOnce()).onDevicesChanged(any());
        assertEquals(1, coordinator.getAvailableDevices().size());
        connect();
        assertEquals("SmartWaterBottle", coordinator.getState().peripheral.name);
    }

    @Test
    public void startScan_whileConnected_isRefused() throws Exception {
        connect();
        assertFalse(coordinator.startScan());
        assertEquals(0, driver.scanStarts.get());
    }

    @Test
    public void diagnostics_describeSession() throws Exception {
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();
        push(link, "garbage", "95");

        String report = coordinator.getDiagnostics();

        assertTrue(report.contains("Connection: CONNECTED"));
        assertTrue(report.contains("Device: " + BOTTLE));
        assertTrue(report.contains("Subject: alice"));
        assertTrue(report.contains("Calibration: none"));
        assertTrue(report.contains("Unparseable payloads: 1"));
        assertTrue(report.contains("(fresh)"));
    }

    @Test
    public void shutdown_releasesRadio() throws Exception {
        FakeRadioDriver.FakeLink link = connect();
        coordinator.shutdown();
        assertTrue(link.isClosed());
        assertEquals(1, driver.closed.get());
        try {
            coordinator.connect(BOTTLE);
            fail();
        } catch (IllegalStateException expected) {
            // shut down
        }
    }

    // ---- ordering and delivery ----

    @Test
    public void defaultDelivery_blockedObserver_doesNotStallOthers() throws Exception {
        BleTransport ownTransport = new BleTransport(new FakeRadioDriver(), setting);
        SessionCoordinator own = new SessionCoordinator(ownTransport, store, null, setting);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastDelivered = new CountDownLatch(1);
        try {
            own.subscribe((r, l) -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            own.subscribe((r, l) -> fastDelivered.countDown());

            own.onReading(SensorReading.ofDistance(80, System.currentTimeMillis(), BOTTLE));

            assertTrue("second observer waited on the first", fastDelivered.await(2, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            own.shutdown();
        }
    }

    @Test
    public void stepArmedBeforeConnect_completesOnceReadingsArrive() throws Exception {
        coordinator.setActiveSubject("alice");
        ResultCallback<Calibration> cb = callback();
        coordinator.beginCalibration(CalibrationStep.EMPTY, cb);

        FakeRadioDriver.FakeLink link = connect();
        assertEquals(CalibrationEngine.Mode.COLLECTING_EMPTY, coordinator.getCalibrationMode());
        pushDistances(link, EMPTY_READINGS);

        ArgumentCaptor<Calibration> draft = ArgumentCaptor.forClass(Calibration.class);
        verify(cb).onSuccess(draft.capture());
        verify(cb, never()).onError(any());
        assertEquals(123.0, draft.getValue().emptyBaselineMm, 0.0);
    }

    @Test
    public void emptyBaseline_survivesReconnectBeforeFullStep() throws Exception {
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink first = connect();
        coordinator.beginCalibration(CalibrationStep.EMPTY, callback());
        pushDistances(first, EMPTY_READINGS);

        first.drop();
        assertEquals(ConnectionState.Phase.IDLE, coordinator.getState().phase);
        FakeRadioDriver.FakeLink second = connect();
        assertTrue(coordinator.isEmptyCalibrated());

        ResultCallback<Calibration> fullCb = callback();
        coordinator.beginCalibration(CalibrationStep.FULL, fullCb);
        pushDistances(second, FULL_READINGS);

        ArgumentCaptor<Calibration> saved = ArgumentCaptor.forClass(Calibration.class);
        verify(store).save(eq("alice"), saved.capture());
        assertEquals(123.0, saved.getValue().emptyBaselineMm, 0.0);
        assertEquals(27.0, saved.getValue().fullBaselineMm, 0.0);
        verify(fullCb, never()).onError(any());
    }

    @Test
    public void readingThatCompletesStep_isNotBookedAsConsumption() throws Exception {
        coordinator.setActiveSubject("alice");
        FakeRadioDriver.FakeLink link = connect();
        coordinator.beginCalibration(CalibrationStep.EMPTY, callback());

        for (int i = 0; i < 10; i++) link.push("{\"p\":5,\"d\":" + (118 + i % 3) + "}");
        coordinator.drain();

        verify(sink, never()).onVolume(anyString(), anyDouble(), anyLong(), any());
        assertEquals(CalibrationEngine.Mode.IDLE, coordinator.getCalibrationMode());

        push(link, "{\"p\":5,\"d\":118}");
        verify(sink, times(1)).onVolume(eq("alice"), eq(50.0), anyLong(), eq(LevelSource.DEVICE_REPORTED));
    }

    @Test
    public void rearmingWhileReadingsFlow_neverHandsOldResultToNewCallback() throws Exception {
        coordinator.setActiveSubject("alice");
        int samples = setting.calibrationSampleCount();
        AtomicInteger fed = new AtomicInteger();
        AtomicBoolean running = new AtomicBoolean(true);
        Future<?> feeder = background.submit(() -> {
            while (running.get()) {
                fed.incrementAndGet();
                coordinator.feedReadingToCalibration(SensorReading.ofDistance(100, System.currentTimeMillis(), BOTTLE));
            }
        });

        List<StepOutcome> armed = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            StepOutcome outcome = new StepOutcome(fed);
            armed.add(outcome);
            coordinator.beginCalibration(CalibrationStep.EMPTY, outcome);
            if (i % 4 == 0) Thread.sleep(1);
        }
        running.set(false);
        feeder.get(5, TimeUnit.SECONDS);
        coordinator.cancelCalibration();

        for (StepOutcome outcome : armed) {
            assertEquals(1, outcome.outcomes.get());
            if (outcome.fedAtSuccess >= 0) {
                // one reading counted just before arming may still land in the new step
                assertTrue("completed after " + (outcome.fedAtSuccess - outcome.fedAtArm) + " readings",
                        outcome.fedAtSuccess - outcome.fedAtArm >= samples - 1);
            }
        }
    }

    private static final class StepOutcome implements ResultCallback<Calibration> {
        private final AtomicInteger fed;
        final int fedAtArm;
        final AtomicInteger outcomes = new AtomicInteger();
        volatile int fedAtSuccess = -1;

        StepOutcome(AtomicInteger fed) {
            this.fed = fed;
            this.fedAtArm = fed.get();
        }

        @Override
        public void onSuccess(Calibration result) {
            fedAtSuccess = fed.get();
            outcomes.incrementAndGet();
        }

        @Override
        public void onError(Exception e) {
            outcomes.incrementAndGet();
        }
    }
}
