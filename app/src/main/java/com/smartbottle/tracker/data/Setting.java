package com.smartbottle.tracker.data;

/**
 * Runtime knobs for the bottle session. Fields are nullable so a partial JSON file only
 * overrides what it names; read them as {@code field != null ? field : DEFAULT_...}.
 */
public class Setting {

    public static final long    DEFAULT_SCAN_TIMEOUT_MS          = 15_000L;
    public static final long    DEFAULT_CONNECT_TIMEOUT_MS       = 10_000L;
    public static final long    DEFAULT_WRITE_TIMEOUT_MS         = 5_000L;
    public static final long    DEFAULT_DISCONNECT_TIMEOUT_MS    = 5_000L;

    public static final double  DEFAULT_MIN_VALID_DISTANCE_MM    = 40.0;
    public static final int     DEFAULT_CALIBRATION_SAMPLE_COUNT = 10;
    public static final int     DEFAULT_BOTTLE_CAPACITY_ML       = 1000;

    public static final long    DEFAULT_SLEEP_GRACE_MS           = 3_000L;
    public static final boolean DEFAULT_INCLUDE_NAMED_DEVICES    = true;
    public static final long    DEFAULT_DATA_FRESH_MS            = 10_000L;
    public static final int     DEFAULT_OBSERVER_QUEUE_LIMIT     = 256;

    // --- radio bounds ---
    /** Scan window when the caller does not pass one. */
    public Long scan_timeout_ms = DEFAULT_SCAN_TIMEOUT_MS;
    /** Connect plus service discovery must finish inside this. */
    public Long connect_timeout_ms = DEFAULT_CONNECT_TIMEOUT_MS;
    public Long write_timeout_ms = DEFAULT_WRITE_TIMEOUT_MS;
    public Long disconnect_timeout_ms = DEFAULT_DISCONNECT_TIMEOUT_MS;

    // --- readings ---
    /** Anything closer than this is the sensor seeing the table, not water. */
    public Double min_valid_distance_mm = DEFAULT_MIN_VALID_DISTANCE_MM;
    /** Readings collected per calibration step. */
    public Integer calibration_sample_count = DEFAULT_CALIBRATION_SAMPLE_COUNT;
    public Integer default_bottle_capacity_ml = DEFAULT_BOTTLE_CAPACITY_ML;

    // --- session ---
    public Long sleep_grace_ms = DEFAULT_SLEEP_GRACE_MS;
    /** List any named peripheral when nothing advertises the bottle service. */
    public Boolean include_named_devices = DEFAULT_INCLUDE_NAMED_DEVICES;
    public Long data_fresh_ms = DEFAULT_DATA_FRESH_MS;
    /** Pending events per observer before the oldest is dropped. */
    public Integer observer_queue_limit = DEFAULT_OBSERVER_QUEUE_LIMIT;

    public Setting() {}

    public long scanTimeoutMs() { return scan_timeout_ms != null ? scan_timeout_ms : DEFAULT_SCAN_TIMEOUT_MS; }
    public long connectTimeoutMs() { return connect_timeout_ms != null ? connect_timeout_ms : DEFAULT_CONNECT_TIMEOUT_MS; }
    public long writeTimeoutMs() { return write_timeout_ms != null ? write_timeout_ms : DEFAULT_WRITE_TIMEOUT_MS; }
    public long disconnectTimeoutMs() { return disconnect_timeout_ms != null ? disconnect_timeout_ms : DEFAULT_DISCONNECT_TIMEOUT_MS; }
    public double minValidDistanceMm() { return min_valid_distance_mm != null ? min_valid_distance_mm : DEFAULT_MIN_VALID_DISTANCE_MM; }
    public int calibrationSampleCount() { return calibration_sample_count != null ? calibration_sample_count : DEFAULT_CALIBRATION_SAMPLE_COUNT; }
    public int defaultBottleCapacityMl() { return default_bottle_capacity_ml != null ? default_bottle_capacity_ml : DEFAULT_BOTTLE_CAPACITY_ML; }
    public long sleepGraceMs() { return sleep_grace_ms != null ? sleep_grace_ms : DEFAULT_SLEEP_GRACE_MS; }
    public boolean includeNamedDevices() { return include_named_devices != null ? include_named_devices : DEFAULT_INCLUDE_NAMED_DEVICES; }
    public long dataFreshMs() { return data_fresh_ms != null ? data_fresh_ms : DEFAULT_DATA_FRESH_MS; }
    public int observerQueueLimit() { return observer_queue_limit != null ? observer_queue_limit : DEFAULT_OBSERVER_QUEUE_LIMIT; }

    @Override
    public String toString() {
        return "Setting{" +
                "scan_timeout_ms=" + scan_timeout_ms +
                ", connect_timeout_ms=" + connect_timeout_ms +
                ", write_timeout_ms=" + write_timeout_ms +
                ", disconnect_timeout_ms=" + disconnect_timeout_ms +
                ", min_valid_distance_mm=" + min_valid_distance_mm +
                ", calibration_sample_count=" + calibration_sample_count +
                ", default_bottle_capacity_ml=" + default_bottle_capacity_ml +
                ", sleep_grace_ms=" + sleep_grace_ms +
                ", include_named_devices=" + include_named_devices +
                ", data_fresh_ms=" + data_fresh_ms +
                ", observer_queue_limit=" + observer_queue_limit +
                '}';
    }
}
