package com.smartbottle.tracker.logic;

import com.smartbottle.tracker.data.SensorReading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Turns one notification payload into a {@link SensorReading}. Shapes are tried in order
 * and the first match wins; a payload no shape accepts is logged, counted and dropped.
 * Safe for concurrent use.
 */
public class TelemetryDecoder {
    private static final Logger log = LoggerFactory.getLogger(TelemetryDecoder.class);

    private static final int MAX_LOGGED_PAYLOAD_CHARS = 64;

    private final List<PayloadShape> shapes;
    private final AtomicLong unparseable = new AtomicLong();

    public TelemetryDecoder() {
        this(Arrays.asList(
                new CompactPayloadShape(),
                new DistancePayloadShape(),
                new BareNumberPayloadShape()));
    }

    public TelemetryDecoder(@Nonnull List<PayloadShape> shapes) {
        this.shapes = Collections.unmodifiableList(new ArrayList<>(shapes));
    }

    @Nullable
    public SensorReading decode(@Nullable byte[] payload, @Nonnull String sourceId, long timestampMs) {
        if (payload == null || payload.length == 0) {
            return drop("<empty>", sourceId);
        }
        return decode(new String(payload, StandardCharsets.UTF_8), sourceId, timestampMs);
    }

    @Nullable
    public SensorReading decode(@Nullable String payload, @Nonnull String sourceId, long timestampMs) {
        if (payload == null) return drop("<null>", sourceId);
        String text = payload.trim();
        for (PayloadShape shape : shapes) {
            SensorReading reading;
            try {
                reading = shape.tryParse(text, sourceId, timestampMs);
            } catch (RuntimeException e) {
                log.warn(shape.getName() + " threw on payload from " + sourceId, e);
                continue;
            }
            if (reading != null) {
                if (log.isDebugEnabled()) {
                    log.debug("Decoded " + reading + " via " + shape.getName());
                }
                return reading;
            }
        }
        return drop(text, sourceId);
    }

    /** Count of payloads dropped since construction. */
    public long getUnparseableCount() {
        return unparseable.get();
    }

    private SensorReading drop(String text, String sourceId) {
        long count = unparseable.incrementAndGet();
        String shown = text.length() > MAX_LOGGED_PAYLOAD_CHARS
                ? text.substring(0, MAX_LOGGED_PAYLOAD_CHARS) + "..." : text;
        log.warn("Unparseable payload from " + sourceId + " dropped (#" + count + "): " + shown);
        return null;
    }
}
