package com.campus.messaging.service;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based client metrics.
 *
 * Counters and gauges live in memory and are written to the debug log; tagged
 * counters are kept per tag combination ({@code name[key=value,...]}).
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(name);
        incrementCounter(taggedName(name, tags));
    }

    // ===== Gauge Metrics =====

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).updateAndGet(v -> Math.max(0, v - 1));
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Session Metrics =====

    public void recordConnectionAttempt(String conversationId, int attempt) {
        incrementCounter("session.connect.attempts", Tags.of("attempt", String.valueOf(attempt)));
        log.debug("Connection attempt: conversationId={}, attempt={}", conversationId, attempt);
    }

    public void recordConnectionOpened(String conversationId) {
        incrementCounter("session.connect.opened");
        incrementGauge("active_connections");
        log.debug("Connection opened: conversationId={}", conversationId);
    }

    public void recordConnectionClosed(String conversationId, int code) {
        incrementCounter("session.connect.closed", Tags.of("code", String.valueOf(code)));
        log.debug("Connection closed: conversationId={}, code={}", conversationId, code);
    }

    /**
     * Pairs with {@link #recordConnectionOpened}: called once when a session lets go of
     * a connection that opened, whether the server closed it or the client dropped it.
     */
    public void recordConnectionReleased(String conversationId) {
        decrementGauge("active_connections");
        log.debug("Connection released: conversationId={}", conversationId);
    }

    public void recordSessionFailed(String conversationId, String reason) {
        incrementCounter("session.failed");
        log.warn("Session failed: conversationId={}, reason={}", conversationId, reason);
    }

    public void recordFrameReceived(String frameType) {
        incrementCounter("session.frames.received", Tags.of("type", frameType));
    }

    public void recordFrameDropped(String cause) {
        incrementCounter("session.frames.dropped", Tags.of("cause", cause));
    }

    public void recordFrameSent(String frameType) {
        incrementCounter("session.frames.sent", Tags.of("type", frameType));
    }

    public void recordSendFailure(String frameType) {
        incrementCounter("session.frames.send_failed", Tags.of("type", frameType));
    }

    // ===== Utility Methods =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public long getCounterValue(String name, Tags tags) {
        return getCounterValue(taggedName(name, tags));
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    public void printSummary() {
        log.info("=== Metrics Summary ===");
        log.info("Counters:");
        counters.forEach((name, value) -> log.info("  {} = {}", name, value.get()));
        log.info("Gauges:");
        gauges.forEach((name, value) -> log.info("  {} = {}", name, value.get()));
        log.info("=====================");
    }

    private static String taggedName(String name, Tags tags) {
        StringBuilder sb = new StringBuilder(name).append('[');
        boolean first = true;
        for (Tag tag : tags) {
            if (!first) {
                sb.append(',');
            }
            sb.append(tag.getKey()).append('=').append(tag.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }
}
