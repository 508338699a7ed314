package com.sensor.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.ListOperation;
import com.aerospike.client.cdt.ListReturnType;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.sensor.anomaly.config.AerospikeConfig;
import com.sensor.anomaly.config.DetectionConfig;
import com.sensor.anomaly.config.MetricsConfig;
import com.sensor.anomaly.exception.DependencyUnavailableException;
import com.sensor.anomaly.model.WindowPoint;
import com.sensor.anomaly.support.BoundedRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Sliding windows stored as one Aerospike record per sensor, with the points kept in an
 * ordered list bin. Read, append and trim run in a single {@code operate()} call, which
 * Aerospike executes under the record lock, so concurrent writers to one sensor never lose
 * updates and never classify against the same snapshot.
 */
@Repository
public class AerospikeSlidingWindowStore implements SlidingWindowStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeSlidingWindowStore.class);

    static final String BIN_SENSOR_ID = "sensorId";
    static final String BIN_POINTS = "points";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_VALUE = "value";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;
    private final int windowSize;
    private final BoundedRetry retry;
    private final MetricsConfig metricsConfig;

    public AerospikeSlidingWindowStore(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy,
                                       @Qualifier("defaultScanPolicy") ScanPolicy scanPolicy,
                                       DetectionConfig detectionConfig,
                                       MetricsConfig metricsConfig) {
        if (detectionConfig.getWindowSize() < 1) {
            throw new IllegalArgumentException("detection.window-size must be >= 1");
        }
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.scanPolicy = scanPolicy;
        this.windowSize = detectionConfig.getWindowSize();
        this.metricsConfig = metricsConfig;

        DetectionConfig.Retry retryConfig = detectionConfig.getStoreRetry();
        this.retry = new BoundedRetry("window-store", retryConfig.getMaxAttempts(),
                retryConfig.getInitialBackoffMs(), retryConfig.getMaxBackoffMs(),
                AerospikeSlidingWindowStore::isTransient);
    }

    @Override
    public int capacity() {
        return windowSize;
    }

    @Override
    public void append(String sensorId, Instant timestamp, double value) {
        Key key = key(sensorId);
        Operation[] operations = appendOperations(sensorId, timestamp, value);
        withStore("append", () -> client.operate(writePolicy, key, operations));
    }

    /**
     * Tail insert followed by removal of everything except the last {@code windowSize}
     * elements (INVERTED selects the complement of the index range).
     */
    Operation[] appendOperations(String sensorId, Instant timestamp, double value) {
        Map<String, Object> point = new HashMap<>();
        point.put(FIELD_TIMESTAMP, timestamp.toString());
        point.put(FIELD_VALUE, value);

        return new Operation[] {
                Operation.put(new Bin(BIN_SENSOR_ID, sensorId)),
                ListOperation.append(BIN_POINTS, Value.get(point)),
                ListOperation.removeByIndexRange(BIN_POINTS, -windowSize, ListReturnType.INVERTED)
        };
    }

    @Override
    public List<WindowPoint> readAndAppend(String sensorId, Instant timestamp, double value) {
        Key key = key(sensorId);
        Operation[] operations = readAndAppendOperations(sensorId, timestamp, value);
        Record record = withStore("read-append", () -> client.operate(writePolicy, key, operations));
        if (record == null) {
            return Collections.emptyList();
        }
        return toPoints(sensorId, preAppendPoints(record.getValue(BIN_POINTS)));
    }

    /**
     * Same as {@link #appendOperations} with a leading get of the points bin, so the returned
     * list is the window before this append.
     */
    Operation[] readAndAppendOperations(String sensorId, Instant timestamp, double value) {
        Operation[] modify = appendOperations(sensorId, timestamp, value);
        Operation[] operations = new Operation[modify.length + 1];
        operations[0] = Operation.get(BIN_POINTS);
        System.arraycopy(modify, 0, operations, 1, modify.length);
        return operations;
    }

    /**
     * Several operations on one bin come back as a list of per-operation results; the get
     * is the first. A missing bin reads as null.
     */
    static List<?> preAppendPoints(Object binValue) {
        if (!(binValue instanceof List<?> results) || results.isEmpty()) {
            return Collections.emptyList();
        }
        Object first = results.get(0);
        if (first == null) {
            return Collections.emptyList();
        }
        if (first instanceof List<?> points) {
            return points;
        }
        return results;
    }

    @Override
    public List<WindowPoint> read(String sensorId) {
        Key key = key(sensorId);
        Record record = withStore("read", () -> client.get(readPolicy, key));
        if (record == null) {
            return Collections.emptyList();
        }
        return toPoints(sensorId, record.getList(BIN_POINTS));
    }

    @Override
    public void clear(String sensorId) {
        Key key = key(sensorId);
        withStore("clear", () -> client.delete(writePolicy, key));
    }

    @Override
    public int deleteByPattern(String pattern) {
        Pattern matcher = globToRegex(pattern);
        ConcurrentLinkedQueue<Key> matching = new ConcurrentLinkedQueue<>();

        withStore("scan", () -> {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SENSOR_WINDOWS,
                    (key, record) -> {
                        String sensorId = record.getString(BIN_SENSOR_ID);
                        if (sensorId != null && matcher.matcher(sensorId).matches()) {
                            matching.add(key);
                        }
                    }, BIN_SENSOR_ID);
            return null;
        });

        int deleted = 0;
        for (Key key : matching) {
            Boolean existed = withStore("delete", () -> client.delete(writePolicy, key));
            if (Boolean.TRUE.equals(existed)) {
                deleted++;
            }
        }
        log.info("Cleared {} sensor windows matching '{}'", deleted, pattern);
        return deleted;
    }

    @Override
    public int countByPattern(String pattern) {
        return windowSizes(pattern).size();
    }

    @Override
    public Map<String, Integer> windowSizes(String pattern) {
        Pattern matcher = globToRegex(pattern);
        Map<String, Integer> sizes = new ConcurrentHashMap<>();

        withStore("scan", () -> {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SENSOR_WINDOWS,
                    (key, record) -> {
                        String sensorId = record.getString(BIN_SENSOR_ID);
                        if (sensorId != null && matcher.matcher(sensorId).matches()) {
                            List<?> points = record.getList(BIN_POINTS);
                            sizes.put(sensorId, points != null ? points.size() : 0);
                        }
                    }, BIN_SENSOR_ID, BIN_POINTS);
            return null;
        });
        return sizes;
    }

    private Key key(String sensorId) {
        return new Key(namespace, AerospikeConfig.SET_SENSOR_WINDOWS, sensorId);
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return retry.call(operation, () -> {
                try {
                    return action.get();
                } catch (AerospikeException e) {
                    throw new StoreFailure(e);
                }
            });
        } catch (StoreFailure e) {
            // Not transient (e.g. server-side error code): no point retrying, still fatal for the caller
            metricsConfig.recordStoreFailure(operation);
            throw new DependencyUnavailableException("window-store", 1, e.getCause());
        } catch (DependencyUnavailableException e) {
            metricsConfig.recordStoreFailure(operation);
            throw e;
        }
    }

    private List<WindowPoint> toPoints(String sensorId, List<?> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        List<WindowPoint> points = new ArrayList<>(raw.size());
        for (Object element : raw) {
            if (!(element instanceof Map<?, ?> map)) {
                log.warn("Skipping malformed window entry for sensor {}: {}", sensorId, element);
                continue;
            }
            Object timestamp = map.get(FIELD_TIMESTAMP);
            Object value = map.get(FIELD_VALUE);
            if (!(value instanceof Number number)) {
                log.warn("Skipping window entry without numeric value for sensor {}: {}", sensorId, map);
                continue;
            }
            points.add(WindowPoint.builder()
                    .timestamp(timestamp != null ? Instant.parse(timestamp.toString()) : null)
                    .value(number.doubleValue())
                    .build());
        }
        return points;
    }

    static boolean isTransient(Throwable e) {
        Throwable cause = e instanceof StoreFailure ? e.getCause() : e;
        return cause instanceof AerospikeException.Timeout
                || cause instanceof AerospikeException.Connection;
    }

    static Pattern globToRegex(String glob) {
        String effective = (glob == null || glob.isBlank()) ? "*" : glob;
        StringBuilder regex = new StringBuilder();
        for (char c : effective.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    /**
     * Carries an Aerospike failure through the retry loop.
     */
    private static final class StoreFailure extends RuntimeException {
        StoreFailure(AerospikeException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
