package com.sensor.anomaly.repository;

import com.sensor.anomaly.model.WindowPoint;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-sensor bounded history shared by every detector instance.
 *
 * <p>Implementations must make {@link #append} and {@link #readAndAppend} single atomic units
 * per sensor key: the new point is added at the tail and the head is trimmed until the window
 * holds at most {@link #capacity()} points. Unreachable storage surfaces as
 * {@link com.sensor.anomaly.exception.DependencyUnavailableException}.
 */
public interface SlidingWindowStore {

    int capacity();

    void append(String sensorId, Instant timestamp, double value);

    /**
     * Return the window as it was immediately before appending the new point, in the same
     * atomic step as the append. Concurrent callers for one sensor are serialized: each sees
     * every point appended before its own and none after.
     *
     * @return pre-append points oldest first; empty for a sensor with no history
     */
    List<WindowPoint> readAndAppend(String sensorId, Instant timestamp, double value);

    /**
     * @return points oldest first, never more than {@link #capacity()}; empty for an unknown sensor
     */
    List<WindowPoint> read(String sensorId);

    void clear(String sensorId);

    /**
     * Administrative bulk delete. Pattern is a glob over sensor ids ({@code *} and {@code ?}).
     *
     * @return number of windows deleted
     */
    int deleteByPattern(String pattern);

    int countByPattern(String pattern);

    /**
     * Current length of every window whose sensor id matches the pattern.
     */
    Map<String, Integer> windowSizes(String pattern);
}
