package com.sensor.anomaly.engine.statistical;

import com.sensor.anomaly.model.AlarmType;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Tukey fences over a sample of prior values.
 *
 * Quartiles use linear interpolation between closest ranks (R-7, the same estimator as
 * numpy's default percentile), so results are reproducible from the stored window alone.
 */
public final class QuartileBand {

    private final double q1;
    private final double q3;
    private final double lowerBound;
    private final double upperBound;
    private final double min;
    private final double max;

    private QuartileBand(double q1, double q3, double lowerBound, double upperBound, double min, double max) {
        this.q1 = q1;
        this.q3 = q3;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.min = min;
        this.max = max;
    }

    public static QuartileBand of(double[] values, double iqrMultiplier) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Cannot compute quartiles of an empty sample");
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        percentile.setData(values);
        double q1 = percentile.evaluate(25.0);
        double q3 = percentile.evaluate(75.0);
        double iqr = q3 - q1;

        double min = values[0];
        double max = values[0];
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new QuartileBand(q1, q3, q1 - iqrMultiplier * iqr, q3 + iqrMultiplier * iqr, min, max);
    }

    /**
     * First matching rule wins: beyond a fence is Low/High, and Low-Low/High-High when the
     * value is also a new extreme for the sample; inside the fences but outside [q1, q3] is
     * Low/High.
     */
    public AlarmType classify(double v) {
        if (v < lowerBound) {
            return v < min ? AlarmType.LOW_LOW : AlarmType.LOW;
        }
        if (v > upperBound) {
            return v > max ? AlarmType.HIGH_HIGH : AlarmType.HIGH;
        }
        if (v < q1) {
            return AlarmType.LOW;
        }
        if (v > q3) {
            return AlarmType.HIGH;
        }
        return AlarmType.OK;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    @Override
    public String toString() {
        return String.format("q1=%.4f q3=%.4f fences=[%.4f, %.4f] range=[%.4f, %.4f]",
                q1, q3, lowerBound, upperBound, min, max);
    }
}
