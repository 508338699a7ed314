package com.sensor.anomaly.engine.reconstruction;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.List;

/**
 * Pretrained standard scaler + PCA projection + error threshold. Immutable after construction
 * and safe to share between threads.
 *
 * <p>For an input x: {@code z = (x - mean) / scale}, {@code p = C (z - mu)},
 * {@code r = C^T p + mu}, error = mean of {@code (z - r)^2}. C holds one principal axis per row.
 */
public final class ReconstructionModel {

    private final List<String> featureNames;
    private final RealVector scalerMean;
    private final RealVector scalerScale;
    private final RealMatrix components;
    private final RealVector pcaMean;
    private final double threshold;
    private final String source;

    ReconstructionModel(List<String> featureNames, double[] scalerMean, double[] scalerScale,
                        double[][] components, double[] pcaMean, double threshold, String source) {
        this.featureNames = List.copyOf(featureNames);
        this.scalerMean = new ArrayRealVector(scalerMean);
        this.scalerScale = new ArrayRealVector(scalerScale);
        this.components = new Array2DRowRealMatrix(components);
        this.pcaMean = new ArrayRealVector(pcaMean);
        this.threshold = threshold;
        this.source = source;
    }

    public double reconstructionError(double[] features) {
        if (features.length != featureNames.size()) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d features, got %d", featureNames.size(), features.length));
        }
        RealVector scaled = new ArrayRealVector(features).subtract(scalerMean).ebeDivide(scalerScale);
        RealVector centered = scaled.subtract(pcaMean);
        RealVector projected = components.operate(centered);
        RealVector reconstructed = components.preMultiply(projected).add(pcaMean);

        RealVector residual = scaled.subtract(reconstructed);
        return residual.dotProduct(residual) / residual.getDimension();
    }

    public boolean isAnomalous(double reconstructionError) {
        return reconstructionError > threshold;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getComponentCount() {
        return components.getRowDimension();
    }

    public String getSource() {
        return source;
    }
}
