package com.mouse.smartbet.predictor;

import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.exception.InvalidInputException;
import com.mouse.smartbet.interfaces.Predictor;

import java.util.List;

/**
 * Multinomial logistic regression. Output is always re-ordered to (home, away, draw)
 * whatever order the artifact stored its classes in.
 */
public class SoftmaxPredictor implements Predictor {

    private final String schemaId;
    private final double[] intercepts;
    private final double[][] weights;
    private final double[] means;
    private final double[] scales;
    // canonical slot for each stored class row
    private final int[] canonicalSlot;
    private final int featureCount;

    public SoftmaxPredictor(String schemaId, List<Outcome> classes, double[] intercepts, double[][] weights,
                            double[] means, double[] scales) {
        this.schemaId = schemaId;
        this.intercepts = intercepts.clone();
        this.weights = new double[weights.length][];
        for (int i = 0; i < weights.length; i++) {
            this.weights[i] = weights[i].clone();
        }
        this.featureCount = weights[0].length;
        this.means = means != null ? means.clone() : null;
        this.scales = scales != null ? scales.clone() : null;
        this.canonicalSlot = new int[classes.size()];
        for (int i = 0; i < classes.size(); i++) {
            canonicalSlot[i] = Outcome.PRIORITY.indexOf(classes.get(i));
        }
    }

    @Override
    public double[] predict(double[] features) {
        if (features == null || features.length != featureCount) {
            throw new InvalidInputException("Expected " + featureCount + " features for " + schemaId
                    + ", got " + (features == null ? 0 : features.length));
        }

        double[] x = standardize(features);
        double[] logits = new double[weights.length];
        double maxLogit = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < weights.length; k++) {
            double z = intercepts[k];
            for (int j = 0; j < featureCount; j++) {
                z += weights[k][j] * x[j];
            }
            logits[k] = z;
            maxLogit = Math.max(maxLogit, z);
        }

        double total = 0;
        double[] exp = new double[logits.length];
        for (int k = 0; k < logits.length; k++) {
            exp[k] = Math.exp(logits[k] - maxLogit);
            total += exp[k];
        }

        double[] out = new double[3];
        for (int k = 0; k < exp.length; k++) {
            out[canonicalSlot[k]] = exp[k] / total;
        }
        return out;
    }

    @Override
    public int featureCount() {
        return featureCount;
    }

    @Override
    public String schemaId() {
        return schemaId;
    }

    private double[] standardize(double[] features) {
        if (means == null || scales == null) return features;
        double[] x = new double[features.length];
        for (int j = 0; j < features.length; j++) {
            double scale = scales[j] == 0 ? 1.0 : scales[j];
            x[j] = (features[j] - means[j]) / scale;
        }
        return x;
    }
}
