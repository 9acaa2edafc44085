package com.mouse.smartbet.interfaces;

/**
 * A trained 1X2 classifier for one league.
 */
public interface Predictor {

    /**
     * @param features vector in the league's schema order
     * @return probabilities in canonical order: home, away, draw
     */
    double[] predict(double[] features);

    int featureCount();

    String schemaId();
}
