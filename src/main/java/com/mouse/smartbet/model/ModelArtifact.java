package com.mouse.smartbet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mouse.smartbet.enums.Outcome;
import lombok.Data;

import java.util.List;

/**
 * Serialized multinomial-logistic 1X2 model: one intercept and one weight row per class,
 * rows in {@link #classes} order. Optional standardization is applied before the weights.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifact {
    private String league;
    private String schema;
    private String version;
    private List<Outcome> classes;
    private double[] intercepts;
    private double[][] weights;
    private double[] featureMeans;
    private double[] featureScales;
}
