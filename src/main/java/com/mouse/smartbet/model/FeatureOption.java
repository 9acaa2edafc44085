package com.mouse.smartbet.model;

/**
 * A recognized optional match statistic and the neutral value used when it is absent.
 */
public record FeatureOption(String key, double defaultValue) {

    public static FeatureOption of(String key, double defaultValue) {
        return new FeatureOption(key, defaultValue);
    }
}
