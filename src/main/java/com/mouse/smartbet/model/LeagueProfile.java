package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.ModelStatus;
import com.mouse.smartbet.interfaces.FeatureAdapter;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Canonical description of a supported league: its feature adapter, decision thresholds
 * and the model artifact its predictor is loaded from. Immutable after registration.
 */
@Value
@Builder(toBuilder = true)
public class LeagueProfile {

    @NonNull
    String key;

    String displayName;

    @Singular
    Set<String> aliases;

    @NonNull
    String schemaId;

    @NonNull
    FeatureAdapter featureAdapter;

    double confidenceThreshold;

    double oddsThreshold;

    @NonNull
    String modelArtifact;

    @Builder.Default
    ModelStatus status = ModelStatus.PRODUCTION;
}
