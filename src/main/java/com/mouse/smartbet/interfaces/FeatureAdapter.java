package com.mouse.smartbet.interfaces;

import com.mouse.smartbet.model.FeatureOption;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.MatchInsights;

import java.util.List;

/**
 * Maps match attributes to the fixed-length, fixed-order vector a league's model was trained on.
 * Implementations are pure functions.
 */
public interface FeatureAdapter {

    /** Identifier matched against the league catalog and the model artifact. */
    String schemaId();

    /** Column names in vector order. */
    List<String> featureNames();

    /** Optional statistics this adapter reads, with their defaults. */
    List<FeatureOption> options();

    double[] toFeatureVector(MatchAttributes match);

    default int featureCount() {
        return featureNames().size();
    }

    /** Display facts, league alerts and team signals for one fixture. */
    default MatchInsights insights(MatchAttributes match) {
        return MatchInsights.empty();
    }
}
