package com.mouse.smartbet.interfaces;

import com.mouse.smartbet.exception.ModelLoadFailureException;
import com.mouse.smartbet.model.LeagueProfile;

public interface PredictorLoader {

    /**
     * Load the trained artifact referenced by the profile. Potentially slow.
     *
     * @throws ModelLoadFailureException if the artifact is missing, unreadable or does not fit the profile's schema
     */
    Predictor load(LeagueProfile profile);
}
