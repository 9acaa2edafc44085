package com.mouse.smartbet.adapter;

import org.springframework.stereotype.Component;

@Component
public class Ligue1FeatureAdapter extends GoalRateFeatureAdapter {

    public static final String SCHEMA = "ligue_1_v1";

    // goals for/against home, away; win rate home, away; draw rate home, away
    private static final double[] DEFAULTS = {1.6, 1.2, 1.4, 1.3, 0.45, 0.35, 0.28, 0.28};

    public Ligue1FeatureAdapter() {
        super(SCHEMA, DEFAULTS, false);
    }
}
