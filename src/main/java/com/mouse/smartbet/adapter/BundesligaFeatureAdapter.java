package com.mouse.smartbet.adapter;

import org.springframework.stereotype.Component;

@Component
public class BundesligaFeatureAdapter extends GoalRateFeatureAdapter {

    public static final String SCHEMA = "bundesliga_v1";

    // goals for/against home, away; win rate home, away; draw rate home, away
    private static final double[] DEFAULTS = {1.8, 1.3, 1.5, 1.4, 0.5, 0.4, 0.25, 0.25};

    public BundesligaFeatureAdapter() {
        super(SCHEMA, DEFAULTS, true);
    }
}
