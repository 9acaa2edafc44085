package com.mouse.smartbet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LeagueCatalog {
    private List<LeagueDefinition> leagues = new ArrayList<>();

    /** Evaluated in list order; first match wins. */
    private List<TokenRule> heuristics = new ArrayList<>();
}
