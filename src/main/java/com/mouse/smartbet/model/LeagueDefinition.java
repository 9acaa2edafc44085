package com.mouse.smartbet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mouse.smartbet.enums.ModelStatus;
import lombok.Data;

import java.util.List;

/**
 * League entry as declared in the catalog file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LeagueDefinition {
    private String key;
    private String displayName;
    private List<String> aliases;
    private String schema;
    private double confidenceThreshold;
    private double oddsThreshold;
    private String modelArtifact;
    private ModelStatus status = ModelStatus.PRODUCTION;
}
