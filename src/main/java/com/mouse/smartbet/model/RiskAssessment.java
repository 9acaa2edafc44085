package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.RiskLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskAssessment {
    RiskLevel level;
    int score;
    @Singular
    List<String> factors;
    String explanation;

    /** No stake, nothing to classify. */
    public static RiskAssessment none(String reason) {
        return RiskAssessment.builder()
                .level(RiskLevel.NONE)
                .score(0)
                .explanation("No stake recommended: " + reason)
                .build();
    }
}
