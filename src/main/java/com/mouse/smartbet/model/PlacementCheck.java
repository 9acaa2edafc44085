package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.PlacementVerdict;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ledger answer to "may this stake be placed now". Warnings are advisory and never flip the verdict.
 */
@Value
@Builder
public class PlacementCheck {
    PlacementVerdict verdict;
    String reason;
    @Singular
    List<String> warnings;

    public boolean isAllowed() {
        return verdict.isAllowed();
    }

    public static PlacementCheck allowed(List<String> warnings) {
        return PlacementCheck.builder()
                .verdict(PlacementVerdict.ALLOWED)
                .reason("OK")
                .warnings(warnings)
                .build();
    }

    public static PlacementCheck refused(PlacementVerdict verdict, String reason) {
        return PlacementCheck.builder()
                .verdict(verdict)
                .reason(reason)
                .build();
    }
}
