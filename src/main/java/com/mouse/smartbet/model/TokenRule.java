package com.mouse.smartbet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Fallback league-name rule: matches when the normalized name contains every token of
 * {@code allOf} and, if {@code anyOf} is non-empty, at least one of those.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenRule {
    private String league;
    private List<String> allOf = List.of();
    private List<String> anyOf = List.of();

    public boolean matches(Set<String> tokens) {
        if (allOf != null && !tokens.containsAll(allOf)) return false;
        if (anyOf == null || anyOf.isEmpty()) return allOf != null && !allOf.isEmpty();
        return anyOf.stream().anyMatch(tokens::contains);
    }
}
