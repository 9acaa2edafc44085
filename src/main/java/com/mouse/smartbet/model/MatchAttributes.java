package com.mouse.smartbet.model;

import com.mouse.smartbet.exception.InvalidInputException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes of one fixture: the required identity (teams and 1X2 odds) plus a
 * bag of optional numeric statistics read by the league feature adapters.
 */
@Slf4j
@Getter
@ToString
@Builder(toBuilder = true)
public class MatchAttributes {

    public static final String MATCH_ID = "match_id";
    public static final String LEAGUE = "league";
    public static final String HOME_TEAM = "home_team";
    public static final String AWAY_TEAM = "away_team";
    public static final String HOME_WIN_ODDS = "home_win_odds";
    public static final String DRAW_ODDS = "draw_odds";
    public static final String AWAY_WIN_ODDS = "away_win_odds";

    private static final List<String> REQUIRED = List.of(HOME_TEAM, AWAY_TEAM, HOME_WIN_ODDS, DRAW_ODDS, AWAY_WIN_ODDS);

    private final String matchId;
    private final String homeTeam;
    private final String awayTeam;
    private final OddsTriple odds;

    @Singular
    private final Map<String, Double> stats;

    /**
     * Value of an optional statistic, or the option's default when absent.
     */
    public double value(FeatureOption option) {
        Double v = stats.get(option.key());
        return v != null ? v : option.defaultValue();
    }

    public Optional<Double> stat(String key) {
        return Optional.ofNullable(stats.get(key));
    }

    /** Explicit match id, or {@code home_away} when none was supplied. */
    public String matchIdOrDefault() {
        if (matchId != null && !matchId.isBlank()) return matchId;
        return homeTeam + "_" + awayTeam;
    }

    public String description() {
        return homeTeam + " vs " + awayTeam;
    }

    /**
     * Build from a loosely-typed attribute map. Only the identity fields are required.
     *
     * @throws InvalidInputException if a team name or one of the three odds is missing or not numeric
     */
    public static MatchAttributes fromMap(Map<String, ?> raw) {
        if (raw == null) {
            throw new InvalidInputException("Match attributes cannot be null");
        }
        for (String field : REQUIRED) {
            Object v = raw.get(field);
            if (v == null || (v instanceof String s && s.isBlank())) {
                throw new InvalidInputException("Missing required field: " + field);
            }
        }

        OddsTriple odds = OddsTriple.of(
                requiredNumber(raw, HOME_WIN_ODDS),
                requiredNumber(raw, DRAW_ODDS),
                requiredNumber(raw, AWAY_WIN_ODDS));

        Map<String, Double> stats = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (REQUIRED.contains(key) || MATCH_ID.equals(key) || LEAGUE.equals(key) || value == null) return;
            Double d = toDouble(value);
            if (d == null) {
                log.warn("Ignoring non-numeric match attribute {}={}, default will apply", key, value);
                return;
            }
            stats.put(key, d);
        });

        Object matchId = raw.get(MATCH_ID);
        return MatchAttributes.builder()
                .matchId(matchId != null ? String.valueOf(matchId) : null)
                .homeTeam(String.valueOf(raw.get(HOME_TEAM)).trim())
                .awayTeam(String.valueOf(raw.get(AWAY_TEAM)).trim())
                .odds(odds)
                .stats(stats)
                .build();
    }

    private static double requiredNumber(Map<String, ?> raw, String field) {
        Double d = toDouble(raw.get(field));
        if (d == null) {
            throw new InvalidInputException("Field " + field + " must be numeric, got: " + raw.get(field));
        }
        return d;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
