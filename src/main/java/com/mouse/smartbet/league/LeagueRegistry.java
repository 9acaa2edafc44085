package com.mouse.smartbet.league;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.smartbet.exception.UnsupportedLeagueException;
import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.model.LeagueCatalog;
import com.mouse.smartbet.model.LeagueDefinition;
import com.mouse.smartbet.model.LeagueProfile;
import com.mouse.smartbet.model.TokenRule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.text.Normalizer;
import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves free-form league names to a canonical {@link LeagueProfile}.
 *
 * Resolution order, first hit wins:
 *   1. normalize (diacritics, case, punctuation, whitespace)
 *   2. exact key match
 *   3. alias table
 *   4. token heuristics from the catalog, in declared order
 *
 * Profiles are registered once at startup; lookups read immutable snapshots.
 */
@Slf4j
@Component
public class LeagueRegistry {

    private static final String CATALOG_PATH_DEFAULT = "classpath:static/leagues.json";
    private static final Pattern DIACRITICS_PATTERN = Pattern.compile("\\p{M}");
    private static final Pattern NON_ALPHANUM_PATTERN = Pattern.compile("[^\\p{Alnum}]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final Map<String, FeatureAdapter> adaptersBySchema;

    @Value("${smartbet.leagues.catalog:" + CATALOG_PATH_DEFAULT + "}")
    private String catalogPath = CATALOG_PATH_DEFAULT;

    private volatile Map<String, LeagueProfile> profilesByKey = Map.of();
    private volatile Map<String, String> aliasToKey = Map.of();
    private volatile List<TokenRule> heuristics = List.of();

    public LeagueRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader, List<FeatureAdapter> adapters) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.adaptersBySchema = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(FeatureAdapter::schemaId, Function.identity()));
    }

    @PostConstruct
    public void init() {
        log.info("Initializing LeagueRegistry from {}", catalogPath);
        LeagueCatalog catalog;
        try {
            catalog = loadCatalog();
        } catch (IOException e) {
            log.error("Failed to load league catalog from {}", catalogPath, e);
            throw new IllegalStateException("Failed to load league catalog from " + catalogPath, e);
        }

        for (LeagueDefinition definition : catalog.getLeagues()) {
            register(toProfile(definition));
        }
        this.heuristics = List.copyOf(catalog.getHeuristics());

        log.info("LeagueRegistry initialized: leagues={}, aliases={}, heuristics={}",
                profilesByKey.size(), aliasToKey.size(), heuristics.size());
    }

    /**
     * Add a profile. Meant for startup wiring only.
     *
     * @throws IllegalArgumentException if the key is taken or an alias already points at another league
     */
    public synchronized void register(LeagueProfile profile) {
        String key = normalize(profile.getKey());
        if (!key.equals(profile.getKey())) {
            throw new IllegalArgumentException("League key must already be normalized: " + profile.getKey());
        }
        if (profilesByKey.containsKey(key)) {
            throw new IllegalArgumentException("League already registered: " + key);
        }

        Map<String, String> tmpAliases = new HashMap<>(aliasToKey);
        for (String alias : profile.getAliases()) {
            if (alias == null) continue;
            String a = normalize(alias);
            if (a.isEmpty()) continue;
            String owner = tmpAliases.get(a);
            if (owner != null && !owner.equals(key)) {
                throw new IllegalArgumentException(
                        "Alias '" + alias + "' of " + key + " already maps to " + owner);
            }
            if (profilesByKey.containsKey(a) && !a.equals(key)) {
                throw new IllegalArgumentException("Alias '" + alias + "' collides with league key " + a);
            }
            tmpAliases.put(a, key);
        }

        Map<String, LeagueProfile> tmpProfiles = new LinkedHashMap<>(profilesByKey);
        tmpProfiles.put(key, profile);

        this.profilesByKey = Collections.unmodifiableMap(tmpProfiles);
        this.aliasToKey = Map.copyOf(tmpAliases);

        log.info("Registered league {} [schema={}, features={}, confidence>={}, odds>={}, status={}]",
                key, profile.getSchemaId(), profile.getFeatureAdapter().featureCount(),
                profile.getConfidenceThreshold(), profile.getOddsThreshold(), profile.getStatus());
    }

    /**
     * @return canonical league key
     * @throws UnsupportedLeagueException if no stage of the pipeline matches
     */
    public String resolve(String leagueName) {
        return findKey(leagueName).orElseThrow(() -> new UnsupportedLeagueException(leagueName,
                "League '" + leagueName + "' not supported. Available: " + String.join(", ", supportedKeys())));
    }

    public Optional<String> findKey(String leagueName) {
        if (leagueName == null || leagueName.isBlank()) return Optional.empty();
        String normalized = normalize(leagueName);
        if (normalized.isEmpty()) return Optional.empty();

        if (profilesByKey.containsKey(normalized)) {
            return Optional.of(normalized);
        }

        String aliased = aliasToKey.get(normalized);
        if (aliased != null) {
            return Optional.of(aliased);
        }

        Set<String> tokens = Set.of(normalized.split("_"));
        for (TokenRule rule : heuristics) {
            if (profilesByKey.containsKey(rule.getLeague()) && rule.matches(tokens)) {
                log.debug("League '{}' resolved to {} by token heuristic {}", leagueName, rule.getLeague(), rule);
                return Optional.of(rule.getLeague());
            }
        }
        return Optional.empty();
    }

    public LeagueProfile profile(String leagueKey) {
        LeagueProfile profile = leagueKey == null ? null : profilesByKey.get(leagueKey);
        if (profile == null) {
            throw new UnsupportedLeagueException(leagueKey, "No profile registered for league key: " + leagueKey);
        }
        return profile;
    }

    public LeagueProfile resolveProfile(String leagueName) {
        return profile(resolve(leagueName));
    }

    public boolean isSupported(String leagueName) {
        return findKey(leagueName).isPresent();
    }

    public List<String> supportedKeys() {
        return List.copyOf(profilesByKey.keySet());
    }

    public Map<String, String> aliasMapView() {
        return aliasToKey;
    }

    public static String normalize(String s) {
        if (s == null) return "";
        String n = Normalizer.normalize(s, Normalizer.Form.NFD);
        n = DIACRITICS_PATTERN.matcher(n).replaceAll("");
        n = n.toLowerCase(Locale.ROOT);
        n = NON_ALPHANUM_PATTERN.matcher(n).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(n).replaceAll("");
    }

    private LeagueProfile toProfile(LeagueDefinition d) {
        FeatureAdapter adapter = adaptersBySchema.get(d.getSchema());
        if (adapter == null) {
            throw new IllegalStateException("League " + d.getKey() + " names unknown feature schema: " + d.getSchema());
        }
        return LeagueProfile.builder()
                .key(d.getKey())
                .displayName(d.getDisplayName())
                .aliases(d.getAliases() != null ? d.getAliases() : List.of())
                .schemaId(d.getSchema())
                .featureAdapter(adapter)
                .confidenceThreshold(d.getConfidenceThreshold())
                .oddsThreshold(d.getOddsThreshold())
                .modelArtifact(d.getModelArtifact())
                .status(d.getStatus())
                .build();
    }

    private LeagueCatalog loadCatalog() throws IOException {
        Resource resource = resourceLoader.getResource(catalogPath);
        if (!resource.exists()) {
            throw new IOException("League catalog not found: " + catalogPath);
        }
        try (InputStream is = resource.getInputStream()) {
            return objectMapper.readValue(is, LeagueCatalog.class);
        }
    }
}
