package com.mouse.smartbet.predictor;

import com.mouse.smartbet.exception.InvalidProbabilitiesException;
import com.mouse.smartbet.exception.ModelLoadFailureException;
import com.mouse.smartbet.exception.SmartBetException;
import com.mouse.smartbet.interfaces.FeatureAdapter;
import com.mouse.smartbet.interfaces.Predictor;
import com.mouse.smartbet.interfaces.PredictorLoader;
import com.mouse.smartbet.league.LeagueRegistry;
import com.mouse.smartbet.model.LeagueProfile;
import com.mouse.smartbet.model.MatchAttributes;
import com.mouse.smartbet.model.ProbabilityTriple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * One predictor per league, loaded lazily.
 *
 * The first caller for a key installs a future and runs the load; concurrent callers for the
 * same key wait on that future. A failed load is removed from the cache so the next call retries,
 * and never touches other keys.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelRouter {

    private final LeagueRegistry leagueRegistry;
    private final PredictorLoader predictorLoader;

    /** leagueKey → loaded (or loading) predictor */
    private final ConcurrentMap<String, CompletableFuture<Predictor>> predictors = new ConcurrentHashMap<>();

    public Predictor get(String leagueKey) {
        CompletableFuture<Predictor> existing = predictors.get(leagueKey);
        if (existing == null) {
            LeagueProfile profile = leagueRegistry.profile(leagueKey);
            CompletableFuture<Predictor> mine = new CompletableFuture<>();
            existing = predictors.putIfAbsent(leagueKey, mine);
            if (existing == null) {
                existing = mine;
                load(profile, mine);
            }
        }
        return await(leagueKey, existing);
    }

    /**
     * @return probabilities in canonical order (home, away, draw)
     */
    public ProbabilityTriple predict(String leagueKey, MatchAttributes match) {
        LeagueProfile profile = leagueRegistry.profile(leagueKey);
        FeatureAdapter adapter = profile.getFeatureAdapter();

        double[] features = adapter.toFeatureVector(match);
        if (features.length != adapter.featureCount()) {
            throw new IllegalStateException(String.format("Adapter %s produced %d features, declared %d",
                    adapter.schemaId(), features.length, adapter.featureCount()));
        }

        double[] p = get(leagueKey).predict(features);
        if (p == null || p.length != 3) {
            throw new InvalidProbabilitiesException("Predictor for " + leagueKey + " returned "
                    + (p == null ? "null" : p.length + " classes") + ", expected 3");
        }

        log.debug("Predicted {} [{}]: home={} away={} draw={}", match.description(), leagueKey, p[0], p[1], p[2]);
        return ProbabilityTriple.of(p[0], p[1], p[2]);
    }

    public boolean isLoaded(String leagueKey) {
        CompletableFuture<Predictor> f = predictors.get(leagueKey);
        return f != null && f.isDone() && !f.isCompletedExceptionally();
    }

    public Set<String> loadedLeagues() {
        return predictors.keySet().stream().filter(this::isLoaded).collect(Collectors.toUnmodifiableSet());
    }

    /** Drop a cached predictor so the next call reloads the artifact. */
    public void evict(String leagueKey) {
        if (predictors.remove(leagueKey) != null) {
            log.info("Evicted cached predictor for {}", leagueKey);
        }
    }

    private void load(LeagueProfile profile, CompletableFuture<Predictor> slot) {
        String key = profile.getKey();
        long start = System.nanoTime();
        try {
            Predictor predictor = predictorLoader.load(profile);
            if (predictor.featureCount() != profile.getFeatureAdapter().featureCount()) {
                throw new ModelLoadFailureException(key, String.format("Predictor expects %d features, adapter %s produces %d",
                        predictor.featureCount(), profile.getSchemaId(), profile.getFeatureAdapter().featureCount()));
            }
            slot.complete(predictor);
            log.info("✅ Predictor ready for {} in {} ms", key, (System.nanoTime() - start) / 1_000_000);
        } catch (Throwable e) {
            // any Throwable: the slot must never stay pending
            predictors.remove(key, slot);
            ModelLoadFailureException failure = e instanceof ModelLoadFailureException mlf ? mlf
                    : new ModelLoadFailureException(key, "Failed to load model for " + key + ": " + e.getMessage(), e);
            slot.completeExceptionally(failure);
            log.error("❌ Model load failed for {}: {}", key, failure.getMessage());
            if (e instanceof VirtualMachineError vme) {
                throw vme;
            }
        }
    }

    private Predictor await(String leagueKey, CompletableFuture<Predictor> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SmartBetException sbe) {
                throw sbe;
            }
            throw new ModelLoadFailureException(leagueKey, "Failed to load model for " + leagueKey, cause);
        }
    }
}
