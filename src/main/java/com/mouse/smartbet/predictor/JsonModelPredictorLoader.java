package com.mouse.smartbet.predictor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.smartbet.enums.Outcome;
import com.mouse.smartbet.exception.ModelLoadFailureException;
import com.mouse.smartbet.interfaces.Predictor;
import com.mouse.smartbet.interfaces.PredictorLoader;
import com.mouse.smartbet.model.LeagueProfile;
import com.mouse.smartbet.model.ModelArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumSet;
import java.util.HashSet;

/**
 * Loads {@link ModelArtifact} JSON files and checks them against the league's feature schema.
 */
@Slf4j
@Component
public class JsonModelPredictorLoader implements PredictorLoader {

    private static final String MODELS_LOCATION_DEFAULT = "classpath:models/";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Value("${smartbet.models.location:" + MODELS_LOCATION_DEFAULT + "}")
    private String modelsLocation = MODELS_LOCATION_DEFAULT;

    public JsonModelPredictorLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public Predictor load(LeagueProfile profile) {
        String league = profile.getKey();
        String location = modelsLocation.endsWith("/") ? modelsLocation + profile.getModelArtifact()
                : modelsLocation + "/" + profile.getModelArtifact();

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ModelLoadFailureException(league, "Model artifact not found: " + location);
        }

        ModelArtifact artifact;
        try (InputStream is = resource.getInputStream()) {
            artifact = objectMapper.readValue(is, ModelArtifact.class);
        } catch (IOException e) {
            throw new ModelLoadFailureException(league, "Unreadable model artifact " + location + ": " + e.getMessage(), e);
        }

        validate(profile, artifact, location);

        log.info("📦 Loaded {} model {} v{} ({} features)", league, location, artifact.getVersion(),
                artifact.getWeights()[0].length);

        return new SoftmaxPredictor(artifact.getSchema(), artifact.getClasses(), artifact.getIntercepts(),
                artifact.getWeights(), artifact.getFeatureMeans(), artifact.getFeatureScales());
    }

    private void validate(LeagueProfile profile, ModelArtifact artifact, String location) {
        String league = profile.getKey();
        int expected = profile.getFeatureAdapter().featureCount();

        if (!profile.getSchemaId().equals(artifact.getSchema())) {
            throw new ModelLoadFailureException(league, String.format(
                    "Schema mismatch in %s: artifact=%s, league=%s", location, artifact.getSchema(), profile.getSchemaId()));
        }
        if (artifact.getClasses() == null || artifact.getClasses().size() != 3
                || !new HashSet<>(artifact.getClasses()).equals(EnumSet.allOf(Outcome.class))) {
            throw new ModelLoadFailureException(league, "Artifact " + location + " must declare HOME, AWAY and DRAW exactly once");
        }
        double[][] weights = artifact.getWeights();
        double[] intercepts = artifact.getIntercepts();
        if (weights == null || weights.length != 3 || intercepts == null || intercepts.length != 3) {
            throw new ModelLoadFailureException(league, "Artifact " + location + " needs 3 weight rows and 3 intercepts");
        }
        for (double[] row : weights) {
            if (row == null || row.length != expected) {
                throw new ModelLoadFailureException(league, String.format(
                        "Artifact %s weight row has %d features, schema %s expects %d",
                        location, row == null ? 0 : row.length, profile.getSchemaId(), expected));
            }
        }
        checkOptionalVector(league, location, "featureMeans", artifact.getFeatureMeans(), expected);
        checkOptionalVector(league, location, "featureScales", artifact.getFeatureScales(), expected);
    }

    private void checkOptionalVector(String league, String location, String name, double[] v, int expected) {
        if (v != null && v.length != expected) {
            throw new ModelLoadFailureException(league, String.format(
                    "Artifact %s %s has %d entries, expected %d", location, name, v.length, expected));
        }
    }
}
