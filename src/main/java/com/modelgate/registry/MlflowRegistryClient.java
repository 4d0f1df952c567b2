package com.modelgate.registry;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelgate.artifact.ModelLoadException;
import com.modelgate.artifact.PredictorLoader;
import com.modelgate.evaluation.Predictor;

/**
 * {@link RegistryClient} backed by the MLflow model registry REST API.
 *
 * <p>The production marker strategy is fixed at construction: {@link ProductionMarker#ALIAS} for servers with
 * registered model aliases, {@link ProductionMarker#STAGE} for servers that only know stages.
 */
public class MlflowRegistryClient implements RegistryClient {
    private static final Logger log = LoggerFactory.getLogger(MlflowRegistryClient.class);
    private static final String API = "api/2.0/mlflow/";
    private static final String ARTIFACTS_API = "api/2.0/mlflow-artifacts/artifacts/";
    static final String INVALID_PARAMETER_VALUE = "INVALID_PARAMETER_VALUE";

    private final MlflowRestClient rest;
    private final PredictorLoader predictorLoader;
    private final ChampionStrategy championStrategy;

    public MlflowRegistryClient(MlflowRestClient rest, ProductionMarker marker, String productionAlias) {
        this(rest, marker, productionAlias, new PredictorLoader());
    }

    public MlflowRegistryClient(
            MlflowRestClient rest,
            ProductionMarker marker,
            String productionAlias,
            PredictorLoader predictorLoader) {
        this.rest = rest;
        this.predictorLoader = predictorLoader;
        this.championStrategy = marker == ProductionMarker.STAGE
                ? new StageStrategy()
                : new AliasStrategy(productionAlias);
    }

    @Override
    public List<ModelVersion> listVersions(String modelName) {
        List<ModelVersion> versions = new ArrayList<>();
        String pageToken = null;
        do {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("filter", "name='" + modelName.replace("'", "\\'") + "'");
            query.put("max_results", "200");
            if (pageToken != null) {
                query.put("page_token", pageToken);
            }
            JsonNode page = rest.get(API + "model-versions/search", query);
            for (JsonNode node : page.path("model_versions")) {
                versions.add(parseVersion(node));
            }
            pageToken = page.path("next_page_token").asText("");
        } while (!pageToken.isBlank());
        return versions;
    }

    @Override
    public Optional<ModelVersion> resolveChampion(String modelName) {
        return championStrategy.resolve(modelName);
    }

    @Override
    public Predictor loadPredictor(ModelVersion version) {
        JsonNode response = rest.get(API + "model-versions/get-download-uri",
                Map.of("name", version.name(), "version", Long.toString(version.version())));
        String artifactUri = response.path("artifact_uri").asText("");
        if (artifactUri.isBlank()) {
            throw new ModelLoadException("MLflow returned no artifact location for " + version.label());
        }
        log.debug("registry.artifact model={} version={} uri={}", version.name(), version.version(), artifactUri);

        if (artifactUri.startsWith("file:")) {
            return predictorLoader.load(Path.of(URI.create(artifactUri)));
        }
        if (artifactUri.startsWith("mlflow-artifacts:")) {
            String relative = URI.create(artifactUri).getPath().replaceFirst("^/+", "");
            byte[] content;
            try {
                content = rest.download(ARTIFACTS_API + relative + "/" + PredictorLoader.ARTIFACT_FILE_NAME);
            } catch (MlflowApiException e) {
                throw new ModelLoadException("Artifact for " + version.label() + " could not be downloaded", e);
            }
            return predictorLoader.read(new ByteArrayInputStream(content), artifactUri);
        }
        throw new ModelLoadException("Unsupported artifact location " + artifactUri + " for " + version.label());
    }

    @Override
    public void promote(String modelName, long version) {
        championStrategy.promote(modelName, version);
    }

    @Override
    public void tag(String modelName, long version, String key, String value) {
        rest.post(API + "model-versions/set-tag", Map.of(
                "name", modelName,
                "version", Long.toString(version),
                "key", key,
                "value", value));
    }

    private ModelVersion parseVersion(JsonNode node) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (JsonNode tag : node.path("tags")) {
            tags.put(tag.path("key").asText(), tag.path("value").asText());
        }
        List<String> aliases = new ArrayList<>();
        for (JsonNode alias : node.path("aliases")) {
            aliases.add(alias.asText());
        }
        return new ModelVersion(
                node.path("name").asText(),
                Long.parseLong(node.path("version").asText()),
                node.path("current_stage").asText(ModelVersion.STAGE_NONE),
                aliases,
                tags,
                node.path("source").asText(""));
    }

    private interface ChampionStrategy {
        Optional<ModelVersion> resolve(String modelName);

        void promote(String modelName, long version);
    }

    private final class AliasStrategy implements ChampionStrategy {
        private final String alias;

        private AliasStrategy(String alias) {
            this.alias = alias;
        }

        /**
         * An unset alias is answered with {@code 400 INVALID_PARAMETER_VALUE}, an unknown model with
         * {@code 404 RESOURCE_DOES_NOT_EXIST}. Both mean there is no champion yet.
         */
        @Override
        public Optional<ModelVersion> resolve(String modelName) {
            JsonNode response;
            try {
                response = rest.get(API + "registered-models/alias", Map.of("name", modelName, "alias", alias));
            } catch (MlflowApiException e) {
                if (isAliasNotFound(e)) {
                    log.info("registry.champion.none model={} alias={} errorCode={}", modelName, alias, e.errorCode());
                    return Optional.empty();
                }
                throw e;
            }
            return Optional.of(parseVersion(response.path("model_version")));
        }

        private boolean isAliasNotFound(MlflowApiException e) {
            return (e.statusCode() == 400 && INVALID_PARAMETER_VALUE.equals(e.errorCode()))
                    || (e.statusCode() == 404 && MlflowRestClient.RESOURCE_DOES_NOT_EXIST.equals(e.errorCode()));
        }

        /**
         * Moving an alias is a single server-side update; the previous holder simply stops carrying it.
         */
        @Override
        public void promote(String modelName, long version) {
            rest.post(API + "registered-models/alias", Map.of(
                    "name", modelName,
                    "alias", alias,
                    "version", Long.toString(version)));
        }
    }

    private final class StageStrategy implements ChampionStrategy {
        @Override
        public Optional<ModelVersion> resolve(String modelName) {
            return listVersions(modelName).stream()
                    .filter(version -> ModelVersion.STAGE_PRODUCTION.equals(version.stage()))
                    .max(Comparator.comparingLong(ModelVersion::version));
        }

        @Override
        public void promote(String modelName, long version) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("name", modelName);
            body.put("version", Long.toString(version));
            body.put("stage", ModelVersion.STAGE_PRODUCTION);
            body.put("archive_existing_versions", true);
            rest.post(API + "model-versions/transition-stage", body);
        }
    }
}
