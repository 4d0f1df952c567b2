package com.modelgate.registry;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.modelgate.artifact.PredictorLoader;
import com.modelgate.evaluation.Predictor;

/**
 * Registry kept in a single JSON document. Every mutation rewrites the document through a temporary file and an
 * atomic move, so readers see either the old or the new production pointer. Promotion moves the production alias
 * and the stage markers together.
 */
public class FileModelRegistry implements RegistryClient {
    private static final Logger log = LoggerFactory.getLogger(FileModelRegistry.class);

    private final Path registryPath;
    private final PredictorLoader predictorLoader;
    private final String productionAlias;
    private final ObjectMapper objectMapper;

    public FileModelRegistry(Path registryPath, String productionAlias) {
        this(registryPath, new PredictorLoader(), productionAlias);
    }

    public FileModelRegistry(Path registryPath, PredictorLoader predictorLoader, String productionAlias) {
        this(registryPath, predictorLoader, productionAlias, JsonMapper.builder().findAndAddModules().build());
    }

    FileModelRegistry(Path registryPath, PredictorLoader predictorLoader, String productionAlias, ObjectMapper objectMapper) {
        this.registryPath = registryPath;
        this.predictorLoader = predictorLoader;
        this.productionAlias = productionAlias;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers an artifact as the next version of the model. Relative artifact paths are stored relative to the
     * registry file.
     */
    public synchronized ModelVersion register(String modelName, Path artifactPath) {
        RegistryDocument document = load();
        RegisteredModel model = document.models.computeIfAbsent(modelName, ignored -> new RegisteredModel());
        long next = model.versions.stream().mapToLong(v -> v.version).max().orElse(0L) + 1;

        StoredVersion stored = new StoredVersion();
        stored.version = next;
        stored.stage = ModelVersion.STAGE_NONE;
        stored.source = sourceFor(artifactPath);
        stored.createdAt = Instant.now();
        model.versions.add(stored);
        save(document);

        log.info("registry.registered model={} version={} source={}", modelName, next, stored.source);
        return toModelVersion(modelName, model, stored);
    }

    @Override
    public synchronized List<ModelVersion> listVersions(String modelName) {
        RegisteredModel model = load().models.get(modelName);
        if (model == null) {
            return List.of();
        }
        List<ModelVersion> versions = new ArrayList<>();
        for (StoredVersion stored : model.versions) {
            versions.add(toModelVersion(modelName, model, stored));
        }
        return versions;
    }

    @Override
    public synchronized Optional<ModelVersion> resolveChampion(String modelName) {
        RegisteredModel model = load().models.get(modelName);
        if (model == null) {
            return Optional.empty();
        }
        Long pointer = model.aliases.get(productionAlias);
        if (pointer == null) {
            return Optional.empty();
        }
        return find(model, pointer).map(stored -> toModelVersion(modelName, model, stored));
    }

    @Override
    public Predictor loadPredictor(ModelVersion version) {
        Path source = Path.of(version.source());
        if (!source.isAbsolute()) {
            source = baseDirectory().resolve(source);
        }
        return predictorLoader.load(source);
    }

    @Override
    public synchronized void promote(String modelName, long version) {
        RegistryDocument document = load();
        RegisteredModel model = document.models.get(modelName);
        if (model == null || find(model, version).isEmpty()) {
            throw new IllegalArgumentException("Unknown model version " + modelName + " v" + version);
        }
        for (StoredVersion stored : model.versions) {
            if (stored.version == version) {
                stored.stage = ModelVersion.STAGE_PRODUCTION;
            } else if (ModelVersion.STAGE_PRODUCTION.equals(stored.stage)) {
                stored.stage = ModelVersion.STAGE_ARCHIVED;
            }
        }
        Long previous = model.aliases.put(productionAlias, version);
        save(document);
        log.info("registry.promoted model={} alias={} version={} previous={}",
                modelName, productionAlias, version, previous == null ? "none" : previous);
    }

    @Override
    public synchronized void tag(String modelName, long version, String key, String value) {
        RegistryDocument document = load();
        RegisteredModel model = document.models.get(modelName);
        StoredVersion stored = model == null ? null : find(model, version).orElse(null);
        if (stored == null) {
            throw new IllegalArgumentException("Unknown model version " + modelName + " v" + version);
        }
        stored.tags.put(key, value);
        save(document);
    }

    private Optional<StoredVersion> find(RegisteredModel model, long version) {
        return model.versions.stream().filter(stored -> stored.version == version).findFirst();
    }

    private ModelVersion toModelVersion(String modelName, RegisteredModel model, StoredVersion stored) {
        List<String> aliases = model.aliases.entrySet().stream()
                .filter(entry -> entry.getValue() == stored.version)
                .map(Map.Entry::getKey)
                .sorted(Comparator.naturalOrder())
                .toList();
        return new ModelVersion(modelName, stored.version, stored.stage, aliases, stored.tags, stored.source);
    }

    private String sourceFor(Path artifactPath) {
        Path absolute = artifactPath.toAbsolutePath().normalize();
        Path base = baseDirectory().toAbsolutePath().normalize();
        return absolute.startsWith(base) ? base.relativize(absolute).toString() : absolute.toString();
    }

    private Path baseDirectory() {
        Path parent = registryPath.toAbsolutePath().getParent();
        return parent == null ? Path.of(".") : parent;
    }

    private RegistryDocument load() {
        try {
            if (!Files.exists(registryPath) || Files.size(registryPath) == 0L) {
                return new RegistryDocument();
            }
            return objectMapper.readValue(registryPath.toFile(), RegistryDocument.class);
        } catch (IOException e) {
            throw new RegistryUnavailableException("Unable to read model registry " + registryPath, e);
        }
    }

    private void save(RegistryDocument document) {
        Path temp = null;
        try {
            Path directory = baseDirectory();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".model-registry", ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new RegistryUnavailableException("Unable to write model registry " + registryPath, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("registry.tempfile.cleanup.failed path={} reason={}", temp, e.getMessage());
        }
    }

    public static class RegistryDocument {
        public Map<String, RegisteredModel> models = new LinkedHashMap<>();
    }

    public static class RegisteredModel {
        public Map<String, Long> aliases = new LinkedHashMap<>();
        public List<StoredVersion> versions = new ArrayList<>();
    }

    public static class StoredVersion {
        public long version;
        public String stage;
        public Map<String, String> tags = new LinkedHashMap<>();
        public String source;
        public Instant createdAt;
    }
}
