package com.modelgate.serving;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.ModelGateException;
import com.modelgate.evaluation.PredictionOutput;
import com.modelgate.evaluation.Predictor;
import com.modelgate.registry.ModelVersion;
import com.modelgate.registry.RegistryClient;

/**
 * The production model a serving process answers with. Readers take a consistent snapshot of the current pointer;
 * {@link #reload()} builds the replacement completely before swapping it in, so a failed reload keeps the old model.
 */
public class ActiveModelHandle {
    private static final Logger log = LoggerFactory.getLogger(ActiveModelHandle.class);

    private final RegistryClient registry;
    private final String modelName;
    private final AtomicReference<LoadedModel> current = new AtomicReference<>();

    public ActiveModelHandle(RegistryClient registry, String modelName) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.modelName = Objects.requireNonNull(modelName, "modelName");
    }

    /**
     * Loads the registry's current production version and swaps it in.
     *
     * @throws ModelGateException if the registry has no production version
     */
    public synchronized LoadedModel reload() {
        ModelVersion champion = registry.resolveChampion(modelName)
                .orElseThrow(() -> new ModelGateException(
                        "No production version for '" + modelName + "'. Run the promotion stage first."));
        LoadedModel replacement = new LoadedModel(champion, registry.loadPredictor(champion));
        LoadedModel previous = current.getAndSet(replacement);
        log.info("serving.reloaded model={} version={} previous={}",
                modelName, champion.version(), previous == null ? "none" : previous.version().version());
        return replacement;
    }

    public LoadedModel current() {
        LoadedModel loaded = current.get();
        if (loaded == null) {
            throw new IllegalStateException("Model not loaded");
        }
        return loaded;
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public int[] predict(List<double[]> rows) {
        PredictionOutput output = current().predictor().predict(rows);
        return output.predictedLabels();
    }

    public record LoadedModel(ModelVersion version, Predictor predictor) {
    }
}
