package com.modelgate.registry;

import java.util.List;
import java.util.Optional;

import com.modelgate.evaluation.Predictor;

/**
 * Contract of the versioned model store the promotion run reads from and mutates.
 *
 * <p>Every operation throws {@link RegistryUnavailableException} when the backing store cannot be reached.
 */
public interface RegistryClient {
    /**
     * All versions of the model, in no particular order.
     */
    List<ModelVersion> listVersions(String modelName);

    /**
     * The version currently holding the production marker, or empty before the first promotion.
     */
    Optional<ModelVersion> resolveChampion(String modelName);

    /**
     * @throws com.modelgate.artifact.ModelLoadException if the artifact is missing or corrupt
     */
    Predictor loadPredictor(ModelVersion version);

    /**
     * Makes {@code version} the only production version and archives the previous holder in one step.
     */
    void promote(String modelName, long version);

    void tag(String modelName, long version, String key, String value);
}
