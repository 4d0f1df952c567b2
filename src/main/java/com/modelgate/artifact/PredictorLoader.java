package com.modelgate.artifact;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Turns a {@link ModelArtifact} JSON document into a {@link LinearPredictor}.
 */
public class PredictorLoader {
    private static final Logger log = LoggerFactory.getLogger(PredictorLoader.class);
    public static final String ARTIFACT_FILE_NAME = "model.json";

    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    /**
     * Loads from a file, or from {@code model.json} inside the given directory.
     */
    public LinearPredictor load(Path artifactPath) {
        Path file = Files.isDirectory(artifactPath) ? artifactPath.resolve(ARTIFACT_FILE_NAME) : artifactPath;
        if (!Files.isRegularFile(file)) {
            throw new ModelLoadException("Model artifact not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            LinearPredictor predictor = read(in, file.toString());
            log.debug("artifact.loaded path={} features={}", file, predictor.featureCount());
            return predictor;
        } catch (IOException e) {
            throw new ModelLoadException("Unable to read model artifact " + file, e);
        }
    }

    public LinearPredictor read(InputStream in, String origin) {
        ModelArtifact artifact;
        try {
            artifact = objectMapper.readValue(in, ModelArtifact.class);
        } catch (IOException e) {
            throw new ModelLoadException("Corrupt model artifact " + origin + ": " + e.getMessage(), e);
        }
        return toPredictor(artifact, origin);
    }

    LinearPredictor toPredictor(ModelArtifact artifact, String origin) {
        boolean softmax;
        if (ModelArtifact.FORMAT_SOFTMAX.equals(artifact.format())) {
            softmax = true;
        } else if (ModelArtifact.FORMAT_LINEAR.equals(artifact.format())) {
            softmax = false;
        } else {
            throw new ModelLoadException("Unsupported artifact format '" + artifact.format() + "' in " + origin);
        }

        List<Integer> classes = artifact.classes();
        List<List<Double>> coefficients = artifact.coefficients();
        List<Double> intercepts = artifact.intercepts();
        if (classes == null || classes.isEmpty() || coefficients == null || intercepts == null) {
            throw new ModelLoadException("Artifact " + origin + " is missing classes, coefficients or intercepts");
        }
        if (coefficients.size() != classes.size() || intercepts.size() != classes.size()) {
            throw new ModelLoadException("Artifact " + origin + " has " + classes.size() + " classes but "
                    + coefficients.size() + " coefficient rows and " + intercepts.size() + " intercepts");
        }

        int width = coefficients.get(0).size();
        double[][] weights = new double[classes.size()][];
        for (int k = 0; k < classes.size(); k++) {
            List<Double> row = coefficients.get(k);
            if (row == null || row.size() != width || width == 0) {
                throw new ModelLoadException("Artifact " + origin + " has ragged or empty coefficient rows");
            }
            weights[k] = row.stream().mapToDouble(Double::doubleValue).toArray();
        }
        return new LinearPredictor(
                classes.stream().mapToInt(Integer::intValue).toArray(),
                weights,
                intercepts.stream().mapToDouble(Double::doubleValue).toArray(),
                softmax);
    }
}
