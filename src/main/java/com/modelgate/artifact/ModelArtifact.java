package com.modelgate.artifact;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON form of a trained linear classifier as exported by the training stage.
 *
 * <p>{@code format} is {@code softmax} when the model emits class probabilities and {@code linear} when it only
 * emits labels. Row {@code k} of {@code coefficients} and entry {@code k} of {@code intercepts} belong to
 * {@code classes[k]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelArtifact(
        String format,
        List<Integer> classes,
        List<String> featureNames,
        List<List<Double>> coefficients,
        List<Double> intercepts) {

    public static final String FORMAT_SOFTMAX = "softmax";
    public static final String FORMAT_LINEAR = "linear";

    public ModelArtifact {
        format = format == null || format.isBlank() ? FORMAT_SOFTMAX : format;
        featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
    }
}
