package com.modelgate.registry;

import java.util.List;
import java.util.Map;

public record ModelVersion(
        String name,
        long version,
        String stage,
        List<String> aliases,
        Map<String, String> tags,
        String source) {

    public static final String STAGE_NONE = "None";
    public static final String STAGE_PRODUCTION = "Production";
    public static final String STAGE_ARCHIVED = "Archived";

    public ModelVersion {
        if (version <= 0) {
            throw new IllegalArgumentException("version must be positive: " + version);
        }
        stage = stage == null || stage.isBlank() ? STAGE_NONE : stage;
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        source = source == null ? "" : source;
    }

    public String label() {
        return name + " v" + version;
    }
}
