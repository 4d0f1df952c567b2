package com.modelgate.registry;

/**
 * How a registry designates the production version. Newer MLflow servers use aliases, older ones stages.
 */
public enum ProductionMarker {
    ALIAS,
    STAGE
}
