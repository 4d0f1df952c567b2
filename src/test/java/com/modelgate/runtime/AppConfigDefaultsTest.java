package com.modelgate.runtime;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.modelgate.ModelGateException;
import com.modelgate.registry.ProductionMarker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToFileRegistryWithProductionAlias() {
        AppConfig config = new AppConfig();

        assertEquals(AppConfig.RegistryType.FILE, config.getRegistry().getType());
        assertEquals(ProductionMarker.ALIAS, config.getRegistry().getMarker());
        assertEquals("production", config.getRegistry().getProductionAlias());
        assertEquals(0.0, config.getGates().getMinAccuracy());
        assertEquals(0.0, config.getGates().getMinF1());
        assertEquals("target", config.getData().getLabelColumn());
    }

    @Test
    void shouldApplyEnvironmentOverridesAndIgnoreBlanks() {
        AppConfig config = new AppConfig().withEnvironmentOverrides(Map.of(
                "MLFLOW_MODEL_NAME", "churn",
                "MLFLOW_TRACKING_URI", "http://mlflow:5000",
                "PROMOTE_MIN_ACCURACY", "0.85",
                "PROMOTE_MIN_F1", " 0.8 ",
                "API_RELOAD_URL", "http://api:8000/reload",
                "API_RELOAD_TOKEN", "  ",
                "HOLDOUT_PATH", "data/holdout.csv"));

        assertEquals("churn", config.getModel().getName());
        assertEquals("http://mlflow:5000", config.getRegistry().getTrackingUri());
        assertEquals(0.85, config.getGates().getMinAccuracy());
        assertEquals(0.8, config.getGates().getMinF1());
        assertEquals("http://api:8000/reload", config.getReload().getUrl());
        assertEquals("", config.getReload().getToken());
        assertEquals("data/holdout.csv", config.getData().getHoldoutPath());
    }

    @Test
    void shouldNameMalformedThresholdVariable() {
        ModelGateException error = assertThrows(ModelGateException.class,
                () -> new AppConfig().withEnvironmentOverrides(Map.of("PROMOTE_MIN_F1", "high")));

        assertTrue(error.getMessage().contains("PROMOTE_MIN_F1"));
    }
}
