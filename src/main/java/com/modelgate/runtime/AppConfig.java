package com.modelgate.runtime;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.modelgate.ModelGateException;
import com.modelgate.registry.ProductionMarker;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ModelConfig model = new ModelConfig();
    private GatesConfig gates = new GatesConfig();
    private RegistryConfig registry = new RegistryConfig();
    private DataConfig data = new DataConfig();
    private ReloadConfig reload = new ReloadConfig();
    private AuditConfig audit = new AuditConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();

    /**
     * Applies the environment variables understood by the training pipeline on top of the YAML values.
     * Blank values are ignored.
     */
    public AppConfig withEnvironmentOverrides(Map<String, String> env) {
        String modelName = env(env, "MLFLOW_MODEL_NAME");
        if (modelName != null) {
            model.setName(modelName);
        }
        String trackingUri = env(env, "MLFLOW_TRACKING_URI");
        if (trackingUri != null) {
            registry.setTrackingUri(trackingUri);
        }
        String minAccuracy = env(env, "PROMOTE_MIN_ACCURACY");
        if (minAccuracy != null) {
            gates.setMinAccuracy(parseThreshold("PROMOTE_MIN_ACCURACY", minAccuracy));
        }
        String minF1 = env(env, "PROMOTE_MIN_F1");
        if (minF1 != null) {
            gates.setMinF1(parseThreshold("PROMOTE_MIN_F1", minF1));
        }
        String reloadUrl = env(env, "API_RELOAD_URL");
        if (reloadUrl != null) {
            reload.setUrl(reloadUrl);
        }
        String reloadToken = env(env, "API_RELOAD_TOKEN");
        if (reloadToken != null) {
            reload.setToken(reloadToken);
        }
        String holdoutPath = env(env, "HOLDOUT_PATH");
        if (holdoutPath != null) {
            data.setHoldoutPath(holdoutPath);
        }
        return this;
    }

    private static double parseThreshold(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ModelGateException(key + " must be a number but was '" + value + "'", e);
        }
    }

    private static String env(Map<String, String> env, String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public ModelConfig getModel() {
        return model;
    }

    public void setModel(ModelConfig model) {
        this.model = model == null ? new ModelConfig() : model;
    }

    public GatesConfig getGates() {
        return gates;
    }

    public void setGates(GatesConfig gates) {
        this.gates = gates == null ? new GatesConfig() : gates;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryConfig registry) {
        this.registry = registry == null ? new RegistryConfig() : registry;
    }

    public DataConfig getData() {
        return data;
    }

    public void setData(DataConfig data) {
        this.data = data == null ? new DataConfig() : data;
    }

    public ReloadConfig getReload() {
        return reload;
    }

    public void setReload(ReloadConfig reload) {
        this.reload = reload == null ? new ReloadConfig() : reload;
    }

    public AuditConfig getAudit() {
        return audit;
    }

    public void setAudit(AuditConfig audit) {
        this.audit = audit == null ? new AuditConfig() : audit;
    }

    public EvaluationConfig getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationConfig evaluation) {
        this.evaluation = evaluation == null ? new EvaluationConfig() : evaluation;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelConfig {
        private String name = "iris-classifier";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GatesConfig {
        private double minAccuracy = 0.0;
        private double minF1 = 0.0;

        public double getMinAccuracy() {
            return minAccuracy;
        }

        public void setMinAccuracy(double minAccuracy) {
            this.minAccuracy = minAccuracy;
        }

        public double getMinF1() {
            return minF1;
        }

        public void setMinF1(double minF1) {
            this.minF1 = minF1;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistryConfig {
        private RegistryType type = RegistryType.FILE;
        private String path = ".modelgate/model-registry.json";
        private String trackingUri = "http://localhost:5000";
        private String experiment = "model-promotion";
        private ProductionMarker marker = ProductionMarker.ALIAS;
        private String productionAlias = "production";
        private int timeoutMs = 10000;

        public RegistryType getType() {
            return type;
        }

        public void setType(RegistryType type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getTrackingUri() {
            return trackingUri;
        }

        public void setTrackingUri(String trackingUri) {
            this.trackingUri = trackingUri;
        }

        public String getExperiment() {
            return experiment;
        }

        public void setExperiment(String experiment) {
            this.experiment = experiment;
        }

        public ProductionMarker getMarker() {
            return marker;
        }

        public void setMarker(ProductionMarker marker) {
            this.marker = marker;
        }

        public String getProductionAlias() {
            return productionAlias;
        }

        public void setProductionAlias(String productionAlias) {
            this.productionAlias = productionAlias;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public enum RegistryType {
        FILE,
        MLFLOW
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DataConfig {
        private String holdoutPath = "data/test.csv";
        private String labelColumn = "target";

        public String getHoldoutPath() {
            return holdoutPath;
        }

        public void setHoldoutPath(String holdoutPath) {
            this.holdoutPath = holdoutPath;
        }

        public String getLabelColumn() {
            return labelColumn;
        }

        public void setLabelColumn(String labelColumn) {
            this.labelColumn = labelColumn;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReloadConfig {
        private String url = "";
        private String token = "";
        private int timeoutMs = 5000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AuditConfig {
        private String logPath = ".modelgate/promotion-audit.jsonl";

        public String getLogPath() {
            return logPath;
        }

        public void setLogPath(String logPath) {
            this.logPath = logPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationConfig {
        private String reportPath = "metrics.json";

        public String getReportPath() {
            return reportPath;
        }

        public void setReportPath(String reportPath) {
            this.reportPath = reportPath;
        }
    }
}
