package com.modelgate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.modelgate.audit.AuditRecord;
import com.modelgate.audit.AuditRecorder;
import com.modelgate.audit.JsonlAuditRecorder;
import com.modelgate.audit.MlflowAuditRecorder;
import com.modelgate.evaluation.HoldoutDataset;
import com.modelgate.evaluation.HoldoutDatasetLoader;
import com.modelgate.evaluation.Metrics;
import com.modelgate.evaluation.MetricsEvaluator;
import com.modelgate.evaluation.MetricsReportWriter;
import com.modelgate.promotion.GateThresholds;
import com.modelgate.promotion.HttpReloadNotifier;
import com.modelgate.promotion.PromotionOrchestrator;
import com.modelgate.promotion.PromotionOutcome;
import com.modelgate.promotion.PromotionResult;
import com.modelgate.promotion.ReloadNotifier;
import com.modelgate.registry.FileModelRegistry;
import com.modelgate.registry.MlflowRegistryClient;
import com.modelgate.registry.MlflowRestClient;
import com.modelgate.registry.MlflowTrackingClient;
import com.modelgate.registry.ModelVersion;
import com.modelgate.registry.RegistryClient;
import com.modelgate.runtime.AppConfig;
import com.modelgate.serving.ActiveModelHandle;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "model-gate",
        mixinStandardHelpOptions = true,
        version = "model-gate 0.1.0",
        description = "Validates the newest registered model version against the production champion and promotes it.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final String EVALUATION_RUN_NAME = "evaluate_model";

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "promote")
    Mode mode;

    @Option(names = "--model-name", description = "Registered model name (overrides config)")
    String modelName;

    @Option(names = "--model-version", description = "Version to score in evaluate mode (defaults to the newest)")
    Long modelVersion;

    @Option(names = "--holdout", description = "Labelled holdout CSV (overrides config)")
    Path holdoutPath;

    @Option(names = "--artifact", description = "Model artifact to register in register mode")
    Path artifactPath;

    @Option(names = "--input", description = "Feature CSV to score in predict mode")
    Path inputPath;

    @Option(names = "--outcome", description = "Outcome filter in history mode: promote, reject or skip")
    String outcome;

    private final OkHttpClient httpClient = new OkHttpClient();
    private final ObjectMapper jsonMapper = new ObjectMapper();

    enum Mode {
        promote,
        evaluate,
        register,
        predict,
        history
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        String name = modelName;
        try {
            AppConfig config = loadConfig(Path.of(configPath)).withEnvironmentOverrides(System.getenv());
            if (modelName != null && !modelName.isBlank()) {
                config.getModel().setName(modelName);
            }
            if (holdoutPath != null) {
                config.getData().setHoldoutPath(holdoutPath.toString());
            }
            name = config.getModel().getName();

            log.info("Starting model-gate in {} mode", mode);
            log.info("Using config file: {}", configPath);
            log.info("Model={} registry={} marker={} minAccuracy={} minF1={} reloadConfigured={}",
                    name,
                    config.getRegistry().getType(),
                    config.getRegistry().getMarker(),
                    config.getGates().getMinAccuracy(),
                    config.getGates().getMinF1(),
                    !config.getReload().getUrl().isBlank());

            RegistryClient registry = createRegistry(config);
            switch (mode) {
                case promote:
                    return runPromotion(config, registry, name);
                case evaluate:
                    return runEvaluation(config, registry, name);
                case register:
                    return runRegistration(registry, name);
                case predict:
                    return runPrediction(config, registry, name);
                case history:
                    return runHistory(config, name);
                default:
                    return 2;
            }
        } catch (ModelGateException e) {
            log.error("model-gate.fatal mode={} model={} reason={}", mode, name, e.getMessage());
            log.debug("model-gate.fatal stacktrace", e);
            return 1;
        }
    }

    private int runPromotion(AppConfig config, RegistryClient registry, String name) {
        HoldoutDataset holdout = new HoldoutDatasetLoader()
                .load(Path.of(config.getData().getHoldoutPath()), config.getData().getLabelColumn());
        PromotionOrchestrator orchestrator = new PromotionOrchestrator(
                registry,
                createAuditRecorder(config),
                createReloadNotifier(config));
        PromotionResult result = orchestrator.run(
                name,
                holdout,
                new GateThresholds(config.getGates().getMinAccuracy(), config.getGates().getMinF1()));
        log.info("Decision for {} v{}: {} reasons={} reloadNotified={}",
                name,
                result.candidate().version(),
                result.outcome().code(),
                result.decision().reasonCodes(),
                result.reloadNotified());
        return 0;
    }

    private int runEvaluation(AppConfig config, RegistryClient registry, String name) throws IOException {
        HoldoutDataset holdout = new HoldoutDatasetLoader()
                .load(Path.of(config.getData().getHoldoutPath()), config.getData().getLabelColumn());
        List<ModelVersion> versions = registry.listVersions(name);
        ModelVersion target = versions.stream()
                .filter(version -> modelVersion == null || version.version() == modelVersion)
                .max(Comparator.comparingLong(ModelVersion::version))
                .orElse(null);
        if (target == null) {
            log.error("No version {} found for '{}'. Run the training stage first.",
                    modelVersion == null ? "at all" : modelVersion, name);
            return 1;
        }
        Metrics metrics = new MetricsEvaluator().score(registry.loadPredictor(target), holdout);
        Path report = new MetricsReportWriter().write(Path.of(config.getEvaluation().getReportPath()), metrics);
        if (config.getRegistry().getType() == AppConfig.RegistryType.MLFLOW) {
            logEvaluationRun(config.getRegistry(), target, metrics);
        }
        log.info("Evaluation done for {} v{}. Metrics: {} report={}", name, target.version(), metrics.asMap(), report);
        return 0;
    }

    private void logEvaluationRun(AppConfig.RegistryConfig registryConfig, ModelVersion target, Metrics metrics) {
        MlflowTrackingClient tracking = new MlflowTrackingClient(mlflowClient(registryConfig));
        String experimentId = tracking.ensureExperiment(registryConfig.getExperiment());
        long now = System.currentTimeMillis();
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("model_name", target.name());
        tags.put("model_version", Long.toString(target.version()));
        String runId = tracking.logFinishedRun(experimentId, EVALUATION_RUN_NAME, now, now, tags, metrics.asMap());
        log.info("evaluation.tracked experiment={} runId={} model={} version={}",
                registryConfig.getExperiment(), runId, target.name(), target.version());
    }

    private int runRegistration(RegistryClient registry, String name) {
        if (artifactPath == null) {
            log.error("--artifact is required in register mode");
            return 2;
        }
        if (!(registry instanceof FileModelRegistry fileRegistry)) {
            log.error("register mode is only available for the file registry; MLflow versions are registered by the training stage");
            return 2;
        }
        ModelVersion registered = fileRegistry.register(name, artifactPath);
        log.info("Registered {} from {}", registered.label(), artifactPath);
        return 0;
    }

    private int runPrediction(AppConfig config, RegistryClient registry, String name) throws IOException {
        if (inputPath == null) {
            log.error("--input is required in predict mode");
            return 2;
        }
        ActiveModelHandle handle = new ActiveModelHandle(registry, name);
        ActiveModelHandle.LoadedModel loaded = handle.reload();
        List<double[]> rows = new HoldoutDatasetLoader().loadFeatures(inputPath, config.getData().getLabelColumn());
        int[] predictions = handle.predict(rows);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("model", name);
        response.put("version", loaded.version().version());
        response.put("predictions", predictions);
        System.out.println(jsonMapper.writeValueAsString(response));
        return 0;
    }

    private int runHistory(AppConfig config, String name) {
        PromotionOutcome filter = null;
        if (outcome != null && !outcome.isBlank()) {
            try {
                filter = PromotionOutcome.fromCode(outcome);
            } catch (IllegalArgumentException e) {
                log.error("--outcome must be one of promote, reject, skip but was '{}'", outcome);
                return 2;
            }
        }
        List<AuditRecord> records = createAuditRecorder(config).find(name, filter);
        log.info("Audit records for {} outcome={}: {}", name, filter == null ? "any" : filter.code(), records.size());
        for (AuditRecord record : records) {
            log.info("{} candidate=v{} champion={} decision={} reasons={} candidateMetrics={} championMetrics={}",
                    record.timestamp(),
                    record.candidateVersion(),
                    record.championVersion() == null ? "none" : "v" + record.championVersion(),
                    record.decision().code(),
                    record.reasons(),
                    record.candidateMetrics(),
                    record.championMetrics() == null ? "none" : record.championMetrics());
        }
        return 0;
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = YAMLMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    RegistryClient createRegistry(AppConfig config) {
        AppConfig.RegistryConfig registryConfig = config.getRegistry();
        if (registryConfig.getType() == AppConfig.RegistryType.MLFLOW) {
            return new MlflowRegistryClient(mlflowClient(registryConfig), registryConfig.getMarker(), registryConfig.getProductionAlias());
        }
        return new FileModelRegistry(Path.of(registryConfig.getPath()), registryConfig.getProductionAlias());
    }

    AuditRecorder createAuditRecorder(AppConfig config) {
        AppConfig.RegistryConfig registryConfig = config.getRegistry();
        if (registryConfig.getType() == AppConfig.RegistryType.MLFLOW) {
            return new MlflowAuditRecorder(mlflowClient(registryConfig), registryConfig.getExperiment());
        }
        return new JsonlAuditRecorder(Path.of(config.getAudit().getLogPath()));
    }

    ReloadNotifier createReloadNotifier(AppConfig config) {
        AppConfig.ReloadConfig reload = config.getReload();
        if (reload.getUrl() == null || reload.getUrl().isBlank()) {
            return ReloadNotifier.disabled();
        }
        return new HttpReloadNotifier(httpClient, reload.getUrl(), reload.getToken(), Duration.ofMillis(reload.getTimeoutMs()));
    }

    private MlflowRestClient mlflowClient(AppConfig.RegistryConfig registryConfig) {
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(registryConfig.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        return new MlflowRestClient(client, registryConfig.getTrackingUri());
    }
}
