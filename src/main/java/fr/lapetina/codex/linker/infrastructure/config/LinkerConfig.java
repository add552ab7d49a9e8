package fr.lapetina.codex.linker.infrastructure.config;

import fr.lapetina.codex.linker.domain.provider.KnownEndpoints;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the linker.
 * Designed to be populated from YAML.
 */
public class LinkerConfig {

    private DetectionConfig detection = new DetectionConfig();
    private LoggingConfig logging = new LoggingConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public DetectionConfig getDetection() { return detection; }
    public void setDetection(DetectionConfig detection) { this.detection = detection; }

    public LoggingConfig getLogging() { return logging; }
    public void setLogging(LoggingConfig logging) { this.logging = logging; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    // HTTP timeouts must be strictly positive
    private static long positive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    /**
     * Endpoint auto-detection configuration.
     */
    public static class DetectionConfig {
        private List<String> candidates = new ArrayList<>(KnownEndpoints.COMMON_BASE_URLS);
        private long probeTimeoutMs = 3000;
        private long connectTimeoutMs = 3000;
        private String modelsPath = "/models";
        private String apiKey;

        public List<String> getCandidates() { return candidates; }
        public void setCandidates(List<String> candidates) { this.candidates = candidates; }

        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = positive("probeTimeoutMs", probeTimeoutMs); }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = positive("connectTimeoutMs", connectTimeoutMs); }

        public String getModelsPath() { return modelsPath; }
        public void setModelsPath(String modelsPath) { this.modelsPath = modelsPath; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }

    /**
     * Logging and remote log shipping configuration.
     */
    public static class LoggingConfig {
        private String level;
        private boolean verbose = false;
        private String file;
        private boolean json = false;
        private String remoteUrl;
        private int queueCapacity = 256;
        private long drainTimeoutMs = 2000;
        private long requestTimeoutMs = 2000;
        private boolean synchronous = false;

        public String getLevel() { return level; }
        public void setLevel(String level) { this.level = level; }

        public boolean isVerbose() { return verbose; }
        public void setVerbose(boolean verbose) { this.verbose = verbose; }

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }

        public boolean isJson() { return json; }
        public void setJson(boolean json) { this.json = json; }

        public String getRemoteUrl() { return remoteUrl; }
        public void setRemoteUrl(String remoteUrl) { this.remoteUrl = remoteUrl; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public long getDrainTimeoutMs() { return drainTimeoutMs; }
        public void setDrainTimeoutMs(long drainTimeoutMs) { this.drainTimeoutMs = drainTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = positive("requestTimeoutMs", requestTimeoutMs); }

        public boolean isSynchronous() { return synchronous; }
        public void setSynchronous(boolean synchronous) { this.synchronous = synchronous; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "codex_linker";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
