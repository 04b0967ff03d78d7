package io.invoicebot.server.config;

import io.invoicebot.server.codec.CompressionType;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoicebot")
public class InvoiceBotProperties {

    private final Claim claim = new Claim();
    private final Checkpoint checkpoint = new Checkpoint();
    private final Router router = new Router();
    private final Executor executor = new Executor();
    private final Maintenance maintenance = new Maintenance();

    public Claim getClaim() {
        return claim;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public Router getRouter() {
        return router;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public static class Claim {
        private String workerId;
        private int timeoutSeconds = 300;
        private long localLockWaitMs = 5000L;
        private int staleRetentionHours = 24;
        private int terminalRetentionDays = 30;

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public long getLocalLockWaitMs() {
            return localLockWaitMs;
        }

        public void setLocalLockWaitMs(long localLockWaitMs) {
            this.localLockWaitMs = localLockWaitMs;
        }

        public int getStaleRetentionHours() {
            return staleRetentionHours;
        }

        public void setStaleRetentionHours(int staleRetentionHours) {
            this.staleRetentionHours = staleRetentionHours;
        }

        public int getTerminalRetentionDays() {
            return terminalRetentionDays;
        }

        public void setTerminalRetentionDays(int terminalRetentionDays) {
            this.terminalRetentionDays = terminalRetentionDays;
        }
    }

    public static class Checkpoint {
        private String directory = "checkpoints";
        private CompressionType compression = CompressionType.GZIP;
        private int retentionDays = 30;
        private int maxPerSession = 50;
        private long autoIntervalSeconds = 300L;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public CompressionType getCompression() {
            return compression;
        }

        public void setCompression(CompressionType compression) {
            this.compression = compression;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public int getMaxPerSession() {
            return maxPerSession;
        }

        public void setMaxPerSession(int maxPerSession) {
            this.maxPerSession = maxPerSession;
        }

        public long getAutoIntervalSeconds() {
            return autoIntervalSeconds;
        }

        public void setAutoIntervalSeconds(long autoIntervalSeconds) {
            this.autoIntervalSeconds = autoIntervalSeconds;
        }
    }

    public static class Router {
        private int maxRetries = 3;
        private long backoffBaseMs = 2000L;
        private double oracleConfidenceThreshold = 0.6;
        private long oracleTimeoutMs = 10000L;
        private List<String> destinationKeywords = new ArrayList<>(List.of("factura", "billing", "invoice", "cfdi"));
        private boolean captureEvidence;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffBaseMs() {
            return backoffBaseMs;
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
        }

        public double getOracleConfidenceThreshold() {
            return oracleConfidenceThreshold;
        }

        public void setOracleConfidenceThreshold(double oracleConfidenceThreshold) {
            this.oracleConfidenceThreshold = oracleConfidenceThreshold;
        }

        public long getOracleTimeoutMs() {
            return oracleTimeoutMs;
        }

        public void setOracleTimeoutMs(long oracleTimeoutMs) {
            this.oracleTimeoutMs = oracleTimeoutMs;
        }

        public List<String> getDestinationKeywords() {
            return destinationKeywords;
        }

        public void setDestinationKeywords(List<String> destinationKeywords) {
            this.destinationKeywords = destinationKeywords;
        }

        public boolean isCaptureEvidence() {
            return captureEvidence;
        }

        public void setCaptureEvidence(boolean captureEvidence) {
            this.captureEvidence = captureEvidence;
        }
    }

    public static class Executor {
        private int oracleCorePoolSize = 2;
        private int oracleMaxPoolSize = 4;
        private int oracleQueueCapacity = 50;
        private int checkpointSchedulerPoolSize = 2;

        public int getOracleCorePoolSize() {
            return oracleCorePoolSize;
        }

        public void setOracleCorePoolSize(int oracleCorePoolSize) {
            this.oracleCorePoolSize = oracleCorePoolSize;
        }

        public int getOracleMaxPoolSize() {
            return oracleMaxPoolSize;
        }

        public void setOracleMaxPoolSize(int oracleMaxPoolSize) {
            this.oracleMaxPoolSize = oracleMaxPoolSize;
        }

        public int getOracleQueueCapacity() {
            return oracleQueueCapacity;
        }

        public void setOracleQueueCapacity(int oracleQueueCapacity) {
            this.oracleQueueCapacity = oracleQueueCapacity;
        }

        public int getCheckpointSchedulerPoolSize() {
            return checkpointSchedulerPoolSize;
        }

        public void setCheckpointSchedulerPoolSize(int checkpointSchedulerPoolSize) {
            this.checkpointSchedulerPoolSize = checkpointSchedulerPoolSize;
        }
    }

    public static class Maintenance {
        private long intervalMs = 3600000L;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
