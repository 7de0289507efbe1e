package com.eyelevel.extractionpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.pipeline" prefix to a strongly-typed
 * configuration object. This provides centralized control over queueing, worker, session
 * retention and export behaviors.
 */
@Data
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineConfig {

    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Session session = new Session();
    private Export export = new Export();

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 200;
    }

    @Data
    public static class Queue {
        /**
         * Name of the Redis list holding pending job ids. Job hashes live under "{name}:job:{id}".
         */
        private String name = "document_processing";
        /**
         * Either "redis" or "memory".
         */
        private String store = "redis";
        private long retentionHours = 24;
        private long dequeueTimeoutSeconds = 5;
        private RetryConfig writeRetry = new RetryConfig();
    }

    @Data
    public static class Worker {
        private int concurrency = 2;
        /**
         * Upper bound for {@code scaleTo}; also the thread count of the worker executor.
         */
        private int maxConcurrency = 16;
        private long stopTimeoutSeconds = 30;
        private long errorBackoffMs = 1000;
        private boolean autoStart = true;
    }

    @Data
    public static class Session {
        private int retentionDays = 30;
    }

    @Data
    public static class Export {
        private String baseDir = System.getProperty("java.io.tmpdir") + "/extraction_exports";
        private String baseUrl = "";
        private int batchThreshold = 5000;
        private int batchSize = 1000;
        private long linkExpiryHours = 24;
        private int maxDownloads = 10;
        private long retentionHours = 24;
    }
}
