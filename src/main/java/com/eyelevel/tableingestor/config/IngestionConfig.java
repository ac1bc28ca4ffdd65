package com.eyelevel.tableingestor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app.ingestion" prefix to a strongly-typed
 * configuration object covering every stage of the ingestion pipeline.
 */
@Data
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionConfig {

    private int workerPoolSize = 4;
    private int workerQueueCapacity = 100;
    private Classifier classifier = new Classifier();
    private Csv csv = new Csv();
    private Ocr ocr = new Ocr();
    private Retry retry = new Retry();
    private Timeouts timeouts = new Timeouts();
    private Sqs sqs = new Sqs();
    private Polling polling = new Polling();
    private Upload upload = new Upload();

    @Data
    public static class Classifier {
        private int prefixBytes = 16;
    }

    @Data
    public static class Csv {
        /**
         * Fixed delimiter. When empty the delimiter is inferred from the header line.
         */
        private String delimiter;
        private String charset = "UTF-8";
    }

    @Data
    public static class Ocr {
        private String tableName = "ocr_text";
        private String command = "tesseract";
        private String language = "eng";
        private int pageSegmentationMode = 3;
        private int dpi = 300;
        private int maxPages = 50;
        private int pageConcurrency = 2;
        private double minSuccessRatio = 0.0;
        private Duration pageTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Retry {
        private int attempts = 3;
        private long delayMs = 500;
        private double multiplier = 2.0;
        private long maxDelayMs = 5000;
    }

    @Data
    public static class Timeouts {
        private Duration fetch = Duration.ofSeconds(60);
        private Duration structure = Duration.ofSeconds(120);
        private Duration extract = Duration.ofMinutes(10);
        private Duration load = Duration.ofSeconds(120);
    }

    @Data
    public static class Sqs {
        private boolean enabled;
        private String queueName;
    }

    @Data
    public static class Polling {
        private boolean enabled;
        private String bucket;
        private String prefix = "";
        private long intervalMs = 60000;
    }

    @Data
    public static class Upload {
        private String bucket;
    }
}
