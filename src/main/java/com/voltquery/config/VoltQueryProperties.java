package com.voltquery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for VoltQuery.
 */
@Data
@Component
@ConfigurationProperties(prefix = "voltquery")
public class VoltQueryProperties {

    public static final String DEFAULT_KEY = "default";

    private LlmConfig llm = new LlmConfig();
    private ApiConfig nrel = new ApiConfig();
    private ApiConfig reopt = new ApiConfig();
    private ApiConfig geocoding = new ApiConfig();
    private ApiConfig bcl = new ApiConfig();
    private ApiConfig urdb = new ApiConfig();
    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();
    private Map<String, BreakerConfig> breakers = new HashMap<>();
    private Map<String, RetryConfig> retry = new HashMap<>();
    private Map<String, Duration> freshness = new HashMap<>();
    private Map<String, ToolConfig> tools = new HashMap<>();
    private FinancingConfig financing = new FinancingConfig();
    private QueryConfig query = new QueryConfig();
    private IndexingConfig indexing = new IndexingConfig();

    /**
     * Breaker settings for a name, falling back to the "default" entry.
     */
    public BreakerConfig breakerFor(String name) {
        BreakerConfig config = breakers.get(name);
        if (config != null) {
            return config;
        }
        return breakers.getOrDefault(DEFAULT_KEY, new BreakerConfig());
    }

    /**
     * Retry settings for a policy name, falling back to the "default" entry.
     */
    public RetryConfig retryFor(String name) {
        RetryConfig config = retry.get(name);
        if (config != null) {
            return config;
        }
        return retry.getOrDefault(DEFAULT_KEY, new RetryConfig());
    }

    public ToolConfig toolFor(String name) {
        ToolConfig config = tools.get(name);
        if (config != null) {
            return config;
        }
        return tools.getOrDefault(DEFAULT_KEY, new ToolConfig());
    }

    public Duration freshnessTtl(String domain) {
        return freshness.getOrDefault(domain, Duration.ofHours(24));
    }

    @Data
    public static class LlmConfig {
        private boolean enabled = true;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.1;
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ApiConfig {
        private String baseUrl;
        private String apiKey;
        private String userAgent = "VoltQuery/1.0";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class StoreConfig {
        /**
         * "supabase" for the PostgREST-backed store, "memory" for the in-process one.
         */
        private String type = "memory";
        private String url;
        private String apiKey;
        private String table = "documents";
        private int topK = 5;
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Upper bound of the in-memory store.
         */
        private long maxRecords = 200_000;

        /**
         * Records per upsert call when indexing.
         */
        private int indexBatchSize = 100;
    }

    @Data
    public static class CacheConfig {
        private int maxSize = 10000;
        private Map<String, Duration> ttl = new HashMap<>();

        public Duration ttlFor(String namespace) {
            return ttl.getOrDefault(namespace, Duration.ofHours(1));
        }
    }

    @Data
    public static class BreakerConfig {
        private int failureThreshold = 5;
        private Duration openTimeout = Duration.ofSeconds(60);
        private int successThreshold = 2;
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double exponentialBase = 2.0;
        private boolean jitter = true;
    }

    @Data
    public static class ToolConfig {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class FinancingConfig {
        private double residentialPurchaseItc = 0.0;
        private double residentialLeaseItc = 0.30;
        private double commercialItc = 0.30;
        private int analysisYears = 25;
        private double discountRate = 0.07;
        private double electricityEscalationRate = 0.04;
        private double omCostEscalationRate = 0.025;
        private double taxRate = 0.26;
        private double pvMaxKw = 1000.0;
        private LocalDate safeHarborDate = LocalDate.of(2026, 7, 4);
        private Duration branchTimeout = Duration.ofMinutes(5);
        private Duration pollInitialInterval = Duration.ofSeconds(3);
        private Duration pollMaxInterval = Duration.ofSeconds(30);
        private int maxPollAttempts = 120;
    }

    @Data
    public static class QueryConfig {
        private int minQuestionLength = 3;
        private int maxQuestionLength = 2000;
        private Duration synthesisTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class IndexingConfig {
        /**
         * Locations indexed concurrently within one batch of a bulk task.
         */
        private int fetchBatchSize = 10;
        private Duration delayBetweenBatches = Duration.ofSeconds(1);
        private int stationLimit = 200;
        private int maxLocationsPerTask = 500;
        private Duration taskRetention = Duration.ofHours(24);
    }
}
