package com.reprise.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Reprise.
 */
@Data
@Component
@ConfigurationProperties(prefix = "reprise")
public class RepriseProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private CacheConfig cache = new CacheConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private ProxyConfig proxy = new ProxyConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String chatModel = "gpt-3.5-turbo";
        private String embeddingModel = "text-embedding-3-small";
        private double temperature = 0.2;
        private int maxTokens = 800;
    }

    @Data
    public static class CacheConfig {
        private Duration ttl = Duration.ofHours(24);
        private int memoryMaxSize = 1000;
        private Path directory = Path.of("storage", "cache");
        private double similarityThreshold = 0.5;
        private RedisTierConfig redis = new RedisTierConfig();
    }

    @Data
    public static class RedisTierConfig {
        private boolean enabled = true;
        private String keyPrefix = "reprise:";
    }

    @Data
    public static class RetrievalConfig {
        private int defaultK = 4;
        private int summaryK = 20;
        private String summaryQuery = "full transcript";
        private double hybridVectorWeight = 0.7;
        private Duration denseTimeout = Duration.ofSeconds(10);
        private DenseFailurePolicy denseFailurePolicy = DenseFailurePolicy.DEGRADE;
        private Bm25Config bm25 = new Bm25Config();
    }

    @Data
    public static class Bm25Config {
        private double k1 = 1.5;
        private double b = 0.75;
    }

    @Data
    public static class ProxyConfig {
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 3;
    }

    /**
     * What hybrid search does when the dense-similarity call fails or times out.
     */
    public enum DenseFailurePolicy {
        DEGRADE,    // Continue with lexical results only
        FAIL        // Propagate UpstreamUnavailableException
    }
}
