package com.reprise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.repository.FileTierStore;
import com.reprise.repository.MemoryTierStore;
import com.reprise.repository.RedisTierStore;
import com.reprise.repository.TierStore;
import com.reprise.service.TieredCacheManager;
import com.reprise.service.canonicalization.QueryNormalizer;
import com.reprise.service.similarity.ApproximateMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Cache tier wiring. Tier order is memory, Redis (when enabled), file.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final RepriseProperties properties;

    public CacheConfiguration(RepriseProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MemoryTierStore memoryTierStore(Clock clock) {
        RepriseProperties.CacheConfig cache = properties.getCache();
        return new MemoryTierStore(cache.getMemoryMaxSize(), cache.getTtl(), clock);
    }

    @Bean
    public FileTierStore fileTierStore(ObjectMapper objectMapper) {
        log.info("File cache tier at {}", properties.getCache().getDirectory().toAbsolutePath());
        return new FileTierStore(properties.getCache().getDirectory(), objectMapper);
    }

    @Bean
    public ApproximateMatcher approximateMatcher(FileTierStore fileTierStore,
                                                 QueryNormalizer normalizer,
                                                 Clock clock) {
        return new ApproximateMatcher(fileTierStore, normalizer, properties, clock);
    }

    @Bean
    public TieredCacheManager tieredCacheManager(MemoryTierStore memoryTierStore,
                                                 ObjectProvider<RedisTierStore> redisTierStore,
                                                 FileTierStore fileTierStore,
                                                 ApproximateMatcher approximateMatcher,
                                                 QueryNormalizer normalizer,
                                                 Clock clock) {
        List<TierStore> tiers = new ArrayList<>();
        tiers.add(memoryTierStore);
        redisTierStore.ifAvailable(tiers::add);
        tiers.add(fileTierStore);

        return new TieredCacheManager(tiers, approximateMatcher, normalizer, clock,
                properties.getCache().getTtl());
    }
}
