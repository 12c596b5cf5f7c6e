package com.reprise.controller;

import com.reprise.model.dto.CacheStatistics;
import com.reprise.service.TieredCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cache statistics across all tiers.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final TieredCacheManager cacheManager;

    public CacheController(TieredCacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        CacheStatistics stats = cacheManager.getStats();
        log.debug("Cache stats requested: hitRate={}", stats.getHitRate());
        return ResponseEntity.ok(stats);
    }
}
