package com.voltquery.controller;

import com.voltquery.model.dto.CacheStatistics;
import com.voltquery.service.cache.ResponseCache;
import com.voltquery.service.resilience.CircuitBreakerRegistry;
import com.voltquery.service.resilience.CircuitBreakerSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for circuit breakers and the response cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final CircuitBreakerRegistry breakerRegistry;
    private final ResponseCache responseCache;

    public AdminController(CircuitBreakerRegistry breakerRegistry, ResponseCache responseCache) {
        this.breakerRegistry = breakerRegistry;
        this.responseCache = responseCache;
    }

    /**
     * Current state of every breaker created so far.
     */
    @GetMapping("/breakers")
    public ResponseEntity<List<CircuitBreakerSnapshot>> getBreakers() {
        return ResponseEntity.ok(breakerRegistry.getAllStates());
    }

    /**
     * Reset one breaker to CLOSED.
     *
     * @param name breaker name
     * @return 404 if no breaker with that name exists
     */
    @PostMapping("/breakers/{name}/reset")
    public ResponseEntity<Map<String, String>> resetBreaker(@PathVariable String name) {
        log.warn("Admin: resetting circuit breaker {}", name);
        if (!breakerRegistry.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "success", "breaker", name));
    }

    @PostMapping("/breakers/reset")
    public ResponseEntity<Map<String, String>> resetAllBreakers() {
        log.warn("Admin: resetting all circuit breakers");
        breakerRegistry.resetAll();
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStatistics> getCacheStats() {
        return ResponseEntity.ok(responseCache.getStats());
    }

    /**
     * Clear the response cache, or only the keys starting with a prefix.
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache(@RequestParam(required = false) String prefix) {
        int removed = prefix == null || prefix.isBlank() ? responseCache.clear() : responseCache.clear(prefix);
        log.warn("Admin: cleared {} cache entries (prefix={})", removed, prefix);
        return ResponseEntity.ok(Map.of("status", "success", "removed", removed));
    }

    /**
     * Drop entries older than the given age.
     *
     * @param maxAgeSeconds entries at least this old are removed
     */
    @PostMapping("/cache/cleanup")
    public ResponseEntity<Map<String, Object>> cleanupCache(@RequestParam long maxAgeSeconds) {
        if (maxAgeSeconds < 0) {
            throw new IllegalArgumentException("maxAgeSeconds must not be negative");
        }
        int removed = responseCache.cleanupExpired(Duration.ofSeconds(maxAgeSeconds));
        log.info("Admin: removed {} cache entries older than {}s", removed, maxAgeSeconds);
        return ResponseEntity.ok(Map.of("status", "success", "removed", removed));
    }
}
