package com.p0ntus.now_playing.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import com.p0ntus.now_playing.service.NowPlayingService;
import com.p0ntus.now_playing.service.ResultCache;

/**
 * Reports the state of the now-playing result cache: whether a result is cached or a
 * run is in flight, and the hit statistics so far.
 */
@Component
public class CacheHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(CacheHealthIndicator.class);

	private final ResultCache resultCache;
	private final String aggregationKey;

	public CacheHealthIndicator(ResultCache resultCache, NowPlayingService nowPlayingService) {
		this.resultCache = resultCache;
		this.aggregationKey = nowPlayingService.getAggregationKey();
	}

	@Override
	public Health health() {
		try {
			CacheStats stats = resultCache.stats();
			long requestCount = stats.requestCount();
			double hitRate = requestCount > 0 ? stats.hitRate() * 100.0 : 0.0;

			Health.Builder builder = Health.up()
					.withDetail("cache", "nowPlayingResults")
					.withDetail("ttlSeconds", resultCache.getTtl().toSeconds())
					.withDetail("estimatedSize", resultCache.estimatedSize())
					.withDetail("inFlight", resultCache.isInFlight(aggregationKey))
					.withDetail("requestCount", requestCount)
					.withDetail("hitCount", stats.hitCount())
					.withDetail("missCount", stats.missCount())
					.withDetail("hitRate", String.format("%.2f%%", hitRate));

			resultCache.get(aggregationKey).ifPresent(entry -> builder
					.withDetail("cachedStatus", entry.result().status().wireName())
					.withDetail("capturedAt", entry.capturedAt().toString()));

			return builder.build();
		} catch (Exception ex) {
			logger.error("Cache health check failed: Unexpected error", ex);
			return Health.down()
					.withDetail("cache", "nowPlayingResults")
					.withDetail("error", "Unable to check cache health")
					.withDetail("errorMessage", ex.getMessage())
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
