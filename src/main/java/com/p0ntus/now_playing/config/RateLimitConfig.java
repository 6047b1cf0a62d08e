package com.p0ntus.now_playing.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.p0ntus.now_playing.service.ConnectionRateLimiter;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

@Configuration
public class RateLimitConfig {

	private static final int SNAPSHOT_PERMITS_PER_PERIOD = 100;
	private static final int SNAPSHOT_PERIOD_IN_SECONDS = 60;

	/**
	 * Per-connection windows, opened by a connection's first refresh.
	 */
	@Bean
	public ConnectionRateLimiter connectionRateLimiter(NowPlayingProperties settings) {
		return new ConnectionRateLimiter(settings.rateLimit().limit(), settings.rateLimit().window());
	}

	@Bean
	public RateLimiter snapshotRateLimiter() {
		RateLimiterConfig config = RateLimiterConfig.custom()
				.limitForPeriod(SNAPSHOT_PERMITS_PER_PERIOD)
				.limitRefreshPeriod(Duration.ofSeconds(SNAPSHOT_PERIOD_IN_SECONDS))
				.timeoutDuration(Duration.ZERO)
				.build();

		return RateLimiter.of("nowPlayingSnapshot", config);
	}
}
