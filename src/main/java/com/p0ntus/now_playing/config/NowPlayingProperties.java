package com.p0ntus.now_playing.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Binds the aggregation and transport timings from application.properties (now-playing.*).
 */
@ConfigurationProperties(prefix = "now-playing")
public record NowPlayingProperties(
		@DefaultValue("20s") Duration cacheTtl,
		@DefaultValue("8s") Duration providerTimeout,
		@DefaultValue("30s") Duration autoRefreshInterval,
		@DefaultValue RateLimit rateLimit,
		@DefaultValue Heartbeat heartbeat) {

	/**
	 * Per-connection refresh quota.
	 */
	public record RateLimit(
			@DefaultValue("10") int limit,
			@DefaultValue("60s") Duration window) {
	}

	/**
	 * Server ping cadence and the inbound silence after which a connection is dropped.
	 */
	public record Heartbeat(
			@DefaultValue("25s") Duration interval,
			@DefaultValue("60s") Duration timeout) {
	}
}
