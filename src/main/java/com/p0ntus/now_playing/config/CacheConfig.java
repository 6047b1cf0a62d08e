package com.p0ntus.now_playing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.p0ntus.now_playing.service.ResultCache;

/**
 * Configuration for the in-memory result cache (Caffeine underneath).
 * TTL: 20 seconds by default, the same for every entry.
 */
@Configuration
public class CacheConfig {

	@Bean
	public ResultCache resultCache(NowPlayingProperties settings) {
		return new ResultCache(settings.cacheTtl());
	}
}
