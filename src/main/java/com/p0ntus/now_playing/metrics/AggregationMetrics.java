package com.p0ntus.now_playing.metrics;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Centralized metrics for now-playing aggregation.
 */
@Component
public class AggregationMetrics {

	private final MeterRegistry meterRegistry;
	private final Counter cacheHitCounter;
	private final Counter cacheMissCounter;
	private final Counter inFlightSharingCounter;
	private final Counter rateLimitedCounter;
	private final Counter pipelineFailureCounter;
	private final Timer aggregationTimer;

	public AggregationMetrics(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.cacheHitCounter = Counter.builder("now.playing.cache.hits")
				.description("Number of refreshes answered from the result cache")
				.register(meterRegistry);

		this.cacheMissCounter = Counter.builder("now.playing.cache.misses")
				.description("Number of refreshes that found no fresh cached result")
				.register(meterRegistry);

		this.inFlightSharingCounter = Counter.builder("now.playing.inflight.sharing")
				.description("Number of refreshes that joined a run already in flight")
				.register(meterRegistry);

		this.rateLimitedCounter = Counter.builder("now.playing.errors.rate_limited")
				.description("Number of refreshes rejected by the rate limiter")
				.tag("error_type", "rate_limited")
				.register(meterRegistry);

		this.pipelineFailureCounter = Counter.builder("now.playing.errors.pipeline_failure")
				.description("Number of runs that ended in error because the history lookup failed")
				.tag("error_type", "pipeline_failure")
				.register(meterRegistry);

		this.aggregationTimer = Timer.builder("now.playing.aggregation.duration")
				.description("Time from refresh request to terminal result")
				.register(meterRegistry);
	}

	public void recordCacheHit() {
		cacheHitCounter.increment();
	}

	public void recordCacheMiss() {
		cacheMissCounter.increment();
	}

	public void recordInFlightSharing() {
		inFlightSharingCounter.increment();
	}

	public void recordRateLimited() {
		rateLimitedCounter.increment();
	}

	public void recordPipelineFailure() {
		pipelineFailureCounter.increment();
	}

	public void recordStageDegraded(String provider) {
		meterRegistry.counter("now.playing.stage.degraded", "provider", provider).increment();
	}

	public Timer.Sample startTimer() {
		return Timer.start();
	}

	public void stopTimer(Timer.Sample sample) {
		sample.stop(aggregationTimer);
	}
}
