package com.p0ntus.now_playing.service;

/**
 * Observer interface for aggregation events.
 * Allows the core aggregator to report business events without knowing about metrics.
 */
public interface AggregationEventObserver {

	void onCacheHit();

	void onCacheMiss();

	void onInFlightSharing();

	void onPipelineFailure();

	/**
	 * An optional stage (enrichment or artwork) failed and was skipped.
	 */
	void onStageDegraded(String provider);
}
