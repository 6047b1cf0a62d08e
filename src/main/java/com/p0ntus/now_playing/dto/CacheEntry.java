package com.p0ntus.now_playing.dto;

import java.time.Instant;

/**
 * A cached terminal result and the moment it was stored.
 */
public record CacheEntry(AggregationResult result, Instant capturedAt) {
}
