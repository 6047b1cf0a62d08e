package com.p0ntus.now_playing.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.dto.CacheEntry;

import reactor.core.publisher.Flux;

/**
 * Short-lived result cache plus the in-flight slot used to coalesce concurrent runs.
 *
 * At most one entry and at most one in-flight run exist per key. The
 * "check cache, check in-flight, register in-flight" decision in {@link #resolve} is
 * taken under a single lock so two callers can never both start a pipeline.
 */
public class ResultCache {

	private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

	private final Cache<String, CacheEntry> entries;
	private final Map<String, Flux<AggregationResult>> inFlight = new ConcurrentHashMap<>();
	private final Object lock = new Object();
	private final Duration ttl;

	public ResultCache(Duration ttl) {
		this(ttl, Ticker.systemTicker());
	}

	public ResultCache(Duration ttl, Ticker ticker) {
		this.ttl = ttl;
		this.entries = Caffeine.newBuilder()
				.maximumSize(16)
				.expireAfterWrite(ttl)
				.ticker(ticker)
				.recordStats()
				.build();
	}

	/**
	 * Outcome of {@link #resolve}: where the caller's results come from.
	 */
	public enum Source {
		CACHE, IN_FLIGHT, NEW_RUN
	}

	/**
	 * Results for one caller together with how they were obtained.
	 */
	public record Resolution(Source source, Flux<AggregationResult> results) {
	}

	public Optional<CacheEntry> get(String key) {
		return Optional.ofNullable(entries.getIfPresent(key));
	}

	/**
	 * Stores a terminal result, replacing any previous entry. Only complete results are
	 * accepted so that a transient failure never poisons the cache.
	 *
	 * @return true when the result was stored
	 */
	public boolean put(String key, AggregationResult result) {
		if (!result.isCacheable()) {
			logger.debug("Refusing to cache {} result for key: {}", result.status(), key);
			return false;
		}
		entries.put(key, new CacheEntry(result, Instant.now()));
		return true;
	}

	public void invalidate(String key) {
		entries.invalidate(key);
	}

	/**
	 * Atomically picks the source of results for {@code key}.
	 * <ul>
	 * <li>a fresh cache entry is replayed as the only result;</li>
	 * <li>a running pipeline is joined, and the caller receives only its terminal value;</li>
	 * <li>otherwise the pipeline from {@code pipeline} is registered and returned.</li>
	 * </ul>
	 * A registered run is shared and replayed to every subscriber, keeps running when
	 * subscribers cancel, and leaves the in-flight slot when it terminates.
	 */
	public Resolution resolve(String key, Supplier<Flux<AggregationResult>> pipeline) {
		synchronized (lock) {
			CacheEntry cached = entries.getIfPresent(key);
			if (cached != null) {
				return new Resolution(Source.CACHE, Flux.just(cached.result()));
			}

			Flux<AggregationResult> running = inFlight.get(key);
			if (running != null) {
				return new Resolution(Source.IN_FLIGHT, running.filter(AggregationResult::isTerminal).take(1));
			}

			AtomicReference<Flux<AggregationResult>> self = new AtomicReference<>();
			Flux<AggregationResult> run = pipeline.get()
					.doFinally(signalType -> {
						synchronized (lock) {
							inFlight.remove(key, self.get());
						}
						logger.debug("Removed in-flight run for key: {} (signal: {})", key, signalType);
					})
					.cache();
			self.set(run);
			inFlight.put(key, run);
			return new Resolution(Source.NEW_RUN, run);
		}
	}

	public boolean isInFlight(String key) {
		return inFlight.containsKey(key);
	}

	public Duration getTtl() {
		return ttl;
	}

	public long estimatedSize() {
		return entries.estimatedSize();
	}

	public CacheStats stats() {
		return entries.stats();
	}
}
