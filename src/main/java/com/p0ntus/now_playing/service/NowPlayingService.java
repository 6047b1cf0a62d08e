package com.p0ntus.now_playing.service;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.p0ntus.now_playing.config.ProviderProperties;
import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.exception.RateLimitExceededException;
import com.p0ntus.now_playing.metrics.AggregationMetrics;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Decorator around {@link CoreNowPlayingAggregator} adding rate limiting and metrics.
 *
 * Implements Decorator Pattern (wraps the core pipeline) and Observer Pattern
 * (receives business events from the core for metrics recording).
 */
@Service
public class NowPlayingService implements AggregationEventObserver {

	private static final Logger logger = LoggerFactory.getLogger(NowPlayingService.class);

	public static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded. Please wait before requesting again.";

	private final CoreNowPlayingAggregator coreAggregator;
	private final AggregationMetrics metrics;
	private final ConnectionRateLimiter connectionRateLimiter;
	private final RateLimiter snapshotRateLimiter;
	private final String aggregationKey;

	public NowPlayingService(
			CoreNowPlayingAggregator coreAggregator,
			AggregationMetrics metrics,
			ConnectionRateLimiter connectionRateLimiter,
			@Qualifier("snapshotRateLimiter") RateLimiter snapshotRateLimiter,
			ProviderProperties providers) {
		this.coreAggregator = coreAggregator;
		this.metrics = metrics;
		this.connectionRateLimiter = connectionRateLimiter;
		this.snapshotRateLimiter = snapshotRateLimiter;
		this.aggregationKey = providers.listenbrainz().user();
	}

	@PostConstruct
	public void wireObserver() {
		coreAggregator.setObserver(this);
	}

	@Override
	public void onCacheHit() {
		metrics.recordCacheHit();
	}

	@Override
	public void onCacheMiss() {
		metrics.recordCacheMiss();
	}

	@Override
	public void onInFlightSharing() {
		metrics.recordInFlightSharing();
	}

	@Override
	public void onPipelineFailure() {
		metrics.recordPipelineFailure();
	}

	@Override
	public void onStageDegraded(String provider) {
		metrics.recordStageDegraded(provider);
	}

	/**
	 * Refresh requested over a client connection. A request beyond the connection's quota
	 * yields a single error result and never reaches the providers.
	 *
	 * @param connectionId identifier of the requesting connection
	 * @return Flux of status updates ending in one terminal result
	 */
	public Flux<AggregationResult> refresh(String connectionId) {
		return Flux.defer(() -> {
			if (!connectionRateLimiter.admit(connectionId)) {
				metrics.recordRateLimited();
				logger.debug("Rejected refresh for connection: {}", connectionId);
				return Flux.just(AggregationResult.error(RATE_LIMIT_MESSAGE));
			}
			return instrumented(coreAggregator.run(aggregationKey));
		});
	}

	/**
	 * Terminal result of one aggregation, for request/response callers.
	 * Shares the cache and in-flight run with connected clients.
	 *
	 * @return Mono containing the complete or error result; errors with
	 *         {@link RateLimitExceededException} when the global quota is used up
	 */
	public Mono<AggregationResult> snapshot() {
		return instrumented(coreAggregator.run(aggregationKey))
				.filter(AggregationResult::isTerminal)
				.next()
				.transformDeferred(RateLimiterOperator.of(snapshotRateLimiter))
				.onErrorMap(RequestNotPermitted.class,
						ex -> new RateLimitExceededException("Rate limit exceeded for now-playing snapshots"))
				.doOnError(RateLimitExceededException.class, ex -> metrics.recordRateLimited());
	}

	/**
	 * Forgets everything kept for a closed connection.
	 */
	public void releaseConnection(String connectionId) {
		connectionRateLimiter.discard(connectionId);
	}

	public String getAggregationKey() {
		return aggregationKey;
	}

	private Flux<AggregationResult> instrumented(Flux<AggregationResult> results) {
		return Flux.defer(() -> {
			Timer.Sample sample = metrics.startTimer();
			return results
					.doOnNext(result -> {
						if (result.isTerminal()) {
							logger.debug("Aggregation for key: {} finished with status: {}",
									aggregationKey, result.status());
						}
					})
					.doOnError(ex -> logger.error("Unexpected error aggregating key: {}", aggregationKey, ex))
					.doFinally(signalType -> metrics.stopTimer(sample));
		});
	}
}
