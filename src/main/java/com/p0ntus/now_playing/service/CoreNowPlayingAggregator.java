package com.p0ntus.now_playing.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.p0ntus.now_playing.connectors.CoverArtArchiveClient;
import com.p0ntus.now_playing.connectors.LastFmClient;
import com.p0ntus.now_playing.connectors.ListenBrainzClient;
import com.p0ntus.now_playing.connectors.MusicBrainzClient;
import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.dto.TrackIdentity;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackInfoDto;
import com.p0ntus.now_playing.dto.listenbrainz.TrackMetadataDto;
import com.p0ntus.now_playing.mapper.NowPlayingMapper;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Core aggregation pipeline: history lookup, enrichment race, artwork fallback chain.
 * Knows nothing about metrics, rate limits or transports; those live in
 * {@link NowPlayingService} and the WebSocket layer.
 */
@Component
public class CoreNowPlayingAggregator {

	private static final Logger logger = LoggerFactory.getLogger(CoreNowPlayingAggregator.class);

	static final String LOADING_MESSAGE = "Fetching from ListenBrainz...";
	static final String PARTIAL_MESSAGE = "Fetching additional info...";

	private final ListenBrainzClient listenBrainzClient;
	private final LastFmClient lastFmClient;
	private final CoverArtArchiveClient coverArtArchiveClient;
	private final MusicBrainzClient musicBrainzClient;
	private final NowPlayingMapper mapper;
	private final ResultCache resultCache;
	private AggregationEventObserver eventObserver;

	public CoreNowPlayingAggregator(
			ListenBrainzClient listenBrainzClient,
			LastFmClient lastFmClient,
			CoverArtArchiveClient coverArtArchiveClient,
			MusicBrainzClient musicBrainzClient,
			NowPlayingMapper mapper,
			ResultCache resultCache) {
		this.listenBrainzClient = listenBrainzClient;
		this.lastFmClient = lastFmClient;
		this.coverArtArchiveClient = coverArtArchiveClient;
		this.musicBrainzClient = musicBrainzClient;
		this.mapper = mapper;
		this.resultCache = resultCache;
	}

	public void setObserver(AggregationEventObserver observer) {
		this.eventObserver = observer;
	}

	/**
	 * Streams the now-playing state for {@code key}.
	 * A cache hit yields the cached result alone. Joining a run already in flight yields
	 * only that run's terminal result. A new run yields loading, one partial and a
	 * terminal result, or loading and a terminal result when nothing is playing or the
	 * history lookup fails.
	 *
	 * @param key aggregation key (the tracked listener)
	 * @return Flux ending with exactly one complete or error result
	 */
	public Flux<AggregationResult> run(String key) {
		return Flux.defer(() -> {
			ResultCache.Resolution resolution = resultCache.resolve(key, () -> pipeline(key));
			switch (resolution.source()) {
				case CACHE -> {
					logger.debug("Cache hit for key: {}", key);
					publish(AggregationEventObserver::onCacheHit);
				}
				case IN_FLIGHT -> {
					logger.debug("In-flight run found for key: {}, sharing the same operation", key);
					publish(AggregationEventObserver::onCacheMiss);
					publish(AggregationEventObserver::onInFlightSharing);
				}
				case NEW_RUN -> {
					logger.debug("Cache miss and no in-flight run for key: {}, starting pipeline", key);
					publish(AggregationEventObserver::onCacheMiss);
				}
			}
			return resolution.results();
		});
	}

	private Flux<AggregationResult> pipeline(String key) {
		Flux<AggregationResult> afterHistory = listenBrainzClient.getPlayingNow()
				.flatMapMany(playingNow -> {
					TrackMetadataDto metadata = playingNow.currentTrack();
					if (metadata == null) {
						AggregationResult nothingPlaying = AggregationResult.nothingPlaying();
						resultCache.put(key, nothingPlaying);
						logger.info("Nothing playing for key: {}", key);
						return Flux.just(nothingPlaying);
					}
					TrackIdentity track = mapper.toTrackIdentity(metadata);
					return Flux.concat(
							Mono.just(AggregationResult.partial(track, PARTIAL_MESSAGE)),
							completeTrack(key, track));
				})
				.onErrorResume(ex -> {
					logger.warn("History lookup failed for key: {} - {}", key, ex.getMessage());
					publish(AggregationEventObserver::onPipelineFailure);
					return Flux.just(AggregationResult.error(describe(ex)));
				});

		return Flux.concat(Mono.just(AggregationResult.loading(LOADING_MESSAGE)), afterHistory);
	}

	private Mono<AggregationResult> completeTrack(String key, TrackIdentity track) {
		return optional(enrichment(track))
				.flatMap(enrichment -> optional(artwork(track, enrichment.orElse(null)))
						.map(coverArt -> AggregationResult.complete(track, coverArt.orElse(null),
								enrichment.orElse(null))))
				.doOnNext(result -> {
					resultCache.put(key, result);
					logger.info("Aggregated now playing for key: {} ({} - {}, artwork: {})",
							key, track.artistName(), track.trackName(), result.coverArt() != null);
				});
	}

	/**
	 * Races the MBID lookup against the name lookup; the first usable answer wins.
	 */
	private Mono<LastFmTrackInfoDto> enrichment(TrackIdentity track) {
		if (!lastFmClient.isEnabled()) {
			return Mono.empty();
		}
		List<Mono<LastFmTrackInfoDto>> queries = new ArrayList<>();
		if (track.hasRecordingMbid()) {
			queries.add(degradeQuietly(lastFmClient.getTrackInfoByMbid(track.recordingMbid()),
					LastFmClient.PROVIDER));
		}
		if (track.artistName() != null && track.trackName() != null) {
			queries.add(degradeQuietly(lastFmClient.getTrackInfo(track.artistName(), track.trackName()),
					LastFmClient.PROVIDER));
		}
		return FirstSuccess.race(queries, LastFmTrackInfoDto::hasTrackData);
	}

	/**
	 * Embedded Last.fm image, then the archive by release id, then a catalog search
	 * for the release id followed by the archive again.
	 */
	private Mono<String> artwork(TrackIdentity track, LastFmTrackInfoDto enrichment) {
		List<Supplier<Mono<String>>> steps = List.of(
				() -> Mono.justOrEmpty(mapper.selectCoverArt(enrichment)),
				() -> track.hasReleaseMbid()
						? degradeQuietly(coverArtArchiveClient.getFrontCoverUrl(track.releaseMbid()),
								CoverArtArchiveClient.PROVIDER)
						: Mono.empty(),
				() -> track.hasReleaseName()
						? degradeQuietly(musicBrainzClient.searchReleaseId(track.artistName(), track.releaseName()),
								MusicBrainzClient.PROVIDER)
								.flatMap(releaseId -> degradeQuietly(coverArtArchiveClient.getFrontCoverUrl(releaseId),
										CoverArtArchiveClient.PROVIDER))
						: Mono.empty());
		return FirstSuccess.sequence(steps);
	}

	private <T> Mono<T> degradeQuietly(Mono<T> call, String provider) {
		return call.doOnError(ex -> {
			logger.warn("{} lookup failed - continuing without it. Error: {}", provider, ex.getMessage());
			publish(observer -> observer.onStageDegraded(provider));
		});
	}

	private static <T> Mono<Optional<T>> optional(Mono<T> value) {
		return value.map(Optional::of).defaultIfEmpty(Optional.empty());
	}

	private static String describe(Throwable ex) {
		return ex.getMessage() != null ? ex.getMessage() : "Unknown error occurred";
	}

	private void publish(Consumer<AggregationEventObserver> event) {
		if (eventObserver != null) {
			event.accept(eventObserver);
		}
	}
}
