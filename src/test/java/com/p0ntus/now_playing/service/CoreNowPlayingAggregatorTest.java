package com.p0ntus.now_playing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.p0ntus.now_playing.connectors.CoverArtArchiveClient;
import com.p0ntus.now_playing.connectors.LastFmClient;
import com.p0ntus.now_playing.connectors.ListenBrainzClient;
import com.p0ntus.now_playing.connectors.MusicBrainzClient;
import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.dto.AggregationStatus;
import com.p0ntus.now_playing.dto.lastfm.LastFmAlbumDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmImageDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackInfoDto;
import com.p0ntus.now_playing.dto.listenbrainz.ListenBrainzPlayingNowDto;
import com.p0ntus.now_playing.dto.listenbrainz.TrackMetadataDto;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;
import com.p0ntus.now_playing.mapper.NowPlayingMapper;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

/**
 * Unit tests for CoreNowPlayingAggregator.
 * Providers are mocked; the mapper and cache are real.
 */
class CoreNowPlayingAggregatorTest {

	private static final String KEY = "test-user";

	@Mock
	private ListenBrainzClient listenBrainzClient;

	@Mock
	private LastFmClient lastFmClient;

	@Mock
	private CoverArtArchiveClient coverArtArchiveClient;

	@Mock
	private MusicBrainzClient musicBrainzClient;

	@Mock
	private AggregationEventObserver eventObserver;

	private ResultCache resultCache;
	private CoreNowPlayingAggregator aggregator;

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		resultCache = new ResultCache(Duration.ofSeconds(20));
		aggregator = new CoreNowPlayingAggregator(listenBrainzClient, lastFmClient, coverArtArchiveClient,
				musicBrainzClient, new NowPlayingMapper(), resultCache);
		aggregator.setObserver(eventObserver);

		when(lastFmClient.isEnabled()).thenReturn(true);
		when(lastFmClient.getTrackInfoByMbid(anyString())).thenReturn(Mono.empty());
		when(lastFmClient.getTrackInfo(anyString(), anyString())).thenReturn(Mono.empty());
		when(coverArtArchiveClient.getFrontCoverUrl(anyString())).thenReturn(Mono.empty());
		when(musicBrainzClient.searchReleaseId(anyString(), anyString())).thenReturn(Mono.empty());
	}

	@Test
	void run_TrackPlaying_EmitsLoadingPartialComplete() {
		// Arrange
		when(listenBrainzClient.getPlayingNow()).thenReturn(Mono.just(playing("Song A", "Artist B", "Album C", "abc")));
		when(lastFmClient.getTrackInfoByMbid("rec-1")).thenReturn(Mono.just(enrichment(
				new LastFmImageDto("http://img/2.jpg", "large"),
				new LastFmImageDto("http://img/1.jpg", "extralarge"))));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.LOADING);
					assertThat(result.message()).isEqualTo("Fetching from ListenBrainz...");
				})
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.PARTIAL);
					assertThat(result.trackName()).isEqualTo("Song A");
					assertThat(result.artistName()).isEqualTo("Artist B");
					assertThat(result.releaseName()).isEqualTo("Album C");
					assertThat(result.mbid()).isEqualTo("abc");
					assertThat(result.message()).isEqualTo("Fetching additional info...");
				})
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.COMPLETE);
					assertThat(result.trackName()).isEqualTo("Song A");
					assertThat(result.coverArt()).isEqualTo("http://img/1.jpg");
					assertThat(result.enrichment()).isNotNull();
					assertThat(result.message()).isEqualTo("Complete");
				})
				.verifyComplete();

		verify(lastFmClient).getTrackInfoByMbid("rec-1");
		// Embedded artwork found, so the archive is never asked
		verify(coverArtArchiveClient, never()).getFrontCoverUrl(anyString());
		verify(eventObserver).onCacheMiss();
		assertThat(resultCache.get(KEY)).isPresent();
	}

	@Test
	void run_CacheHit_ReturnsCachedResultWithoutProviderCalls() {
		// Arrange
		AggregationResult cached = AggregationResult.nothingPlaying();
		resultCache.put(KEY, cached);

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNext(cached)
				.verifyComplete();

		verify(eventObserver).onCacheHit();
		verify(listenBrainzClient, never()).getPlayingNow();
	}

	@Test
	void run_NothingPlaying_CompletesAndIsCached() {
		// Arrange
		when(listenBrainzClient.getPlayingNow()).thenReturn(Mono.just(nothingPlaying()));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNextMatches(result -> result.status() == AggregationStatus.LOADING)
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.COMPLETE);
					assertThat(result.trackName()).isNull();
					assertThat(result.message()).isEqualTo("No track currently playing");
				})
				.verifyComplete();

		StepVerifier.create(aggregator.run(KEY))
				.expectNextMatches(result -> result.message().equals("No track currently playing"))
				.verifyComplete();
		verify(listenBrainzClient, times(1)).getPlayingNow();
		verify(lastFmClient, never()).getTrackInfo(anyString(), anyString());
	}

	@Test
	void run_HistoryFails_EmitsErrorAndDoesNotCache() {
		// Arrange
		when(listenBrainzClient.getPlayingNow())
				.thenReturn(Mono.error(new ProviderUnavailableException("ListenBrainz", 500, "ListenBrainz error: 500", null)))
				.thenReturn(Mono.just(nothingPlaying()));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNextMatches(result -> result.status() == AggregationStatus.LOADING)
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.ERROR);
					assertThat(result.message()).isEqualTo("ListenBrainz error: 500");
				})
				.verifyComplete();

		verify(eventObserver).onPipelineFailure();
		assertThat(resultCache.get(KEY)).isEmpty();

		// The next run goes back to the provider
		StepVerifier.create(aggregator.run(KEY))
				.expectNextCount(1)
				.expectNextMatches(result -> result.status() == AggregationStatus.COMPLETE)
				.verifyComplete();
		verify(listenBrainzClient, times(2)).getPlayingNow();
	}

	@Test
	void run_EnrichmentDown_StillCompletesWithArchiveArtwork() {
		// Arrange
		when(listenBrainzClient.getPlayingNow()).thenReturn(Mono.just(playing("Song A", "Artist B", "Album C", "abc")));
		when(lastFmClient.getTrackInfoByMbid("rec-1"))
				.thenReturn(Mono.error(new ProviderUnavailableException("Last.fm", 503, "Last.fm error: 503", null)));
		when(lastFmClient.getTrackInfo("Artist B", "Song A"))
				.thenReturn(Mono.error(new ProviderUnavailableException("Last.fm", 503, "Last.fm error: 503", null)));
		when(coverArtArchiveClient.getFrontCoverUrl("abc")).thenReturn(Mono.just("https://archive.org/abc/front.jpg"));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNextCount(2)
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.COMPLETE);
					assertThat(result.enrichment()).isNull();
					assertThat(result.coverArt()).isEqualTo("https://archive.org/abc/front.jpg");
				})
				.verifyComplete();

		verify(eventObserver, times(2)).onStageDegraded("Last.fm");
		verify(musicBrainzClient, never()).searchReleaseId(anyString(), anyString());
	}

	@Test
	void run_NoReleaseMbid_FallsBackToCatalogSearch() {
		// Arrange
		when(listenBrainzClient.getPlayingNow()).thenReturn(Mono.just(playing("Song A", "Artist B", "Album C", null)));
		when(musicBrainzClient.searchReleaseId("Artist B", "Album C")).thenReturn(Mono.just("found-release"));
		when(coverArtArchiveClient.getFrontCoverUrl("found-release"))
				.thenReturn(Mono.just("https://archive.org/found-release/front.jpg"));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNextCount(2)
				.assertNext(result -> assertThat(result.coverArt())
						.isEqualTo("https://archive.org/found-release/front.jpg"))
				.verifyComplete();
	}

	@Test
	void run_EveryArtworkSourceFails_CompletesWithoutArtwork() {
		// Arrange
		when(listenBrainzClient.getPlayingNow()).thenReturn(Mono.just(playing("Song A", "Artist B", "Album C", "abc")));
		when(coverArtArchiveClient.getFrontCoverUrl("abc"))
				.thenReturn(Mono.error(new ProviderUnavailableException("Cover Art Archive", 404, "Cover Art Archive error: 404", null)));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNextCount(2)
				.assertNext(result -> {
					assertThat(result.status()).isEqualTo(AggregationStatus.COMPLETE);
					assertThat(result.coverArt()).isNull();
				})
				.verifyComplete();
	}

	@Test
	void run_EnrichmentDisabled_SkipsLastFm() {
		// Arrange
		when(lastFmClient.isEnabled()).thenReturn(false);
		when(listenBrainzClient.getPlayingNow()).thenReturn(Mono.just(playing("Song A", "Artist B", "Album C", "abc")));
		when(coverArtArchiveClient.getFrontCoverUrl("abc")).thenReturn(Mono.just("https://archive.org/abc/front.jpg"));

		// Act & Assert
		StepVerifier.create(aggregator.run(KEY))
				.expectNextCount(2)
				.assertNext(result -> assertThat(result.coverArt()).isEqualTo("https://archive.org/abc/front.jpg"))
				.verifyComplete();

		verify(lastFmClient, never()).getTrackInfo(anyString(), anyString());
		verify(lastFmClient, never()).getTrackInfoByMbid(anyString());
	}

	@Test
	void run_ConcurrentCallers_ShareOneRunAndTerminalInstance() {
		// Arrange
		Sinks.One<ListenBrainzPlayingNowDto> history = Sinks.one();
		when(listenBrainzClient.getPlayingNow()).thenReturn(history.asMono());
		AtomicReference<AggregationResult> firstTerminal = new AtomicReference<>();
		AtomicReference<AggregationResult> secondTerminal = new AtomicReference<>();

		Flux<AggregationResult> first = aggregator.run(KEY);
		Flux<AggregationResult> second = aggregator.run(KEY);

		// Act
		StepVerifier.create(first)
				.expectNextMatches(result -> result.status() == AggregationStatus.LOADING)
				.then(() -> StepVerifier.create(second)
						.then(() -> history.tryEmitValue(playing("Song A", "Artist B", "Album C", "abc")))
						.consumeNextWith(secondTerminal::set)
						.verifyComplete())
				.expectNextMatches(result -> result.status() == AggregationStatus.PARTIAL)
				.consumeNextWith(firstTerminal::set)
				.verifyComplete();

		// Assert
		assertThat(firstTerminal.get().status()).isEqualTo(AggregationStatus.COMPLETE);
		assertThat(secondTerminal.get()).isSameAs(firstTerminal.get());
		verify(listenBrainzClient, times(1)).getPlayingNow();
		verify(lastFmClient, times(1)).getTrackInfoByMbid("rec-1");
		verify(eventObserver).onInFlightSharing();
	}

	private static ListenBrainzPlayingNowDto playing(String track, String artist, String release, String releaseMbid) {
		TrackMetadataDto metadata = new TrackMetadataDto(track, artist, release, null,
				new TrackMetadataDto.AdditionalInfo("rec-1", releaseMbid, List.of("art-1")));
		return new ListenBrainzPlayingNowDto(new ListenBrainzPlayingNowDto.Payload(1, KEY, true,
				List.of(new ListenBrainzPlayingNowDto.Listen(true, metadata))));
	}

	private static ListenBrainzPlayingNowDto nothingPlaying() {
		return new ListenBrainzPlayingNowDto(new ListenBrainzPlayingNowDto.Payload(0, KEY, true, List.of()));
	}

	private static LastFmTrackInfoDto enrichment(LastFmImageDto... images) {
		LastFmAlbumDto album = new LastFmAlbumDto("Artist B", "Album C", null, null, List.of(images));
		LastFmTrackDto track = new LastFmTrackDto("Song A", null, null, null, "1234", "5678", null, album);
		return new LastFmTrackInfoDto(track, null, null, null);
	}
}
