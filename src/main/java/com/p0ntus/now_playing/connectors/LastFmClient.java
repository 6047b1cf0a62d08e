package com.p0ntus.now_playing.connectors;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.p0ntus.now_playing.config.NowPlayingProperties;
import com.p0ntus.now_playing.config.ProviderProperties;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackInfoDto;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;

import reactor.core.publisher.Mono;

@Component
public class LastFmClient {

	public static final String PROVIDER = "Last.fm";

	private final WebClient lastFmWebClient;
	private final String apiKey;
	private final boolean enabled;
	private final Duration timeout;

	public LastFmClient(
			@Qualifier("lastFmWebClient") WebClient lastFmWebClient,
			ProviderProperties providers,
			NowPlayingProperties settings) {
		this.lastFmWebClient = lastFmWebClient;
		this.apiKey = providers.lastfm().apiKey();
		this.enabled = providers.lastfm().isEnabled();
		this.timeout = settings.providerTimeout();
	}

	/**
	 * Whether an API key is configured. Without one every lookup completes empty.
	 */
	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * Looks up a track by its MusicBrainz recording identifier.
	 *
	 * @param recordingMbid MusicBrainz recording id
	 * @return Mono containing track info, empty when enrichment is disabled
	 */
	public Mono<LastFmTrackInfoDto> getTrackInfoByMbid(String recordingMbid) {
		if (!enabled) {
			return Mono.empty();
		}
		return lastFmWebClient.get()
				.uri(uriBuilder -> uriBuilder
						.path("/2.0/")
						.queryParam("method", "track.getInfoByMbid")
						.queryParam("mbid", "{mbid}")
						.queryParam("api_key", "{apiKey}")
						.queryParam("format", "json")
						.build(recordingMbid, apiKey))
				.retrieve()
				.bodyToMono(LastFmTrackInfoDto.class)
				.flatMap(this::rejectErrorBody)
				.transform(ProviderCallGuard.guard(PROVIDER, timeout));
	}

	/**
	 * Looks up a track by artist and track name, letting Last.fm correct misspellings.
	 *
	 * @param artist artist name
	 * @param track  track name
	 * @return Mono containing track info, empty when enrichment is disabled
	 */
	public Mono<LastFmTrackInfoDto> getTrackInfo(String artist, String track) {
		if (!enabled) {
			return Mono.empty();
		}
		return lastFmWebClient.get()
				.uri(uriBuilder -> uriBuilder
						.path("/2.0/")
						.queryParam("method", "track.getInfo")
						.queryParam("api_key", "{apiKey}")
						.queryParam("artist", "{artist}")
						.queryParam("track", "{track}")
						.queryParam("format", "json")
						.queryParam("autocorrect", "1")
						.build(apiKey, artist, track))
				.retrieve()
				.bodyToMono(LastFmTrackInfoDto.class)
				.flatMap(this::rejectErrorBody)
				.transform(ProviderCallGuard.guard(PROVIDER, timeout));
	}

	// Last.fm signals "track not found" and friends with HTTP 200 and an error code
	private Mono<LastFmTrackInfoDto> rejectErrorBody(LastFmTrackInfoDto info) {
		if (info.error() != null) {
			return Mono.error(new ProviderUnavailableException(PROVIDER,
					PROVIDER + " error " + info.error() + ": " + info.message(), null));
		}
		return Mono.just(info);
	}
}
