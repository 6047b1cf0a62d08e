package com.p0ntus.now_playing.connectors;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.p0ntus.now_playing.config.NowPlayingProperties;
import com.p0ntus.now_playing.dto.musicbrainz.MusicBrainzReleaseSearchDto;

import reactor.core.publisher.Mono;

@Component
public class MusicBrainzClient {

	public static final String PROVIDER = "MusicBrainz";

	private final WebClient musicBrainzWebClient;
	private final Duration timeout;

	public MusicBrainzClient(
			@Qualifier("musicBrainzWebClient") WebClient musicBrainzWebClient,
			NowPlayingProperties settings) {
		this.musicBrainzWebClient = musicBrainzWebClient;
		this.timeout = settings.providerTimeout();
	}

	/**
	 * Searches the release catalog for the best match of an artist and release title.
	 *
	 * @param artist      artist name
	 * @param releaseName release (album) title
	 * @return Mono containing the top release id, empty when the search finds nothing
	 */
	public Mono<String> searchReleaseId(String artist, String releaseName) {
		String query = "artist:" + quote(artist) + " AND release:" + quote(releaseName);
		return musicBrainzWebClient.get()
				.uri(uriBuilder -> uriBuilder
						.path("/ws/2/release/")
						.queryParam("query", "{query}")
						.queryParam("fmt", "json")
						.queryParam("limit", 1)
						.build(query))
				.retrieve()
				.bodyToMono(MusicBrainzReleaseSearchDto.class)
				.transform(ProviderCallGuard.guard(PROVIDER, timeout))
				.flatMap(result -> Mono.justOrEmpty(result.firstReleaseId()));
	}

	private static String quote(String term) {
		return "\"" + term.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
