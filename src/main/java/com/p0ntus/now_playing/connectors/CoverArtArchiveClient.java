package com.p0ntus.now_playing.connectors;

import java.net.URI;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.p0ntus.now_playing.config.NowPlayingProperties;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;

import reactor.core.publisher.Mono;

@Component
public class CoverArtArchiveClient {

	public static final String PROVIDER = "Cover Art Archive";

	private final WebClient coverArtArchiveWebClient;
	private final Duration timeout;

	public CoverArtArchiveClient(
			@Qualifier("coverArtArchiveWebClient") WebClient coverArtArchiveWebClient,
			NowPlayingProperties settings) {
		this.coverArtArchiveWebClient = coverArtArchiveWebClient;
		this.timeout = settings.providerTimeout();
	}

	/**
	 * Resolves the front cover of a release to the URL the image is served from.
	 * The archive answers with a redirect to the image host; the redirect target is the
	 * artwork link and the image bytes are never downloaded.
	 *
	 * @param releaseMbid MusicBrainz release id
	 * @return Mono containing the artwork URL
	 */
	public Mono<String> getFrontCoverUrl(String releaseMbid) {
		return coverArtArchiveWebClient.get()
				.uri("/release/{mbid}/front", releaseMbid)
				.exchangeToMono(this::resolveArtworkUrl)
				.transform(ProviderCallGuard.guard(PROVIDER, timeout));
	}

	private Mono<String> resolveArtworkUrl(ClientResponse response) {
		URI requestUri = response.request().getURI();
		int status = response.statusCode().value();

		if (response.statusCode().is3xxRedirection()) {
			URI location = response.headers().asHttpHeaders().getLocation();
			if (location == null) {
				return response.releaseBody().then(Mono.error(new ProviderUnavailableException(PROVIDER, status,
						PROVIDER + " redirect without Location", null)));
			}
			return response.releaseBody().thenReturn(requestUri.resolve(location).toString());
		}
		if (response.statusCode().is2xxSuccessful()) {
			return response.releaseBody().thenReturn(requestUri.toString());
		}
		return response.releaseBody().then(Mono.error(new ProviderUnavailableException(PROVIDER, status,
				PROVIDER + " error: " + status, null)));
	}
}
