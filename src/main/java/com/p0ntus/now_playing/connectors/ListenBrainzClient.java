package com.p0ntus.now_playing.connectors;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.p0ntus.now_playing.config.NowPlayingProperties;
import com.p0ntus.now_playing.config.ProviderProperties;
import com.p0ntus.now_playing.dto.listenbrainz.ListenBrainzPlayingNowDto;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;

import reactor.core.publisher.Mono;

@Component
public class ListenBrainzClient {

	public static final String PROVIDER = "ListenBrainz";

	private final WebClient listenBrainzWebClient;
	private final String user;
	private final Duration timeout;

	public ListenBrainzClient(
			@Qualifier("listenBrainzWebClient") WebClient listenBrainzWebClient,
			ProviderProperties providers,
			NowPlayingProperties settings) {
		this.listenBrainzWebClient = listenBrainzWebClient;
		this.user = providers.listenbrainz().user();
		this.timeout = settings.providerTimeout();
	}

	/**
	 * Fetches what the configured user is listening to right now.
	 *
	 * @return Mono with the playing-now payload; errors with
	 *         {@link ProviderUnavailableException} on any failure, including an empty body
	 */
	public Mono<ListenBrainzPlayingNowDto> getPlayingNow() {
		return listenBrainzWebClient.get()
				.uri("/1/user/{user}/playing-now", user)
				.retrieve()
				.bodyToMono(ListenBrainzPlayingNowDto.class)
				.switchIfEmpty(Mono.error(() -> new ProviderUnavailableException(PROVIDER,
						PROVIDER + " returned an empty response", null)))
				.transform(ProviderCallGuard.guard(PROVIDER, timeout));
	}

	public String getUser() {
		return user;
	}
}
