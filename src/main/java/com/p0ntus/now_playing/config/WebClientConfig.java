package com.p0ntus.now_playing.config;

import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

/**
 * One WebClient per upstream provider. All of them share the same connector settings and
 * request logging; only base URL and default headers differ.
 */
@Configuration
@EnableConfigurationProperties({ ProviderProperties.class, NowPlayingProperties.class })
public class WebClientConfig {

	private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

	private static final int CONNECT_TIMEOUT_MILLIS = 5000;

	@Bean
	public WebClient listenBrainzWebClient(ProviderProperties providers, NowPlayingProperties settings) {
		ProviderProperties.ListenBrainz listenbrainz = providers.listenbrainz();
		WebClient.Builder builder = baseBuilder(listenbrainz.baseUrl(), "ListenBrainz", settings);
		if (listenbrainz.hasToken()) {
			builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Token " + listenbrainz.token());
		}
		return builder.build();
	}

	@Bean
	public WebClient lastFmWebClient(ProviderProperties providers, NowPlayingProperties settings) {
		return baseBuilder(providers.lastfm().baseUrl(), "Last.fm", settings).build();
	}

	@Bean
	public WebClient coverArtArchiveWebClient(ProviderProperties providers, NowPlayingProperties settings) {
		return baseBuilder(providers.coverArtArchive().baseUrl(), "Cover Art Archive", settings).build();
	}

	@Bean
	public WebClient musicBrainzWebClient(ProviderProperties providers, NowPlayingProperties settings) {
		return baseBuilder(providers.musicbrainz().baseUrl(), "MusicBrainz", settings)
				.defaultHeader(HttpHeaders.USER_AGENT, providers.musicbrainz().userAgent())
				.build();
	}

	private WebClient.Builder baseBuilder(String baseUrl, String providerName, NowPlayingProperties settings) {
		// redirects stay unfollowed: the artwork archive answers with a Location we read ourselves
		HttpClient httpClient = HttpClient.create()
				.responseTimeout(settings.providerTimeout())
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

		return WebClient.builder()
				.baseUrl(baseUrl)
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				.filter(logRequestAndResponseWithLatency(providerName));
	}

	private ExchangeFilterFunction logRequestAndResponseWithLatency(String providerName) {
		return (clientRequest, next) -> {
			Instant startTime = Instant.now();
			String method = clientRequest.method().name();
			String url = clientRequest.url().getPath();

			if (logger.isDebugEnabled()) {
				logger.debug("Outgoing request to {}: {} {}", providerName, method, url);
			}

			return next.exchange(clientRequest)
					.doOnSuccess(response -> {
						Duration duration = Duration.between(startTime, Instant.now());
						int statusCode = response.statusCode().value();

						if (logger.isDebugEnabled()) {
							logger.debug("Received response from {}: {} in {}ms",
									providerName, statusCode, duration.toMillis());
						}

						if (response.statusCode().isError()) {
							logger.warn("{} returned error: {} for {} {} (took {}ms)",
									providerName, statusCode, method, url, duration.toMillis());
						}
					})
					.doOnError(error -> {
						Duration duration = Duration.between(startTime, Instant.now());
						logger.warn("{} request failed for {} {} (took {}ms) - {}",
								providerName, method, url, duration.toMillis(), error.getMessage());
					});
		};
	}
}
