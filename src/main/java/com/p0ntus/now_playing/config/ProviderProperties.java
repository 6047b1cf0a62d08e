package com.p0ntus.now_playing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the upstream provider settings from application.properties (providers.*).
 */
@ConfigurationProperties(prefix = "providers")
public record ProviderProperties(
		ListenBrainz listenbrainz,
		LastFm lastfm,
		CoverArtArchive coverArtArchive,
		MusicBrainz musicbrainz) {

	/**
	 * History provider. The user name doubles as the aggregation key.
	 */
	public record ListenBrainz(String baseUrl, String user, String token) {

		public boolean hasToken() {
			return token != null && !token.isBlank();
		}
	}

	/**
	 * Enrichment provider. A missing API key disables every enrichment call.
	 */
	public record LastFm(String baseUrl, String apiKey) {

		public boolean isEnabled() {
			return apiKey != null && !apiKey.isBlank();
		}
	}

	public record CoverArtArchive(String baseUrl) {
	}

	public record MusicBrainz(String baseUrl, String userAgent) {
	}
}
