package com.p0ntus.now_playing.dto.lastfm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LastFmImageDto(
		@JsonProperty("#text") String url,
		@JsonProperty("size") String size) {

	public boolean hasUrl() {
		return url != null && !url.isBlank();
	}
}
