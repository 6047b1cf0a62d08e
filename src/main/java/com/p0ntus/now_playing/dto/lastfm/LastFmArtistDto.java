package com.p0ntus.now_playing.dto.lastfm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LastFmArtistDto(
		@JsonProperty("name") String name,
		@JsonProperty("mbid") String mbid,
		@JsonProperty("url") String url) {
}
