package com.p0ntus.now_playing.dto.lastfm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LastFmTrackDto(
		@JsonProperty("name") String name,
		@JsonProperty("mbid") String mbid,
		@JsonProperty("url") String url,
		@JsonProperty("duration") String duration,
		@JsonProperty("listeners") String listeners,
		@JsonProperty("playcount") String playcount,
		@JsonProperty("artist") LastFmArtistDto artist,
		@JsonProperty("album") LastFmAlbumDto album) {
}
