package com.p0ntus.now_playing.dto.lastfm;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LastFmAlbumDto(
		@JsonProperty("artist") String artist,
		@JsonProperty("title") String title,
		@JsonProperty("mbid") String mbid,
		@JsonProperty("url") String url,
		@JsonProperty("image") List<LastFmImageDto> image) {
}
