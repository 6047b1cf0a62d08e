package com.p0ntus.now_playing.dto.lastfm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of Last.fm {@code track.getInfo} / {@code track.getInfoByMbid}.
 * Last.fm reports lookup failures with HTTP 200 and an {@code error} code in the body.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LastFmTrackInfoDto(
		@JsonProperty("track") LastFmTrackDto track,
		@JsonProperty("album") LastFmAlbumDto album,
		@JsonProperty("error") Integer error,
		@JsonProperty("message") String message) {

	public boolean hasTrackData() {
		return error == null && (track != null || album != null);
	}
}
