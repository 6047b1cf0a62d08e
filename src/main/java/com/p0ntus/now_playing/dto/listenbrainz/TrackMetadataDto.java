package com.p0ntus.now_playing.dto.listenbrainz;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackMetadataDto(
		@JsonProperty("track_name") String trackName,
		@JsonProperty("artist_name") String artistName,
		@JsonProperty("release_name") String releaseName,
		@JsonProperty("mbid") String mbid,
		@JsonProperty("additional_info") AdditionalInfo additionalInfo) {

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record AdditionalInfo(
			@JsonProperty("recording_mbid") String recordingMbid,
			@JsonProperty("release_mbid") String releaseMbid,
			@JsonProperty("artist_mbids") List<String> artistMbids) {
	}
}
