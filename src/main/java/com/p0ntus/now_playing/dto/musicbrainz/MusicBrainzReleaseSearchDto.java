package com.p0ntus.now_playing.dto.musicbrainz;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of MusicBrainz {@code /ws/2/release/?query=...&fmt=json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MusicBrainzReleaseSearchDto(
		@JsonProperty("count") Integer count,
		@JsonProperty("releases") List<Release> releases) {

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Release(
			@JsonProperty("id") String id,
			@JsonProperty("title") String title,
			@JsonProperty("score") Integer score) {
	}

	public String firstReleaseId() {
		if (releases == null || releases.isEmpty()) {
			return null;
		}
		return releases.get(0).id();
	}
}
