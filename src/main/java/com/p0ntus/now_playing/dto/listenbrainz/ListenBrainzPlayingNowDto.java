package com.p0ntus.now_playing.dto.listenbrainz;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of ListenBrainz {@code /1/user/{user}/playing-now}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListenBrainzPlayingNowDto(
		@JsonProperty("payload") Payload payload) {

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Payload(
			@JsonProperty("count") Integer count,
			@JsonProperty("user_id") String userId,
			@JsonProperty("playing_now") Boolean playingNow,
			@JsonProperty("listens") List<Listen> listens) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Listen(
			@JsonProperty("playing_now") Boolean playingNow,
			@JsonProperty("track_metadata") TrackMetadataDto trackMetadata) {
	}

	/**
	 * Returns the metadata of the first listen, or null when nothing is playing.
	 */
	public TrackMetadataDto currentTrack() {
		if (payload == null || payload.count() == null || payload.count() == 0) {
			return null;
		}
		List<Listen> listens = payload.listens();
		if (listens == null || listens.isEmpty()) {
			return null;
		}
		return listens.get(0).trackMetadata();
	}
}
