package com.p0ntus.now_playing.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import com.p0ntus.now_playing.dto.lastfm.LastFmTrackInfoDto;

/**
 * One status update pushed to clients. Every push is a new value; absent fields are
 * left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregationResult(
		@JsonProperty("status") AggregationStatus status,
		@JsonProperty("track_name") String trackName,
		@JsonProperty("artist_name") String artistName,
		@JsonProperty("release_name") String releaseName,
		@JsonProperty("mbid") String mbid,
		@JsonProperty("coverArt") String coverArt,
		@JsonProperty("enrichment") LastFmTrackInfoDto enrichment,
		@JsonProperty("message") String message) {

	public static final String NOTHING_PLAYING_MESSAGE = "No track currently playing";

	public static AggregationResult loading(String message) {
		return new AggregationResult(AggregationStatus.LOADING, null, null, null, null, null, null, message);
	}

	public static AggregationResult partial(TrackIdentity track, String message) {
		return new AggregationResult(AggregationStatus.PARTIAL,
				track.trackName(), track.artistName(), track.releaseName(), track.displayMbid(),
				null, null, message);
	}

	public static AggregationResult complete(TrackIdentity track, String coverArt, LastFmTrackInfoDto enrichment) {
		return new AggregationResult(AggregationStatus.COMPLETE,
				track.trackName(), track.artistName(), track.releaseName(), track.displayMbid(),
				coverArt, enrichment, "Complete");
	}

	public static AggregationResult nothingPlaying() {
		return new AggregationResult(AggregationStatus.COMPLETE, null, null, null, null, null, null,
				NOTHING_PLAYING_MESSAGE);
	}

	public static AggregationResult error(String message) {
		return new AggregationResult(AggregationStatus.ERROR, null, null, null, null, null, null, message);
	}

	@JsonIgnore
	public boolean isTerminal() {
		return status != null && status.isTerminal();
	}

	@JsonIgnore
	public boolean isCacheable() {
		return status == AggregationStatus.COMPLETE;
	}
}
