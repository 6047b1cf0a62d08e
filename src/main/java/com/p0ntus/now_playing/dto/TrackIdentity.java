package com.p0ntus.now_playing.dto;

import java.util.List;

/**
 * The track as reported by the history provider. Used as the join key for the
 * enrichment and artwork lookups.
 */
public record TrackIdentity(
		String trackName,
		String artistName,
		String releaseName,
		String recordingMbid,
		String releaseMbid,
		String fallbackMbid,
		List<String> artistMbids) {

	public TrackIdentity {
		artistMbids = artistMbids == null ? List.of() : List.copyOf(artistMbids);
	}

	public boolean hasRecordingMbid() {
		return isPresent(recordingMbid);
	}

	public boolean hasReleaseMbid() {
		return isPresent(releaseMbid);
	}

	public boolean hasReleaseName() {
		return isPresent(releaseName) && isPresent(artistName);
	}

	/**
	 * The identifier clients display: release MBID first, then the listen's own MBID.
	 */
	public String displayMbid() {
		return hasReleaseMbid() ? releaseMbid : fallbackMbid;
	}

	private static boolean isPresent(String value) {
		return value != null && !value.isBlank();
	}
}
