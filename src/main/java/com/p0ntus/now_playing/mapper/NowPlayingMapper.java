package com.p0ntus.now_playing.mapper;

import java.util.List;

import org.springframework.stereotype.Component;

import com.p0ntus.now_playing.dto.TrackIdentity;
import com.p0ntus.now_playing.dto.lastfm.LastFmAlbumDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmImageDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackInfoDto;
import com.p0ntus.now_playing.dto.listenbrainz.TrackMetadataDto;

/**
 * Maps provider responses to our internal track identity and artwork link.
 */
@Component
public class NowPlayingMapper {

	private static final List<String> PREFERRED_IMAGE_SIZES = List.of("extralarge", "large");

	public TrackIdentity toTrackIdentity(TrackMetadataDto metadata) {
		TrackMetadataDto.AdditionalInfo info = metadata.additionalInfo();
		return new TrackIdentity(
				metadata.trackName(),
				metadata.artistName(),
				metadata.releaseName(),
				info != null ? info.recordingMbid() : null,
				info != null ? info.releaseMbid() : null,
				metadata.mbid(),
				info != null ? info.artistMbids() : null);
	}

	/**
	 * Picks the artwork embedded in a Last.fm response.
	 * The top-level album wins over the track's album; within one image list
	 * extralarge beats large, and otherwise the last image with a URL is used.
	 *
	 * @return the image URL, or null when the response carries no usable image
	 */
	public String selectCoverArt(LastFmTrackInfoDto info) {
		if (info == null) {
			return null;
		}
		String fromAlbum = selectImage(info.album());
		if (fromAlbum != null) {
			return fromAlbum;
		}
		return info.track() != null ? selectImage(info.track().album()) : null;
	}

	private String selectImage(LastFmAlbumDto album) {
		if (album == null || album.image() == null) {
			return null;
		}
		List<LastFmImageDto> images = album.image().stream()
				.filter(LastFmImageDto::hasUrl)
				.toList();
		if (images.isEmpty()) {
			return null;
		}
		for (String size : PREFERRED_IMAGE_SIZES) {
			for (LastFmImageDto image : images) {
				if (size.equals(image.size())) {
					return image.url();
				}
			}
		}
		return images.get(images.size() - 1).url();
	}
}
