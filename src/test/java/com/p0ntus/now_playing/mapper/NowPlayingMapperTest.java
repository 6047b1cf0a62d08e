package com.p0ntus.now_playing.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p0ntus.now_playing.dto.TrackIdentity;
import com.p0ntus.now_playing.dto.lastfm.LastFmAlbumDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmImageDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackDto;
import com.p0ntus.now_playing.dto.lastfm.LastFmTrackInfoDto;
import com.p0ntus.now_playing.dto.listenbrainz.TrackMetadataDto;

class NowPlayingMapperTest {

	private NowPlayingMapper mapper;

	@BeforeEach
	void setUp() {
		mapper = new NowPlayingMapper();
	}

	@Test
	void selectCoverArt_PrefersExtraLargeOverLarge() {
		// Arrange
		LastFmTrackInfoDto info = trackAlbum(List.of(
				new LastFmImageDto("http://img/s.jpg", "small"),
				new LastFmImageDto("http://img/2.jpg", "large"),
				new LastFmImageDto("http://img/1.jpg", "extralarge")));

		// Act & Assert
		assertThat(mapper.selectCoverArt(info)).isEqualTo("http://img/1.jpg");
	}

	@Test
	void selectCoverArt_NoPreferredSize_UsesLastImage() {
		// Arrange
		LastFmTrackInfoDto info = trackAlbum(List.of(
				new LastFmImageDto("http://img/s.jpg", "small"),
				new LastFmImageDto("http://img/m.jpg", "medium")));

		// Act & Assert
		assertThat(mapper.selectCoverArt(info)).isEqualTo("http://img/m.jpg");
	}

	@Test
	void selectCoverArt_BlankUrlsIgnored() {
		// Arrange
		LastFmTrackInfoDto info = trackAlbum(List.of(
				new LastFmImageDto("http://img/l.jpg", "large"),
				new LastFmImageDto("", "extralarge"),
				new LastFmImageDto("  ", "mega")));

		// Act & Assert
		assertThat(mapper.selectCoverArt(info)).isEqualTo("http://img/l.jpg");
	}

	@Test
	void selectCoverArt_TopLevelAlbumWinsOverTrackAlbum() {
		// Arrange
		LastFmAlbumDto topLevel = album(List.of(new LastFmImageDto("http://img/top.jpg", "medium")));
		LastFmTrackDto track = new LastFmTrackDto("Song A", null, null, null, null, null, null,
				album(List.of(new LastFmImageDto("http://img/track.jpg", "extralarge"))));
		LastFmTrackInfoDto info = new LastFmTrackInfoDto(track, topLevel, null, null);

		// Act & Assert
		assertThat(mapper.selectCoverArt(info)).isEqualTo("http://img/top.jpg");
	}

	@Test
	void selectCoverArt_NoUsableImage_ReturnsNull() {
		assertThat(mapper.selectCoverArt(null)).isNull();
		assertThat(mapper.selectCoverArt(new LastFmTrackInfoDto(null, null, null, null))).isNull();
		assertThat(mapper.selectCoverArt(trackAlbum(List.of(new LastFmImageDto("", "large"))))).isNull();
	}

	@Test
	void toTrackIdentity_MapsAdditionalInfo() {
		// Arrange
		TrackMetadataDto metadata = new TrackMetadataDto("Song A", "Artist B", "Album C", "listen-mbid",
				new TrackMetadataDto.AdditionalInfo("rec-1", "abc", List.of("art-1")));

		// Act
		TrackIdentity track = mapper.toTrackIdentity(metadata);

		// Assert
		assertThat(track.trackName()).isEqualTo("Song A");
		assertThat(track.artistName()).isEqualTo("Artist B");
		assertThat(track.releaseName()).isEqualTo("Album C");
		assertThat(track.recordingMbid()).isEqualTo("rec-1");
		assertThat(track.releaseMbid()).isEqualTo("abc");
		assertThat(track.artistMbids()).containsExactly("art-1");
		assertThat(track.displayMbid()).isEqualTo("abc");
	}

	@Test
	void toTrackIdentity_WithoutAdditionalInfo_FallsBackToListenMbid() {
		// Arrange
		TrackMetadataDto metadata = new TrackMetadataDto("Song A", "Artist B", null, "listen-mbid", null);

		// Act
		TrackIdentity track = mapper.toTrackIdentity(metadata);

		// Assert
		assertThat(track.hasRecordingMbid()).isFalse();
		assertThat(track.hasReleaseMbid()).isFalse();
		assertThat(track.hasReleaseName()).isFalse();
		assertThat(track.artistMbids()).isEmpty();
		assertThat(track.displayMbid()).isEqualTo("listen-mbid");
	}

	private static LastFmTrackInfoDto trackAlbum(List<LastFmImageDto> images) {
		LastFmTrackDto track = new LastFmTrackDto("Song A", null, null, null, null, null, null, album(images));
		return new LastFmTrackInfoDto(track, null, null, null);
	}

	private static LastFmAlbumDto album(List<LastFmImageDto> images) {
		return new LastFmAlbumDto("Artist B", "Album C", null, null, images);
	}
}
