package com.p0ntus.now_playing.connectors;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.p0ntus.now_playing.TestProperties;
import com.p0ntus.now_playing.config.ProviderProperties;
import com.p0ntus.now_playing.config.WebClientConfig;
import com.p0ntus.now_playing.exception.ProviderTimeoutException;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import reactor.test.StepVerifier;

/**
 * Unit tests for ListenBrainzClient against a MockWebServer.
 */
class ListenBrainzClientTest {

	private MockWebServer mockWebServer;
	private ListenBrainzClient listenBrainzClient;
	private String baseUrl;

	@BeforeEach
	void setUp() throws Exception {
		mockWebServer = new MockWebServer();
		mockWebServer.start();
		baseUrl = mockWebServer.url("/").toString().replaceAll("/$", "");

		ProviderProperties providers = TestProperties.providers(baseUrl);
		WebClient webClient = new WebClientConfig().listenBrainzWebClient(providers, TestProperties.settings());
		listenBrainzClient = new ListenBrainzClient(webClient, providers, TestProperties.settings());
	}

	@AfterEach
	void tearDown() throws Exception {
		mockWebServer.shutdown();
	}

	@Test
	void getPlayingNow_Success_ParsesFirstListen() throws Exception {
		// Arrange
		String jsonResponse = """
				{
					"payload": {
						"count": 1,
						"user_id": "test-user",
						"playing_now": true,
						"listens": [{
							"playing_now": true,
							"track_metadata": {
								"artist_name": "Daft Punk",
								"track_name": "Get Lucky",
								"release_name": "Random Access Memories",
								"additional_info": {
									"recording_mbid": "rec-1",
									"release_mbid": "rel-1",
									"artist_mbids": ["art-1"]
								}
							}
						}]
					}
				}
				""";
		mockWebServer.enqueue(new MockResponse()
				.setResponseCode(200)
				.setBody(jsonResponse)
				.addHeader("Content-Type", "application/json"));

		// Act & Assert
		StepVerifier.create(listenBrainzClient.getPlayingNow())
				.assertNext(playingNow -> {
					assertThat(playingNow.payload().count()).isEqualTo(1);
					assertThat(playingNow.currentTrack().trackName()).isEqualTo("Get Lucky");
					assertThat(playingNow.currentTrack().artistName()).isEqualTo("Daft Punk");
					assertThat(playingNow.currentTrack().additionalInfo().releaseMbid()).isEqualTo("rel-1");
					assertThat(playingNow.currentTrack().additionalInfo().artistMbids()).containsExactly("art-1");
				})
				.verifyComplete();

		RecordedRequest request = mockWebServer.takeRequest();
		assertThat(request.getPath()).isEqualTo("/1/user/test-user/playing-now");
		assertThat(request.getHeader("Authorization")).isEqualTo("Token lb-token");
	}

	@Test
	void getPlayingNow_NothingPlaying_HasNoCurrentTrack() {
		// Arrange
		mockWebServer.enqueue(new MockResponse()
				.setResponseCode(200)
				.setBody("{\"payload\": {\"count\": 0, \"listens\": []}}")
				.addHeader("Content-Type", "application/json"));

		// Act & Assert
		StepVerifier.create(listenBrainzClient.getPlayingNow())
				.assertNext(playingNow -> assertThat(playingNow.currentTrack()).isNull())
				.verifyComplete();
	}

	@Test
	void getPlayingNow_ServerError_ThrowsProviderUnavailable() {
		// Arrange
		mockWebServer.enqueue(new MockResponse()
				.setResponseCode(503)
				.setBody("Service Unavailable"));

		// Act & Assert
		StepVerifier.create(listenBrainzClient.getPlayingNow())
				.expectErrorMatches(error ->
					error instanceof ProviderUnavailableException unavailable &&
					unavailable.getStatusCode() == 503 &&
					unavailable.getMessage().equals("ListenBrainz error: 503"))
				.verify();
	}

	@Test
	void getPlayingNow_MalformedBody_ThrowsProviderUnavailable() {
		// Arrange
		mockWebServer.enqueue(new MockResponse()
				.setResponseCode(200)
				.setBody("{\"payload\": [")
				.addHeader("Content-Type", "application/json"));

		// Act & Assert
		StepVerifier.create(listenBrainzClient.getPlayingNow())
				.expectError(ProviderUnavailableException.class)
				.verify();
	}

	@Test
	void getPlayingNow_SlowResponse_ThrowsProviderTimeout() {
		// Arrange: plain WebClient so only the per-call deadline can fire
		ProviderProperties providers = TestProperties.providers(baseUrl);
		ListenBrainzClient impatientClient = new ListenBrainzClient(
				WebClient.builder().baseUrl(baseUrl).build(),
				providers,
				TestProperties.settings(Duration.ofMillis(200)));
		mockWebServer.enqueue(new MockResponse()
				.setResponseCode(200)
				.setHeadersDelay(2, TimeUnit.SECONDS)
				.setBody("{\"payload\": {\"count\": 0}}"));

		// Act & Assert
		StepVerifier.create(impatientClient.getPlayingNow())
				.expectError(ProviderTimeoutException.class)
				.verify(Duration.ofSeconds(5));
	}
}
