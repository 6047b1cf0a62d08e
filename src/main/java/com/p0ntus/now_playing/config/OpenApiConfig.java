package com.p0ntus.now_playing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfig {

	@Bean
	public OpenAPI nowPlayingOpenAPI() {
		return new OpenAPI()
				.info(new Info()
						.title("Now Playing API")
						.description("Aggregates the currently playing track from ListenBrainz with Last.fm " +
								"metadata and Cover Art Archive artwork. Live updates are pushed over the " +
								"WebSocket endpoint /ws/now-playing; this API exposes a one-shot snapshot.")
						.version("1.0.0"))
				.externalDocs(new ExternalDocumentation()
						.description("ListenBrainz playing-now API")
						.url("https://listenbrainz.readthedocs.io/en/latest/users/api/core.html"));
	}
}
