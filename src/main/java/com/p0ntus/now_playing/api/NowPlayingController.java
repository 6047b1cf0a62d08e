package com.p0ntus.now_playing.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.dto.AggregationStatus;
import com.p0ntus.now_playing.exception.RateLimitExceededException;
import com.p0ntus.now_playing.service.NowPlayingService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/now-playing")
@Tag(name = "Now Playing", description = "Currently playing track snapshot")
public class NowPlayingController {

	private final NowPlayingService nowPlayingService;

	public NowPlayingController(NowPlayingService nowPlayingService) {
		this.nowPlayingService = nowPlayingService;
	}

	@Operation(
			summary = "Get the currently playing track",
			description = "Returns the terminal result of one aggregation: ListenBrainz listen, Last.fm " +
					"metadata and cover art. Results are cached for 20 seconds and shared with WebSocket clients.")
	@ApiResponses(value = {
			@ApiResponse(
					responseCode = "200",
					description = "Aggregation complete (possibly with nothing playing)",
					content = @Content(schema = @Schema(implementation = AggregationResult.class))),
			@ApiResponse(
					responseCode = "429",
					description = "Too many requests - rate limit exceeded (100 requests per minute)",
					content = @Content),
			@ApiResponse(
					responseCode = "503",
					description = "History provider unavailable",
					content = @Content(schema = @Schema(implementation = AggregationResult.class))),
			@ApiResponse(
					responseCode = "500",
					description = "Internal server error",
					content = @Content)
	})
	@GetMapping
	public Mono<ResponseEntity<AggregationResult>> getNowPlaying() {
		return nowPlayingService.snapshot()
				.map(result -> result.status() == AggregationStatus.ERROR
						? ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result)
						: ResponseEntity.ok(result))
				.onErrorResume(RateLimitExceededException.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
							.body(AggregationResult.error(ex.getMessage()))))
				.onErrorResume(Exception.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
							.body((AggregationResult) null)));
	}
}
