package com.p0ntus.now_playing.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.p0ntus.now_playing.websocket.NowPlayingWebSocketHandler;
import com.p0ntus.now_playing.websocket.SocketFrameCodec;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class WebSocketConfig {

	public static final String NOW_PLAYING_PATH = "/ws/now-playing";

	@Bean
	public HandlerMapping nowPlayingHandlerMapping(NowPlayingWebSocketHandler handler) {
		return new SimpleUrlHandlerMapping(Map.of(NOW_PLAYING_PATH, handler), Ordered.HIGHEST_PRECEDENCE);
	}

	@Bean
	public SocketFrameCodec socketFrameCodec(ObjectMapper objectMapper) {
		return new SocketFrameCodec(objectMapper);
	}

	/**
	 * Drives auto-refresh timers and heartbeats. The shared parallel scheduler is owned by
	 * Reactor, so the context must not dispose it.
	 */
	@Bean(destroyMethod = "")
	public Scheduler sessionTimerScheduler() {
		return Schedulers.parallel();
	}
}
