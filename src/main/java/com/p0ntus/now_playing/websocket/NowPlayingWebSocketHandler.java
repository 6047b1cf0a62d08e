package com.p0ntus.now_playing.websocket;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.p0ntus.now_playing.config.NowPlayingProperties;
import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.service.NowPlayingService;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Push server for now-playing updates.
 *
 * Each connection gets a {@link Session}. Refresh requests go through the connection's
 * rate limit to the aggregator and every resulting update is sent back to that
 * connection only. The server pings every heartbeat interval and drops connections
 * that stay silent for the heartbeat timeout.
 */
@Component
public class NowPlayingWebSocketHandler implements WebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(NowPlayingWebSocketHandler.class);

	static final String UNEXPECTED_FAILURE_MESSAGE = "Failed to fetch now playing data";

	private final NowPlayingService nowPlayingService;
	private final SessionRegistry sessionRegistry;
	private final SocketFrameCodec codec;
	private final Scheduler timerScheduler;
	private final Duration autoRefreshInterval;
	private final Duration heartbeatInterval;
	private final Duration heartbeatTimeout;

	public NowPlayingWebSocketHandler(
			NowPlayingService nowPlayingService,
			SessionRegistry sessionRegistry,
			SocketFrameCodec codec,
			@Qualifier("sessionTimerScheduler") Scheduler timerScheduler,
			NowPlayingProperties settings) {
		this.nowPlayingService = nowPlayingService;
		this.sessionRegistry = sessionRegistry;
		this.codec = codec;
		this.timerScheduler = timerScheduler;
		this.autoRefreshInterval = settings.autoRefreshInterval();
		this.heartbeatInterval = settings.heartbeat().interval();
		this.heartbeatTimeout = settings.heartbeat().timeout();
	}

	@Override
	public Mono<Void> handle(WebSocketSession webSocketSession) {
		String connectionId = webSocketSession.getId();
		Session session = connect(connectionId);

		Flux<WebSocketMessage> updates = session.updates()
				.map(result -> webSocketSession.textMessage(codec.encode(SocketFrame.statusUpdate(result))));

		Flux<WebSocketMessage> heartbeats = Flux.interval(heartbeatInterval, heartbeatInterval, timerScheduler)
				.map(tick -> webSocketSession.pingMessage(factory -> factory.wrap(new byte[0])))
				.takeUntilOther(session.onClose());

		Mono<Void> outbound = webSocketSession.send(Flux.merge(updates, heartbeats));

		Mono<Void> inbound = webSocketSession.receive()
				.timeout(heartbeatTimeout, timerScheduler)
				.doOnNext(message -> {
					if (message.getType() == WebSocketMessage.Type.TEXT) {
						onFrame(session, message.getPayloadAsText());
					}
				})
				.onErrorResume(TimeoutException.class, ex -> {
					logger.info("No traffic from client {} for {}s, closing connection",
							connectionId, heartbeatTimeout.toSeconds());
					return Mono.empty();
				})
				.doFinally(signalType -> disconnect(connectionId))
				.then();

		return Mono.when(inbound, outbound)
				.doFinally(signalType -> disconnect(connectionId));
	}

	Session connect(String connectionId) {
		Session session = sessionRegistry.open(connectionId);
		logger.info("Client connected: {}", connectionId);
		return session;
	}

	void disconnect(String connectionId) {
		if (sessionRegistry.close(connectionId)) {
			nowPlayingService.releaseConnection(connectionId);
			logger.info("Client disconnected: {}", connectionId);
		}
	}

	void onFrame(Session session, String text) {
		codec.decode(text).ifPresent(frame -> {
			switch (frame.event()) {
				case SocketFrame.REQUEST_REFRESH -> refresh(session);
				case SocketFrame.START_AUTO_REFRESH -> startAutoRefresh(session);
				default -> logger.debug("Ignoring unknown event '{}' from client {}", frame.event(), session.getId());
			}
		});
	}

	void refresh(Session session) {
		session.forward(nowPlayingService.refresh(session.getId())
				.onErrorResume(ex -> {
					logger.error("Refresh failed for client {}", session.getId(), ex);
					return Flux.just(AggregationResult.error(UNEXPECTED_FAILURE_MESSAGE));
				}));
	}

	/**
	 * Replaces the session's timer with one that refreshes every auto-refresh interval,
	 * first firing one interval from now.
	 */
	void startAutoRefresh(Session session) {
		Disposable timer = Flux.interval(autoRefreshInterval, autoRefreshInterval, timerScheduler)
				.subscribe(tick -> refresh(session));
		session.replaceAutoRefresh(timer);
		logger.debug("Auto-refresh every {}s enabled for client {}", autoRefreshInterval.toSeconds(), session.getId());
	}
}
