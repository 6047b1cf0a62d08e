package com.p0ntus.now_playing.client;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.p0ntus.now_playing.dto.AggregationResult;
import com.p0ntus.now_playing.websocket.SocketFrame;
import com.p0ntus.now_playing.websocket.SocketFrameCodec;

import io.netty.channel.ChannelOption;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

/**
 * Client side of the now-playing session protocol.
 *
 * Keeps one connection open and reconnects with capped exponential backoff after it is
 * lost or an attempt fails. Requests made while disconnected are dropped, never queued:
 * callers should issue a fresh refresh after observing a live signal.
 */
public class NowPlayingSocketClient {

	private static final Logger logger = LoggerFactory.getLogger(NowPlayingSocketClient.class);

	private static final Duration EMIT_RETRY = Duration.ofMillis(250);

	private final WebSocketClient webSocketClient;
	private final URI uri;
	private final ReconnectProperties reconnect;
	private final SocketFrameCodec codec;
	private final Scheduler scheduler;

	private final Sinks.Many<ConnectionEvent> events = Sinks.many().multicast().directBestEffort();
	private final Sinks.Many<AggregationResult> statusUpdates = Sinks.many().multicast().directBestEffort();
	private final AtomicReference<Sinks.Many<String>> outbound = new AtomicReference<>();
	private final AtomicBoolean live = new AtomicBoolean();
	private final AtomicInteger failedAttempts = new AtomicInteger();
	private final Disposable.Swap connection = Disposables.swap();
	private final Disposable.Swap retryTimer = Disposables.swap();
	private volatile boolean running;

	public NowPlayingSocketClient(WebSocketClient webSocketClient, URI uri, ReconnectProperties reconnect,
			SocketFrameCodec codec, Scheduler scheduler) {
		this.webSocketClient = webSocketClient;
		this.uri = uri;
		this.reconnect = reconnect;
		this.codec = codec;
		this.scheduler = scheduler;
	}

	/**
	 * Client on Reactor Netty with the given policy; nothing is opened until {@link #connect()}.
	 */
	public static NowPlayingSocketClient create(URI uri, ReconnectProperties reconnect, ObjectMapper objectMapper) {
		HttpClient httpClient = HttpClient.create()
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) reconnect.connectTimeout().toMillis());
		return new NowPlayingSocketClient(new ReactorNettyWebSocketClient(httpClient), uri, reconnect,
				new SocketFrameCodec(objectMapper), Schedulers.parallel());
	}

	/**
	 * Opens the connection unless it is already open or being re-established.
	 */
	public void connect() {
		if (running) {
			return;
		}
		running = true;
		failedAttempts.set(0);
		open();
	}

	/**
	 * Closes the connection on purpose. No reconnection follows.
	 */
	public void disconnect() {
		running = false;
		retryTimer.update(Disposables.disposed());
		connection.update(Disposables.disposed());
		Sinks.Many<String> queue = outbound.getAndSet(null);
		if (queue != null) {
			queue.tryEmitComplete();
		}
		if (live.getAndSet(false)) {
			publish(ConnectionEvent.of(ConnectionEvent.Type.DISCONNECT));
		}
	}

	/**
	 * Stops for good and completes the event streams.
	 */
	public void close() {
		disconnect();
		connection.dispose();
		retryTimer.dispose();
		events.tryEmitComplete();
		statusUpdates.tryEmitComplete();
	}

	/**
	 * @return false when the request was dropped because the client is not connected
	 */
	public boolean requestRefresh() {
		return send(SocketFrame.REQUEST_REFRESH);
	}

	/**
	 * @return false when the request was dropped because the client is not connected
	 */
	public boolean startAutoRefresh() {
		return send(SocketFrame.START_AUTO_REFRESH);
	}

	public boolean isLive() {
		return live.get();
	}

	public Flux<ConnectionEvent> events() {
		return events.asFlux();
	}

	/**
	 * Current live state followed by every change of it.
	 */
	public Flux<Boolean> liveness() {
		return Flux.concat(Mono.fromSupplier(live::get), events().map(event -> event.type().isLive()))
				.distinctUntilChanged();
	}

	public Flux<AggregationResult> statusUpdates() {
		return statusUpdates.asFlux();
	}

	private void open() {
		Sinks.Many<String> queue = Sinks.many().unicast().onBackpressureBuffer();
		Disposable attempt = webSocketClient.execute(uri, session -> exchange(session, queue))
				.subscribe(
						ignored -> {
						},
						error -> onConnectionLost(queue, error),
						() -> onConnectionLost(queue, null));
		connection.update(attempt);
	}

	private Mono<Void> exchange(WebSocketSession session, Sinks.Many<String> queue) {
		onOpen(queue);
		Mono<Void> send = session.send(queue.asFlux().map(session::textMessage));
		Mono<Void> receive = session.receive()
				.filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
				.map(WebSocketMessage::getPayloadAsText)
				.doOnNext(this::onText)
				.doFinally(signalType -> queue.tryEmitComplete())
				.then();
		return Mono.when(send, receive);
	}

	private void onOpen(Sinks.Many<String> queue) {
		outbound.set(queue);
		live.set(true);
		int attempts = failedAttempts.getAndSet(0);
		logger.info("Connected to {}", uri);
		if (attempts > 0) {
			publish(new ConnectionEvent(ConnectionEvent.Type.RECONNECT, attempts));
		}
		publish(ConnectionEvent.of(ConnectionEvent.Type.CONNECT));
	}

	private void onText(String text) {
		codec.decode(text)
				.filter(frame -> SocketFrame.STATUS_UPDATE.equals(frame.event()) && frame.data() != null)
				.ifPresent(frame -> statusUpdates.emitNext(frame.data(),
						Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY)));
	}

	private void onConnectionLost(Sinks.Many<String> queue, Throwable error) {
		outbound.compareAndSet(queue, null);
		queue.tryEmitComplete();
		if (live.getAndSet(false)) {
			publish(ConnectionEvent.of(ConnectionEvent.Type.DISCONNECT));
		}
		if (error != null) {
			logger.warn("Connection to {} failed: {}", uri, error.getMessage());
		} else {
			logger.info("Connection to {} closed", uri);
		}
		if (running) {
			scheduleReconnect();
		}
	}

	private void scheduleReconnect() {
		int attempt = failedAttempts.incrementAndGet();
		if (attempt > reconnect.attempts()) {
			running = false;
			logger.warn("Giving up on {} after {} reconnection attempts", uri, reconnect.attempts());
			publish(new ConnectionEvent(ConnectionEvent.Type.RECONNECT_FAILED, reconnect.attempts()));
			return;
		}
		Duration delay = backoff(attempt);
		logger.debug("Reconnecting to {} in {}ms (attempt {})", uri, delay.toMillis(), attempt);
		retryTimer.update(Mono.delay(delay, scheduler).subscribe(tick -> {
			if (running) {
				publish(new ConnectionEvent(ConnectionEvent.Type.RECONNECT_ATTEMPT, attempt));
				open();
			}
		}));
	}

	/**
	 * delay * 2^(attempt - 1), jittered by the randomization factor and capped at maxDelay.
	 */
	Duration backoff(int attempt) {
		long base = reconnect.delay().toMillis() << Math.min(attempt - 1, 30);
		long capped = Math.min(Math.max(base, 0), reconnect.maxDelay().toMillis());
		double factor = reconnect.randomizationFactor();
		if (factor > 0) {
			double deviation = ThreadLocalRandom.current().nextDouble() * factor * capped;
			capped = ThreadLocalRandom.current().nextBoolean() ? capped - (long) deviation : capped + (long) deviation;
		}
		return Duration.ofMillis(Math.min(capped, reconnect.maxDelay().toMillis()));
	}

	private boolean send(String event) {
		Sinks.Many<String> queue = outbound.get();
		if (queue == null || !live.get()) {
			logger.debug("Dropping {} while disconnected", event);
			return false;
		}
		return queue.tryEmitNext(codec.encode(SocketFrame.request(event))).isSuccess();
	}

	private void publish(ConnectionEvent event) {
		logger.debug("Connection event: {}", event.type().eventName());
		events.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
	}
}
