package com.p0ntus.now_playing.websocket;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p0ntus.now_playing.dto.AggregationResult;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Server-side state of one client connection. Owns the connection's outbound queue,
 * its auto-refresh timer and the refresh streams being forwarded to it; all of them are
 * released by {@link #close()}.
 */
public class Session {

	private static final Logger logger = LoggerFactory.getLogger(Session.class);

	private static final Duration EMIT_RETRY = Duration.ofMillis(250);

	private final String id;
	private final Sinks.Many<AggregationResult> outbound = Sinks.many().unicast().onBackpressureBuffer();
	private final Sinks.Empty<Void> closed = Sinks.empty();
	private final Disposable.Swap autoRefresh = Disposables.swap();
	private final Disposable.Composite refreshes = Disposables.composite();

	public Session(String id) {
		this.id = id;
	}

	public String getId() {
		return id;
	}

	/**
	 * Updates queued for this connection, in emission order.
	 */
	public Flux<AggregationResult> updates() {
		return outbound.asFlux();
	}

	/**
	 * Completes when the session is closed.
	 */
	public Mono<Void> onClose() {
		return closed.asMono();
	}

	public void emit(AggregationResult result) {
		outbound.emitNext(result, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
	}

	/**
	 * Forwards every result of {@code results} to this connection until the stream ends
	 * or the session closes. Closing stops the forwarding only; the producer is not told.
	 */
	public void forward(Flux<AggregationResult> results) {
		Disposable.Swap subscription = Disposables.swap();
		if (!refreshes.add(subscription)) {
			return;
		}
		subscription.update(results
				.doFinally(signalType -> refreshes.remove(subscription))
				.subscribe(this::emit,
						error -> logger.error("Refresh stream failed for session: {}", id, error)));
	}

	/**
	 * Installs a new auto-refresh timer, disposing the one it supersedes.
	 */
	public void replaceAutoRefresh(Disposable timer) {
		if (isClosed()) {
			timer.dispose();
			return;
		}
		autoRefresh.update(timer);
	}

	public boolean hasAutoRefresh() {
		Disposable current = autoRefresh.get();
		return current != null && !current.isDisposed();
	}

	public boolean isClosed() {
		return refreshes.isDisposed();
	}

	public void close() {
		autoRefresh.dispose();
		refreshes.dispose();
		outbound.tryEmitComplete();
		closed.tryEmitEmpty();
	}
}
