package com.p0ntus.now_playing.service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Per-connection refresh admission.
 *
 * A connection's first request opens a window with count 1; requests inside the window
 * are admitted until the limit is reached. Once the window has elapsed, the next request
 * opens a fresh window anchored at that request. Windows are dropped when the connection
 * closes; nothing carries over to a reconnect.
 */
public class ConnectionRateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionRateLimiter.class);

	private final int limit;
	private final long windowNanos;
	private final Ticker ticker;
	private final Cache<String, RateWindow> windows;

	/**
	 * Requests counted in the window opened at {@code openedAt} (ticker nanos).
	 */
	record RateWindow(int count, long openedAt) {
	}

	public ConnectionRateLimiter(int limit, Duration window) {
		this(limit, window, Ticker.systemTicker());
	}

	public ConnectionRateLimiter(int limit, Duration window, Ticker ticker) {
		this.limit = limit;
		this.windowNanos = window.toNanos();
		this.ticker = ticker;
		this.windows = Caffeine.newBuilder()
				.expireAfter(new WindowExpiry())
				.ticker(ticker)
				.build();
	}

	/**
	 * @return true when the request fits in the connection's current window
	 */
	public boolean admit(String connectionId) {
		AtomicBoolean permitted = new AtomicBoolean();
		windows.asMap().compute(connectionId, (id, current) -> {
			long now = ticker.read();
			if (current == null || now - current.openedAt() >= windowNanos) {
				permitted.set(true);
				return new RateWindow(1, now);
			}
			if (current.count() >= limit) {
				return current;
			}
			permitted.set(true);
			return new RateWindow(current.count() + 1, current.openedAt());
		});
		if (!permitted.get()) {
			logger.debug("Rate limit reached for connection: {}", connectionId);
		}
		return permitted.get();
	}

	public void discard(String connectionId) {
		windows.invalidate(connectionId);
	}

	public long trackedConnections() {
		windows.cleanUp();
		return windows.estimatedSize();
	}

	// an entry lives until its window ends; counting inside the window never extends it
	private final class WindowExpiry implements Expiry<String, RateWindow> {

		@Override
		public long expireAfterCreate(String connectionId, RateWindow window, long currentTime) {
			return remaining(window, currentTime);
		}

		@Override
		public long expireAfterUpdate(String connectionId, RateWindow window, long currentTime,
				long currentDuration) {
			return remaining(window, currentTime);
		}

		@Override
		public long expireAfterRead(String connectionId, RateWindow window, long currentTime,
				long currentDuration) {
			return currentDuration;
		}

		private long remaining(RateWindow window, long currentTime) {
			return Math.max(0, window.openedAt() + windowNanos - currentTime);
		}
	}
}
