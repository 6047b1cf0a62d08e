package com.p0ntus.now_playing.client;

import java.time.Duration;

/**
 * Reconnection policy of {@link NowPlayingSocketClient}.
 *
 * @param attempts            consecutive failed attempts before giving up
 * @param delay               delay before the first attempt, doubled for each following one
 * @param maxDelay            upper bound for any delay
 * @param randomizationFactor jitter applied to each delay, 0 for none
 * @param connectTimeout      TCP connect timeout of one attempt
 */
public record ReconnectProperties(
		int attempts,
		Duration delay,
		Duration maxDelay,
		double randomizationFactor,
		Duration connectTimeout) {

	public static ReconnectProperties defaults() {
		return new ReconnectProperties(5, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.5, Duration.ofSeconds(20));
	}
}
