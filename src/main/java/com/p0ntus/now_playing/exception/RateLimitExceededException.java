package com.p0ntus.now_playing.exception;

/**
 * Thrown when a caller exceeds its refresh quota. Providers are never contacted for a
 * rejected request.
 */
public class RateLimitExceededException extends RuntimeException {

	public RateLimitExceededException(String message) {
		super(message);
	}
}
