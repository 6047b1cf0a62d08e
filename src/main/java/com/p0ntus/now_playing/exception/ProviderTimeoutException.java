package com.p0ntus.now_playing.exception;

import java.time.Duration;

/**
 * A provider call exceeded its deadline. Handled exactly like any other unavailability.
 */
public class ProviderTimeoutException extends ProviderUnavailableException {

	public ProviderTimeoutException(String provider, Duration timeout, Throwable cause) {
		super(provider, provider + " request timed out after " + timeout.toMillis() + "ms", cause);
	}
}
