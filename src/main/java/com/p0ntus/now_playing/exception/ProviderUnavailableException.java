package com.p0ntus.now_playing.exception;

/**
 * Exception thrown when an upstream provider cannot answer
 * (non-success HTTP status, network failure, unreadable body).
 */
public class ProviderUnavailableException extends RuntimeException {

	private final String provider;
	private final Integer statusCode;

	public ProviderUnavailableException(String provider, Integer statusCode, String message, Throwable cause) {
		super(message, cause);
		this.provider = provider;
		this.statusCode = statusCode;
	}

	public ProviderUnavailableException(String provider, String message, Throwable cause) {
		this(provider, null, message, cause);
	}

	public String getProvider() {
		return provider;
	}

	/**
	 * HTTP status reported by the provider, or null when the call never got a response.
	 */
	public Integer getStatusCode() {
		return statusCode;
	}
}
