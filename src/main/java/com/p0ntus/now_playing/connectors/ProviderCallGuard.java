package com.p0ntus.now_playing.connectors;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.p0ntus.now_playing.exception.ProviderTimeoutException;
import com.p0ntus.now_playing.exception.ProviderUnavailableException;

import reactor.core.publisher.Mono;

/**
 * Applies the per-call deadline to a provider request and folds every failure into
 * {@link ProviderUnavailableException}.
 */
final class ProviderCallGuard {

	private ProviderCallGuard() {
	}

	static <T> Function<Mono<T>, Mono<T>> guard(String provider, Duration timeout) {
		return call -> call
				.timeout(timeout)
				.onErrorMap(error -> !(error instanceof ProviderUnavailableException),
						error -> translate(provider, timeout, error));
	}

	private static ProviderUnavailableException translate(String provider, Duration timeout, Throwable error) {
		if (error instanceof TimeoutException) {
			return new ProviderTimeoutException(provider, timeout, error);
		}
		if (error instanceof WebClientResponseException responseError) {
			int status = responseError.getStatusCode().value();
			return new ProviderUnavailableException(provider, status, provider + " error: " + status, error);
		}
		if (error instanceof WebClientRequestException) {
			return new ProviderUnavailableException(provider, provider + " unreachable: " + error.getMessage(), error);
		}
		if (error instanceof CodecException) {
			return new ProviderUnavailableException(provider, provider + " returned an unreadable response", error);
		}
		return new ProviderUnavailableException(provider, provider + " request failed: " + error.getMessage(), error);
	}
}
