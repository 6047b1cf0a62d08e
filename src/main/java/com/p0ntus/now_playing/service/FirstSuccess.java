package com.p0ntus.now_playing.service;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * "Try, fall through on failure" combinators over independent asynchronous lookups.
 * A failed or empty lookup never fails the combination; it only yields no value.
 */
public final class FirstSuccess {

	private FirstSuccess() {
	}

	/**
	 * Subscribes to all candidates at once and emits the first value accepted by
	 * {@code usable}. A failing candidate neither cancels nor delays the others; the
	 * remaining ones are cancelled once a winner is found.
	 *
	 * @return Mono with the winning value, empty when every candidate fails or is unusable
	 */
	public static <T> Mono<T> race(List<Mono<T>> candidates, Predicate<? super T> usable) {
		return Flux.merge(candidates.stream()
						.map(candidate -> candidate.onErrorResume(ex -> Mono.empty()))
						.toList())
				.filter(usable)
				.next();
	}

	/**
	 * Tries the steps one after another, subscribing to the next only when the previous
	 * one failed or completed empty.
	 *
	 * @return Mono with the first produced value, empty when every step falls through
	 */
	public static <T> Mono<T> sequence(List<Supplier<Mono<T>>> steps) {
		return Flux.fromIterable(steps)
				.concatMap(step -> Mono.defer(step).onErrorResume(ex -> Mono.empty()), 1)
				.next();
	}
}
