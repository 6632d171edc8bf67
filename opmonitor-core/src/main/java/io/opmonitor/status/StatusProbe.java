/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

import reactor.core.publisher.Mono;

/**
 * Caller supplied operation reporting the current status of a remote operation.
 *
 * <p>
 * The returned {@link Mono} must emit exactly one {@link StatusResult} or fail. A
 * failure ends the observation and is handed to the caller unchanged. The polling client
 * never has more than one probe outstanding.
 *
 * @param <T> the type of the terminal payload
 */
@FunctionalInterface
public interface StatusProbe<T> {

	/**
	 * Fetches the current status.
	 * @return a Mono emitting the status snapshot
	 */
	Mono<StatusResult<T>> poll();

}
