/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

/**
 * Snapshot of a monitored operation at one observation instant.
 *
 * @param <T> the type of the terminal payload
 * @param completed whether the operation has finished
 * @param payload the terminal value, only present when {@code completed} is true
 */
public record StatusResult<T>(boolean completed, T payload) {

	public StatusResult {
		if (!completed && payload != null) {
			throw new IllegalArgumentException("An incomplete status result must not carry a payload");
		}
	}

	public static <T> StatusResult<T> completed(T payload) {
		return new StatusResult<>(true, payload);
	}

	public static <T> StatusResult<T> incomplete() {
		return new StatusResult<>(false, null);
	}

}
