/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opmonitor.status.StatusResult;
import io.opmonitor.util.Assert;

/**
 * Factory methods for stream processors.
 */
public final class StreamProcessors {

	private StreamProcessors() {
	}

	/**
	 * Adapts a processor working on a typed view of each message. Messages are converted
	 * with {@link ObjectMapper#convertValue(Object, Class)}; a message that cannot be
	 * converted fails the subscription with Jackson's {@link IllegalArgumentException}.
	 * @param <M> the message view type
	 * @param <T> the type of the terminal payload
	 * @param messageType the message view type
	 * @param mapper the mapper performing the conversion
	 * @param processor the typed processor
	 * @return a processor accepting raw messages
	 */
	public static <M, T> Function<Map<String, Object>, StatusResult<T>> typed(Class<M> messageType,
			ObjectMapper mapper, Function<M, StatusResult<T>> processor) {
		Assert.notNull(messageType, "messageType must not be null");
		Assert.notNull(mapper, "mapper must not be null");
		Assert.notNull(processor, "processor must not be null");
		return message -> processor.apply(mapper.convertValue(message, messageType));
	}

	/**
	 * A processor completing on the first message and returning it as the payload.
	 * @return a processor completing on the first message
	 */
	public static Function<Map<String, Object>, StatusResult<Map<String, Object>>> firstMessage() {
		return StatusResult::completed;
	}

}
