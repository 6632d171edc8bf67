/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.Map;

/**
 * Hook applied by the transport to every outgoing message.
 */
@FunctionalInterface
public interface CometExtension {

	/**
	 * Returns the message to send in place of {@code message}.
	 * @param message an outgoing transport message
	 * @return the message to send
	 */
	Map<String, Object> outgoing(Map<String, Object> message);

}
