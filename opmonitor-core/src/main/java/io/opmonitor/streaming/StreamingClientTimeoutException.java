/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import io.opmonitor.StatusMonitorException;
import io.opmonitor.util.TimeValue;

/**
 * A streaming handshake or subscription did not finish in time.
 */
public class StreamingClientTimeoutException extends StatusMonitorException {

	private static final long serialVersionUID = 1L;

	public static final String HANDSHAKE_TIMEOUT = "HandshakeTimeout";

	public static final String SUBSCRIBE_TIMEOUT = "GenericTimeoutError";

	private final transient TimeValue timeout;

	private StreamingClientTimeoutException(String name, String message, TimeValue timeout) {
		super(name, message);
		this.timeout = timeout;
	}

	public static StreamingClientTimeoutException handshake(TimeValue timeout) {
		return new StreamingClientTimeoutException(HANDSHAKE_TIMEOUT,
				"The streaming handshake did not complete within " + timeout, timeout);
	}

	public static StreamingClientTimeoutException subscribe(String channel, TimeValue timeout) {
		return new StreamingClientTimeoutException(SUBSCRIBE_TIMEOUT,
				"No terminal result was received on " + channel + " within " + timeout, timeout);
	}

	public TimeValue getTimeout() {
		return this.timeout;
	}

}
