/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.util;

/**
 * Default values shared by the polling and streaming clients.
 *
 * <p>
 * Option builders fall back to these values only when asked to (see
 * {@code PollingOptions.defaults} and {@code ChannelOptions.defaults}); a plain builder
 * leaves missing values unset so that the client factories can report them.
 */
public final class MonitorDefaults {

	private MonitorDefaults() {
		// Utility class - no instantiation
	}

	/**
	 * Default interval between two status probes.
	 */
	public static final TimeValue DEFAULT_POLL_FREQUENCY = TimeValue.seconds(1);

	/**
	 * Default upper bound on the total time spent polling.
	 */
	public static final TimeValue DEFAULT_POLL_TIMEOUT = TimeValue.seconds(30);

	/**
	 * Default time allowed for the streaming handshake.
	 */
	public static final TimeValue DEFAULT_HANDSHAKE_TIMEOUT = TimeValue.seconds(30);

	/**
	 * Default time allowed for a streaming subscription to produce a terminal result.
	 */
	public static final TimeValue DEFAULT_SUBSCRIBE_TIMEOUT = TimeValue.minutes(3);

	/**
	 * Replay id asking the server for new events only.
	 */
	public static final long DEFAULT_REPLAY_ID = -1L;

	/**
	 * Replay id asking the server for all retained events.
	 */
	public static final long REPLAY_ALL_ID = -2L;

}
