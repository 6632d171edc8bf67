/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

/**
 * State reported by a successful {@link SubscriptionChannel#handshake()}.
 */
public enum ConnectionState {

	CONNECTED

}
