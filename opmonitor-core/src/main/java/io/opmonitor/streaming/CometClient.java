/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.Map;
import java.util.function.Consumer;

import reactor.core.publisher.Mono;

/**
 * Contract of the push transport consumed by {@link SubscriptionChannel}.
 *
 * <p>
 * Implementations own connection negotiation, serialization and authentication. The
 * lifecycle is handshake, subscribe, deliver or fail, then disconnect. Callbacks must
 * not be invoked on the caller's stack: a handshake callback or a message delivery
 * always happens after the call that requested it returned.
 */
public interface CometClient {

	/**
	 * Registers an extension applied to outgoing messages.
	 * @param extension the extension
	 */
	void addExtension(CometExtension extension);

	/**
	 * Disables a transport feature by label, e.g. {@code "websocket"}.
	 * @param label the feature label
	 */
	void disable(String label);

	/**
	 * Sets a header sent with every transport request.
	 * @param name the header name
	 * @param value the header value
	 */
	void setHeader(String name, String value);

	/**
	 * Negotiates the connection and then invokes {@code callback} once.
	 * @param callback invoked when the handshake succeeded
	 */
	void handshake(Runnable callback);

	/**
	 * Subscribes to a channel.
	 * @param channel the channel name
	 * @param onMessage invoked once per delivered message, in delivery order
	 * @return the subscription handle
	 */
	CometSubscription subscribe(String channel, Consumer<Map<String, Object>> onMessage);

	/**
	 * Closes the connection. Safe to call repeatedly.
	 * @return a Mono completing when disconnected
	 */
	Mono<Void> disconnect();

}
