/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.function.Consumer;

import reactor.core.publisher.Mono;

/**
 * Handle of one subscription to a streaming channel.
 *
 * <p>
 * The handle is returned synchronously by {@link CometClient#subscribe}; its terminal
 * {@link SubscriptionEvent} arrives later. Listeners registered after the event fired
 * still receive it.
 */
public interface CometSubscription {

	/**
	 * Returns a Mono emitting the single terminal event of this subscription.
	 * @return the terminal event
	 */
	Mono<SubscriptionEvent> event();

	/**
	 * Registers a listener for the terminal event.
	 * @param listener invoked exactly once with the terminal event
	 */
	default void onEvent(Consumer<SubscriptionEvent> listener) {
		event().subscribe(listener);
	}

}
