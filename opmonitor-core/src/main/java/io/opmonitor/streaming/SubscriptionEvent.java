/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import io.opmonitor.util.Assert;

/**
 * Terminal lifecycle event of a {@link CometSubscription}. Exactly one event is emitted
 * per subscription.
 */
public sealed interface SubscriptionEvent permits SubscriptionEvent.Complete, SubscriptionEvent.Failed {

	/**
	 * The subscription is established and messages may now be delivered.
	 */
	record Complete() implements SubscriptionEvent {

	}

	/**
	 * The subscription could not be established.
	 *
	 * @param error the error reported by the transport, delivered as is
	 */
	record Failed(Throwable error) implements SubscriptionEvent {

		public Failed {
			Assert.notNull(error, "error must not be null");
		}

	}

	static SubscriptionEvent complete() {
		return new Complete();
	}

	static SubscriptionEvent failed(Throwable error) {
		return new Failed(error);
	}

}
