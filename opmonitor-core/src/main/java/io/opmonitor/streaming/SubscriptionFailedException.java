/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import io.opmonitor.StatusMonitorException;

/**
 * Default error of a subscription that could not be established.
 */
public class SubscriptionFailedException extends StatusMonitorException {

	private static final long serialVersionUID = 1L;

	public static final String NAME = "SubscriptionFailure";

	public SubscriptionFailedException(String message) {
		super(NAME, message);
	}

	public SubscriptionFailedException(String message, Throwable cause) {
		super(NAME, message, cause);
	}

}
