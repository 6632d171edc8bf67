/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

import io.opmonitor.StatusMonitorException;

/**
 * The observation was cancelled through {@link PollingClient#cancel()}.
 */
public class PollingClientCancelledException extends StatusMonitorException {

	private static final long serialVersionUID = 1L;

	public static final String NAME = "PollingClientCancelled";

	public PollingClientCancelledException() {
		super(NAME, "The polling client was cancelled");
	}

}
