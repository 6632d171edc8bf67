/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

import io.opmonitor.StatusMonitorException;
import io.opmonitor.util.TimeValue;

/**
 * The polling deadline was reached before the probe reported completion.
 */
public class PollingClientTimeoutException extends StatusMonitorException {

	private static final long serialVersionUID = 1L;

	public static final String NAME = "PollingClientTimeout";

	private final transient TimeValue timeout;

	public PollingClientTimeoutException(TimeValue timeout) {
		super(NAME, "The client has timed out after " + timeout);
		this.timeout = timeout;
	}

	public TimeValue getTimeout() {
		return this.timeout;
	}

}
