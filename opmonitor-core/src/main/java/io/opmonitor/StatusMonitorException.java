/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor;

/**
 * Base class of the errors raised by the monitors themselves. Errors raised by caller
 * supplied probes and processors are never converted into this type.
 *
 * <p>
 * Each subclass carries a stable {@link #getName() name} so callers can branch on the
 * outcome without depending on the concrete class.
 */
public abstract class StatusMonitorException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String name;

	protected StatusMonitorException(String name, String message) {
		super(message);
		this.name = name;
	}

	protected StatusMonitorException(String name, String message, Throwable cause) {
		super(message, cause);
		this.name = name;
	}

	/**
	 * Returns the discriminant of this error, e.g. {@code PollingClientTimeout}.
	 * @return the error name
	 */
	public String getName() {
		return this.name;
	}

	@Override
	public String toString() {
		return this.name + ": " + getMessage();
	}

}
