/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor;

/**
 * Raised synchronously by client factories when options are missing or invalid.
 */
public class ConfigurationException extends StatusMonitorException {

	private static final long serialVersionUID = 1L;

	public static final String NAME = "ConfigurationError";

	public ConfigurationException(String message) {
		super(NAME, message);
	}

}
