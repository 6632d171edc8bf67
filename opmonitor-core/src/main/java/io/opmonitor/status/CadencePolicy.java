/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

import java.time.Duration;

import io.opmonitor.util.Assert;
import io.opmonitor.util.TimeValue;

/**
 * Decides the gap between the scheduled starts of two consecutive probes.
 *
 * <p>
 * Intervals are measured between scheduled starts, not from the moment the previous
 * probe returned, so a policy describes a cadence rather than a sleep.
 */
@FunctionalInterface
public interface CadencePolicy {

	/**
	 * Returns the interval between the scheduled start of probe {@code attempt} and the
	 * one after it.
	 * @param attempt zero-based index of the probe that was just scheduled
	 * @param frequency the configured polling frequency
	 * @return a positive interval
	 */
	Duration interval(int attempt, TimeValue frequency);

	/**
	 * A fixed cadence: every interval equals the configured frequency.
	 * @return the fixed cadence policy
	 */
	static CadencePolicy fixed() {
		return (attempt, frequency) -> frequency.toDuration();
	}

	/**
	 * A cadence that starts at the configured frequency and multiplies the interval by
	 * {@code multiplier} after each probe, never exceeding {@code maxInterval}.
	 * @param multiplier growth factor, at least 1
	 * @param maxInterval upper bound of a single interval
	 * @return the backoff cadence policy
	 */
	static CadencePolicy exponentialBackoff(double multiplier, TimeValue maxInterval) {
		Assert.isTrue(multiplier >= 1.0, "multiplier must be at least 1");
		Assert.notNull(maxInterval, "maxInterval must not be null");
		Assert.isTrue(maxInterval.isPositive(), "maxInterval must be positive");
		long max = maxInterval.toMilliseconds();
		return (attempt, frequency) -> {
			double millis = frequency.toMilliseconds() * Math.pow(multiplier, attempt);
			return Duration.ofMillis((long) Math.min(millis, max));
		};
	}

}
