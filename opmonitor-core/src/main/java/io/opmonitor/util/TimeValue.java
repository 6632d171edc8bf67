/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.util;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * An immutable amount of time expressed in a {@link TimeUnit}.
 *
 * <p>
 * Two values are equal when they describe the same number of milliseconds, regardless
 * of the unit they were declared with:
 *
 * <pre>{@code
 * TimeValue.seconds(1).equals(TimeValue.milliseconds(1000)); // true
 * }</pre>
 *
 * Arithmetic and ordering operate on the millisecond projection.
 */
public final class TimeValue implements Comparable<TimeValue> {

	private final long amount;

	private final TimeUnit unit;

	private TimeValue(long amount, TimeUnit unit) {
		Assert.notNull(unit, "unit must not be null");
		this.amount = amount;
		this.unit = unit;
	}

	public static TimeValue of(long amount, TimeUnit unit) {
		return new TimeValue(amount, unit);
	}

	public static TimeValue milliseconds(long amount) {
		return new TimeValue(amount, TimeUnit.MILLISECONDS);
	}

	public static TimeValue seconds(long amount) {
		return new TimeValue(amount, TimeUnit.SECONDS);
	}

	public static TimeValue minutes(long amount) {
		return new TimeValue(amount, TimeUnit.MINUTES);
	}

	public static TimeValue hours(long amount) {
		return new TimeValue(amount, TimeUnit.HOURS);
	}

	public long amount() {
		return this.amount;
	}

	public TimeUnit unit() {
		return this.unit;
	}

	/**
	 * Returns the canonical millisecond count of this value. Sub-millisecond units are
	 * truncated.
	 * @return the number of milliseconds
	 */
	public long toMilliseconds() {
		return this.unit.toMillis(this.amount);
	}

	/**
	 * Bridges this value to a {@link Duration} for use with timers.
	 * @return the equivalent duration
	 */
	public Duration toDuration() {
		return Duration.ofMillis(toMilliseconds());
	}

	public boolean isPositive() {
		return toMilliseconds() > 0;
	}

	public TimeValue plus(TimeValue other) {
		Assert.notNull(other, "other must not be null");
		return milliseconds(Math.addExact(toMilliseconds(), other.toMilliseconds()));
	}

	public TimeValue minus(TimeValue other) {
		Assert.notNull(other, "other must not be null");
		return milliseconds(Math.subtractExact(toMilliseconds(), other.toMilliseconds()));
	}

	@Override
	public int compareTo(TimeValue other) {
		return Long.compare(toMilliseconds(), other.toMilliseconds());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TimeValue other)) {
			return false;
		}
		return toMilliseconds() == other.toMilliseconds();
	}

	@Override
	public int hashCode() {
		return Long.hashCode(toMilliseconds());
	}

	@Override
	public String toString() {
		String name = this.unit.name().toLowerCase(Locale.ROOT);
		if (this.amount == 1) {
			name = name.substring(0, name.length() - 1);
		}
		return this.amount + " " + name;
	}

}
