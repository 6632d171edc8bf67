/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

import io.opmonitor.util.Assert;
import io.opmonitor.util.MonitorDefaults;
import io.opmonitor.util.TimeValue;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Configuration of a {@link PollingClient}.
 *
 * <p>
 * Use the {@link #builder()} method to create instances:
 *
 * <pre>{@code
 * PollingOptions<Deployment> options = PollingOptions.<Deployment>builder()
 *     .probe(() -> api.deploymentStatus(id))
 *     .frequency(TimeValue.seconds(2))
 *     .timeout(TimeValue.minutes(10))
 *     .build();
 * }</pre>
 *
 * The builder performs no validation; {@link PollingClient#create(PollingOptions)}
 * does.
 *
 * @param <T> the type of the terminal payload
 * @see PollingClient
 */
public final class PollingOptions<T> {

	private static final long CLOCK_ORIGIN = System.nanoTime();

	private final StatusProbe<T> probe;

	private final TimeValue frequency;

	private final TimeValue timeout;

	private final CadencePolicy cadencePolicy;

	private final Scheduler scheduler;

	private final LongSupplier clock;

	private PollingOptions(Builder<T> builder) {
		this.probe = builder.probe;
		this.frequency = builder.frequency;
		this.timeout = builder.timeout;
		this.cadencePolicy = builder.cadencePolicy != null ? builder.cadencePolicy : CadencePolicy.fixed();
		this.scheduler = builder.scheduler != null ? builder.scheduler : Schedulers.parallel();
		this.clock = builder.clock != null ? builder.clock : monotonicClock();
	}

	public StatusProbe<T> probe() {
		return this.probe;
	}

	public TimeValue frequency() {
		return this.frequency;
	}

	public TimeValue timeout() {
		return this.timeout;
	}

	public CadencePolicy cadencePolicy() {
		return this.cadencePolicy;
	}

	/**
	 * Returns the scheduler driving the cadence timers.
	 * @return the scheduler
	 */
	public Scheduler scheduler() {
		return this.scheduler;
	}

	/**
	 * Returns the millisecond clock anchoring the deadline and the cadence slots.
	 * @return the clock
	 */
	public LongSupplier clock() {
		return this.clock;
	}

	/**
	 * A clock reading {@link System#nanoTime()}, unaffected by wall clock adjustments.
	 * Its readings are never negative. This is the default.
	 * @return a monotonic millisecond clock
	 */
	public static LongSupplier monotonicClock() {
		return () -> TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - CLOCK_ORIGIN);
	}

	/**
	 * A clock reading the time of the given scheduler, e.g. a virtual time scheduler in
	 * tests.
	 * @param scheduler the scheduler
	 * @return a millisecond clock following the scheduler
	 */
	public static LongSupplier schedulerClock(Scheduler scheduler) {
		Assert.notNull(scheduler, "scheduler must not be null");
		return () -> scheduler.now(TimeUnit.MILLISECONDS);
	}

	/**
	 * Creates options for the given probe using
	 * {@link MonitorDefaults#DEFAULT_POLL_FREQUENCY} and
	 * {@link MonitorDefaults#DEFAULT_POLL_TIMEOUT}.
	 * @param <T> the type of the terminal payload
	 * @param probe the status probe
	 * @return the options
	 */
	public static <T> PollingOptions<T> defaults(StatusProbe<T> probe) {
		return PollingOptions.<T>builder()
			.probe(probe)
			.frequency(MonitorDefaults.DEFAULT_POLL_FREQUENCY)
			.timeout(MonitorDefaults.DEFAULT_POLL_TIMEOUT)
			.build();
	}

	public static <T> Builder<T> builder() {
		return new Builder<>();
	}

	/**
	 * Builder for {@link PollingOptions}.
	 *
	 * @param <T> the type of the terminal payload
	 */
	public static final class Builder<T> {

		private StatusProbe<T> probe;

		private TimeValue frequency;

		private TimeValue timeout;

		private CadencePolicy cadencePolicy;

		private Scheduler scheduler;

		private LongSupplier clock;

		private Builder() {
		}

		/**
		 * Sets the operation reporting the status of the monitored task.
		 * @param probe the status probe
		 * @return this builder
		 */
		public Builder<T> probe(StatusProbe<T> probe) {
			this.probe = probe;
			return this;
		}

		/**
		 * Sets the interval between the scheduled starts of two probes.
		 * @param frequency the polling frequency
		 * @return this builder
		 */
		public Builder<T> frequency(TimeValue frequency) {
			this.frequency = frequency;
			return this;
		}

		/**
		 * Sets the upper bound of the whole observation.
		 * @param timeout the polling timeout
		 * @return this builder
		 */
		public Builder<T> timeout(TimeValue timeout) {
			this.timeout = timeout;
			return this;
		}

		/**
		 * Sets the policy computing intervals between probes. Defaults to
		 * {@link CadencePolicy#fixed()}.
		 * @param cadencePolicy the cadence policy
		 * @return this builder
		 */
		public Builder<T> cadencePolicy(CadencePolicy cadencePolicy) {
			this.cadencePolicy = cadencePolicy;
			return this;
		}

		/**
		 * Sets the scheduler used for timers. Defaults to {@link Schedulers#parallel()}.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public Builder<T> scheduler(Scheduler scheduler) {
			this.scheduler = scheduler;
			return this;
		}

		/**
		 * Sets the clock measuring elapsed time. Defaults to {@link #monotonicClock()}.
		 * Use {@link #schedulerClock(Scheduler)} to follow a virtual time scheduler.
		 * @param clock the millisecond clock
		 * @return this builder
		 */
		public Builder<T> clock(LongSupplier clock) {
			this.clock = clock;
			return this;
		}

		public PollingOptions<T> build() {
			return new PollingOptions<>(this);
		}

	}

}
