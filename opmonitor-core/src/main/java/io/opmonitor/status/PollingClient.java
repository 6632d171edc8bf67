/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.status;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import io.opmonitor.ConfigurationException;
import io.opmonitor.util.TimeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Watches a remote operation to completion by repeatedly invoking a {@link StatusProbe}.
 *
 * <p>
 * The first probe is issued as soon as {@link #observe()} is subscribed. Every following
 * probe starts on the cadence anchored at that first start, as computed by the
 * configured {@link CadencePolicy}; slots that have already passed because of a slow
 * probe are skipped. After each incomplete result the client checks the deadline: once
 * the next slot would start at or after {@code start + timeout}, no further probe is
 * issued and the observation fails with a {@link PollingClientTimeoutException} when the
 * deadline is reached. An in-flight probe is never interrupted.
 *
 * <pre>{@code
 * PollingClient<Deployment> client = PollingClient.create(options);
 * Deployment deployment = client.observe().block();
 * }</pre>
 *
 * <p>
 * A client observes once. Construct a new client to poll again.
 *
 * @param <T> the type of the terminal payload
 */
public final class PollingClient<T> {

	private static final Logger logger = LoggerFactory.getLogger(PollingClient.class);

	private final PollingOptions<T> options;

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final Sinks.Empty<Void> cancellation = Sinks.empty();

	private volatile boolean cancelRequested;

	private PollingClient(PollingOptions<T> options) {
		this.options = options;
	}

	/**
	 * Creates a polling client that has not started observing yet.
	 * @param <T> the type of the terminal payload
	 * @param options the polling options
	 * @return the client
	 * @throws ConfigurationException if the probe, frequency or timeout is missing, or
	 * frequency or timeout is not positive
	 */
	public static <T> PollingClient<T> create(PollingOptions<T> options) {
		if (options == null) {
			throw new ConfigurationException("Polling options must be provided");
		}
		if (options.probe() == null) {
			throw new ConfigurationException("A status probe must be provided");
		}
		requirePositive(options.frequency(), "frequency");
		requirePositive(options.timeout(), "timeout");
		return new PollingClient<>(options);
	}

	private static void requirePositive(TimeValue value, String name) {
		if (value == null) {
			throw new ConfigurationException("The polling " + name + " must be provided");
		}
		if (!value.isPositive()) {
			throw new ConfigurationException("The polling " + name + " must be positive but was " + value);
		}
	}

	public PollingOptions<T> options() {
		return this.options;
	}

	/**
	 * Returns whether {@link #observe()} has been subscribed.
	 * @return true once the observation started
	 */
	public boolean isStarted() {
		return this.started.get();
	}

	/**
	 * Polls until the probe reports completion.
	 *
	 * <p>
	 * The returned Mono emits the completed result's payload, or completes empty if that
	 * payload is null. It fails with a {@link PollingClientTimeoutException} when the
	 * deadline passes, with a {@link PollingClientCancelledException} after
	 * {@link #cancel()}, and with the probe's own error, unchanged, when a probe fails.
	 * Subscribing a second time fails with an {@link IllegalStateException}.
	 * @return a Mono settling exactly once with the outcome of the observation
	 */
	public Mono<T> observe() {
		return Mono.defer(() -> {
			if (!this.started.compareAndSet(false, true)) {
				return Mono.error(new IllegalStateException("This polling client has already been observed"));
			}
			long start = now();
			Observation observation = new Observation(start,
					saturatedAdd(start, this.options.timeout().toMilliseconds()));
			logger.debug("Polling every {} for at most {}", this.options.frequency(), this.options.timeout());
			return probe(observation, 0, start);
		});
	}

	/**
	 * Requests cancellation of the observation. A pending wait between two probes ends
	 * immediately; a probe in flight is awaited and its result is honoured only if it
	 * reports completion. Calling this more than once has no further effect.
	 */
	public void cancel() {
		this.cancelRequested = true;
		this.cancellation.tryEmitEmpty();
	}

	private Mono<T> probe(Observation observation, int attempt, long scheduledStart) {
		return Mono.defer(() -> {
			observation.probes++;
			logger.debug("Issuing status probe #{}", observation.probes);
			return this.options.probe().poll();
		})
			.switchIfEmpty(Mono.error(() -> new IllegalStateException("The status probe completed without a result")))
			.flatMap(result -> {
				if (result.completed()) {
					logger.debug("Operation completed after {} probes in {} ms", observation.probes,
							now() - observation.start);
					return Mono.justOrEmpty(result.payload());
				}
				return scheduleNext(observation, attempt, scheduledStart);
			});
	}

	private Mono<T> scheduleNext(Observation observation, int attempt, long scheduledStart) {
		if (this.cancelRequested) {
			return Mono.error(new PollingClientCancelledException());
		}
		long now = now();
		if (now >= observation.deadline) {
			return timedOut(observation);
		}

		int slot = attempt + 1;
		long slotStart = saturatedAdd(scheduledStart, intervalMillis(attempt));
		while (slotStart < now) {
			slotStart = saturatedAdd(slotStart, intervalMillis(slot));
			slot++;
		}

		if (slotStart >= observation.deadline) {
			return sleep(observation.deadline - now).flatMap(
					elapsed -> elapsed ? timedOut(observation) : Mono.error(new PollingClientCancelledException()));
		}

		int nextAttempt = slot;
		long nextStart = slotStart;
		return sleep(nextStart - now).flatMap(elapsed -> elapsed ? probe(observation, nextAttempt, nextStart)
				: Mono.error(new PollingClientCancelledException()));
	}

	private long intervalMillis(int attempt) {
		Duration interval = this.options.cadencePolicy().interval(attempt, this.options.frequency());
		if (interval == null || interval.toMillis() <= 0) {
			throw new IllegalStateException("The cadence policy returned a non-positive interval: " + interval);
		}
		return interval.toMillis();
	}

	/**
	 * Waits for the given number of milliseconds. Emits {@code true} when the wait
	 * elapsed and {@code false} when it was cut short by {@link #cancel()}.
	 */
	private Mono<Boolean> sleep(long millis) {
		Scheduler scheduler = this.options.scheduler();
		return Mono.firstWithSignal(Mono.delay(Duration.ofMillis(millis), scheduler).thenReturn(Boolean.TRUE),
				this.cancellation.asMono().thenReturn(Boolean.FALSE));
	}

	private Mono<T> timedOut(Observation observation) {
		logger.warn("Polling timed out after {} ({} probes issued)", this.options.timeout(), observation.probes);
		return Mono.error(new PollingClientTimeoutException(this.options.timeout()));
	}

	private long now() {
		return this.options.clock().getAsLong();
	}

	private static long saturatedAdd(long time, long millis) {
		long sum = time + millis;
		return sum < time ? Long.MAX_VALUE : sum;
	}

	/**
	 * Accounting of one observation. Probes are strictly sequential, so the counter is
	 * only ever touched by one signal at a time.
	 */
	private static final class Observation {

		private final long start;

		private final long deadline;

		private int probes;

		private Observation(long start, long deadline) {
			this.start = start;
			this.deadline = deadline;
		}

	}

}
