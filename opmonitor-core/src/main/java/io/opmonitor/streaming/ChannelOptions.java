/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import io.opmonitor.status.StatusResult;
import io.opmonitor.util.MonitorDefaults;
import io.opmonitor.util.TimeValue;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Configuration of a {@link SubscriptionChannel}.
 *
 * <pre>{@code
 * ChannelOptions<JobInfo> options = ChannelOptions.<JobInfo>builder()
 *     .channel("/topic/JobStatus")
 *     .cometClient(cometClient)
 *     .streamProcessor(message -> isDone(message) ? StatusResult.completed(toJob(message))
 *             : StatusResult.incomplete())
 *     .subscribeTimeout(TimeValue.minutes(5))
 *     .build();
 * }</pre>
 *
 * The builder performs no validation; {@link SubscriptionChannel#create(ChannelOptions)}
 * does.
 *
 * @param <T> the type of the terminal payload
 */
public final class ChannelOptions<T> {

	private final String channel;

	private final CometClient cometClient;

	private final Function<Map<String, Object>, StatusResult<T>> streamProcessor;

	private final TimeValue handshakeTimeout;

	private final TimeValue subscribeTimeout;

	private final long replayId;

	private final Map<String, String> headers;

	private final Set<String> disabledFeatures;

	private final Scheduler scheduler;

	private ChannelOptions(Builder<T> builder) {
		this.channel = builder.channel;
		this.cometClient = builder.cometClient;
		this.streamProcessor = builder.streamProcessor;
		this.handshakeTimeout = builder.handshakeTimeout;
		this.subscribeTimeout = builder.subscribeTimeout;
		this.replayId = builder.replayId;
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.disabledFeatures = Collections.unmodifiableSet(new LinkedHashSet<>(builder.disabledFeatures));
		this.scheduler = builder.scheduler != null ? builder.scheduler : Schedulers.parallel();
	}

	public String channel() {
		return this.channel;
	}

	public CometClient cometClient() {
		return this.cometClient;
	}

	/**
	 * Returns the function turning each delivered message into a status snapshot. The
	 * first completed snapshot ends the subscription.
	 * @return the stream processor
	 */
	public Function<Map<String, Object>, StatusResult<T>> streamProcessor() {
		return this.streamProcessor;
	}

	public TimeValue handshakeTimeout() {
		return this.handshakeTimeout;
	}

	public TimeValue subscribeTimeout() {
		return this.subscribeTimeout;
	}

	public long replayId() {
		return this.replayId;
	}

	public Map<String, String> headers() {
		return this.headers;
	}

	public Set<String> disabledFeatures() {
		return this.disabledFeatures;
	}

	public Scheduler scheduler() {
		return this.scheduler;
	}

	/**
	 * Creates options with the default handshake and subscribe timeouts.
	 * @param <T> the type of the terminal payload
	 * @param channel the channel name
	 * @param cometClient the transport
	 * @param streamProcessor the stream processor
	 * @return the options
	 */
	public static <T> ChannelOptions<T> defaults(String channel, CometClient cometClient,
			Function<Map<String, Object>, StatusResult<T>> streamProcessor) {
		return ChannelOptions.<T>builder()
			.channel(channel)
			.cometClient(cometClient)
			.streamProcessor(streamProcessor)
			.handshakeTimeout(MonitorDefaults.DEFAULT_HANDSHAKE_TIMEOUT)
			.subscribeTimeout(MonitorDefaults.DEFAULT_SUBSCRIBE_TIMEOUT)
			.build();
	}

	public static <T> Builder<T> builder() {
		return new Builder<>();
	}

	/**
	 * Builder for {@link ChannelOptions}.
	 *
	 * @param <T> the type of the terminal payload
	 */
	public static final class Builder<T> {

		private String channel;

		private CometClient cometClient;

		private Function<Map<String, Object>, StatusResult<T>> streamProcessor;

		private TimeValue handshakeTimeout;

		private TimeValue subscribeTimeout;

		private long replayId = MonitorDefaults.DEFAULT_REPLAY_ID;

		private final Map<String, String> headers = new LinkedHashMap<>();

		private final Set<String> disabledFeatures = new LinkedHashSet<>();

		private Scheduler scheduler;

		private Builder() {
		}

		public Builder<T> channel(String channel) {
			this.channel = channel;
			return this;
		}

		public Builder<T> cometClient(CometClient cometClient) {
			this.cometClient = cometClient;
			return this;
		}

		public Builder<T> streamProcessor(Function<Map<String, Object>, StatusResult<T>> streamProcessor) {
			this.streamProcessor = streamProcessor;
			return this;
		}

		public Builder<T> handshakeTimeout(TimeValue handshakeTimeout) {
			this.handshakeTimeout = handshakeTimeout;
			return this;
		}

		public Builder<T> subscribeTimeout(TimeValue subscribeTimeout) {
			this.subscribeTimeout = subscribeTimeout;
			return this;
		}

		/**
		 * Sets the replay id sent with the subscribe message. Defaults to
		 * {@link MonitorDefaults#DEFAULT_REPLAY_ID}.
		 * @param replayId the replay id
		 * @return this builder
		 */
		public Builder<T> replayId(long replayId) {
			this.replayId = replayId;
			return this;
		}

		public Builder<T> header(String name, String value) {
			this.headers.put(name, value);
			return this;
		}

		/**
		 * Disables a transport feature, e.g. {@code "websocket"}.
		 * @param label the feature label
		 * @return this builder
		 */
		public Builder<T> disable(String label) {
			this.disabledFeatures.add(label);
			return this;
		}

		/**
		 * Sets the scheduler running the timeout timers. Defaults to
		 * {@link Schedulers#parallel()}.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public Builder<T> scheduler(Scheduler scheduler) {
			this.scheduler = scheduler;
			return this;
		}

		public ChannelOptions<T> build() {
			return new ChannelOptions<>(this);
		}

	}

}
