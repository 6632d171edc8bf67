/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.opmonitor.ConfigurationException;
import io.opmonitor.status.StatusResult;
import io.opmonitor.util.Assert;
import io.opmonitor.util.TimeValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * Watches a remote operation to completion through a push channel.
 *
 * <p>
 * The channel drives a {@link CometClient} through handshake, subscribe and delivery.
 * Every delivered message is handed to the configured stream processor; the first
 * completed {@link StatusResult} ends the observation with its payload. The transport is
 * disconnected whatever the outcome.
 *
 * <pre>{@code
 * SubscriptionChannel<JobInfo> channel = SubscriptionChannel.create(options);
 * JobInfo job = channel.observe(startJob()).block();
 * }</pre>
 *
 * @param <T> the type of the terminal payload
 */
public final class SubscriptionChannel<T> {

	private static final Logger logger = LoggerFactory.getLogger(SubscriptionChannel.class);

	private final ChannelOptions<T> options;

	private final ReplayExtension replayExtension;

	private SubscriptionChannel(ChannelOptions<T> options) {
		this.options = options;
		this.replayExtension = new ReplayExtension(options.channel(), options.replayId());

		CometClient cometClient = options.cometClient();
		cometClient.addExtension(this.replayExtension);
		options.disabledFeatures().forEach(cometClient::disable);
		options.headers().forEach(cometClient::setHeader);
	}

	/**
	 * Creates a channel and registers its replay extension, headers and disabled
	 * features with the transport.
	 * @param <T> the type of the terminal payload
	 * @param options the channel options
	 * @return the channel
	 * @throws ConfigurationException if a required option is missing or a timeout is not
	 * positive
	 */
	public static <T> SubscriptionChannel<T> create(ChannelOptions<T> options) {
		if (options == null) {
			throw new ConfigurationException("Channel options must be provided");
		}
		if (!Assert.hasText(options.channel())) {
			throw new ConfigurationException("A channel name must be provided");
		}
		if (options.cometClient() == null) {
			throw new ConfigurationException("A comet client must be provided");
		}
		if (options.streamProcessor() == null) {
			throw new ConfigurationException("A stream processor must be provided");
		}
		requirePositive(options.handshakeTimeout(), "handshake timeout");
		requirePositive(options.subscribeTimeout(), "subscribe timeout");
		return new SubscriptionChannel<>(options);
	}

	private static void requirePositive(TimeValue value, String name) {
		if (value == null || !value.isPositive()) {
			throw new ConfigurationException("The " + name + " must be a positive duration but was " + value);
		}
	}

	public ChannelOptions<T> options() {
		return this.options;
	}

	/**
	 * Changes the replay id sent when subscribing.
	 * @param replayId the replay id, e.g. {@code -2} to replay all retained events
	 */
	public void replay(long replayId) {
		this.replayExtension.setReplayId(replayId);
	}

	/**
	 * Negotiates the transport connection.
	 * @return a Mono emitting {@link ConnectionState#CONNECTED}, or failing with a
	 * {@link StreamingClientTimeoutException} named
	 * {@value StreamingClientTimeoutException#HANDSHAKE_TIMEOUT} after the handshake
	 * timeout
	 */
	public Mono<ConnectionState> handshake() {
		TimeValue timeout = this.options.handshakeTimeout();
		return Mono.<ConnectionState>create(sink -> this.options.cometClient()
			.handshake(() -> sink.success(ConnectionState.CONNECTED)))
			.timeout(timeout.toDuration(), Mono.error(() -> StreamingClientTimeoutException.handshake(timeout)),
					this.options.scheduler())
			.doOnNext(state -> logger.debug("Handshake with streaming transport completed"))
			.onErrorResume(error -> disconnectQuietly().then(Mono.error(error)));
	}

	/**
	 * Performs the handshake, then subscribes.
	 * @param streamInit action starting the remote operation once the subscription is
	 * established
	 * @return a Mono with the same outcomes as {@link #subscribe(Mono)} plus the
	 * handshake timeout
	 */
	public Mono<T> observe(Mono<Void> streamInit) {
		return handshake().then(subscribe(streamInit));
	}

	/**
	 * Subscribes to the channel and processes delivered messages until one yields a
	 * completed status.
	 *
	 * <p>
	 * {@code streamInit} is subscribed once the subscription is established, so that no
	 * event emitted by the operation it starts can be missed. Messages delivered before
	 * that point are held back and processed afterwards, in delivery order; if the
	 * outcome is already settled {@code streamInit} is not run. The returned Mono emits the
	 * completed payload (or completes empty if it is null). It fails with the error of a
	 * failed subscription, of {@code streamInit} or of the stream processor, unchanged,
	 * or with a {@link StreamingClientTimeoutException} named
	 * {@value StreamingClientTimeoutException#SUBSCRIBE_TIMEOUT} after the subscribe
	 * timeout. Messages delivered after the outcome are ignored.
	 * @param streamInit action starting the remote operation, may be null
	 * @return a Mono settling exactly once
	 */
	public Mono<T> subscribe(Mono<Void> streamInit) {
		Mono<Void> init = streamInit != null ? streamInit : Mono.empty();
		String channel = this.options.channel();
		TimeValue timeout = this.options.subscribeTimeout();

		Mono<T> outcome = Mono.<T>create(sink -> {
			AtomicBoolean settled = new AtomicBoolean(false);
			Disposable.Composite disposables = Disposables.composite();
			sink.onDispose(disposables);

			DeliveryGate gate = new DeliveryGate(message -> onMessage(message, sink, settled));

			logger.debug("Subscribing to {}", channel);
			CometSubscription subscription = this.options.cometClient().subscribe(channel, gate::offer);

			disposables.add(subscription.event().subscribe(event -> {
				if (event instanceof SubscriptionEvent.Failed failed) {
					logger.warn("Subscription to {} failed: {}", channel, failed.error().getMessage());
					fail(sink, settled, failed.error());
				}
				else if (settled.get()) {
					logger.debug("Subscription to {} established after the outcome was settled", channel);
				}
				else {
					logger.debug("Subscription to {} established", channel);
					disposables.add(init.subscribe(null, error -> fail(sink, settled, error)));
					gate.open();
				}
			}, error -> fail(sink, settled, error)));
		});

		return Mono.usingWhen(Mono.just(this.options.cometClient()),
				client -> outcome.timeout(timeout.toDuration(),
						Mono.error(() -> StreamingClientTimeoutException.subscribe(channel, timeout)),
						this.options.scheduler()),
				client -> disconnectQuietly(), (client, error) -> disconnectQuietly(), client -> disconnectQuietly());
	}

	/**
	 * Disconnects the transport. Safe to call repeatedly.
	 * @return a Mono completing when disconnected
	 */
	public Mono<Void> disconnect() {
		return Mono.defer(() -> this.options.cometClient().disconnect());
	}

	private void onMessage(Map<String, Object> message, MonoSink<T> sink, AtomicBoolean settled) {
		if (settled.get()) {
			logger.debug("Ignoring message delivered on {} after the outcome was settled", this.options.channel());
			return;
		}
		StatusResult<T> result;
		try {
			result = this.options.streamProcessor().apply(message);
		}
		catch (RuntimeException ex) {
			fail(sink, settled, ex);
			return;
		}
		if (result != null && result.completed() && settled.compareAndSet(false, true)) {
			logger.debug("Operation on {} completed", this.options.channel());
			sink.success(result.payload());
		}
	}

	/**
	 * Holds back messages until the subscription is established and the stream init
	 * action has been started, then hands them over in delivery order.
	 */
	private static final class DeliveryGate {

		private final Consumer<Map<String, Object>> consumer;

		private final Queue<Map<String, Object>> pending = new ArrayDeque<>();

		private boolean open;

		private DeliveryGate(Consumer<Map<String, Object>> consumer) {
			this.consumer = consumer;
		}

		synchronized void offer(Map<String, Object> message) {
			if (this.open) {
				this.consumer.accept(message);
			}
			else {
				this.pending.add(message);
			}
		}

		synchronized void open() {
			this.open = true;
			Map<String, Object> message;
			while ((message = this.pending.poll()) != null) {
				this.consumer.accept(message);
			}
		}

	}

	private static <T> void fail(MonoSink<T> sink, AtomicBoolean settled, Throwable error) {
		if (settled.compareAndSet(false, true)) {
			sink.error(error);
		}
	}

	private Mono<Void> disconnectQuietly() {
		return disconnect().onErrorResume(error -> {
			logger.warn("Failed to disconnect from the streaming transport", error);
			return Mono.empty();
		});
	}

}
