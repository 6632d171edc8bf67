/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.testing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.opmonitor.streaming.CometSubscription;
import io.opmonitor.streaming.ReplayExtension;
import io.opmonitor.streaming.SubscriptionEvent;
import io.opmonitor.streaming.SubscriptionFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

@ExtendWith(MonitorTestContextExtension.class)
class StreamingMockCometClientTests {

	private static final String CHANNEL = "/topic/JobStatus";

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();

	@Test
	void handshakeCallbackRunsOnTheClientWorker(MonitorTestContext context) {
		StreamingMockCometClient client = context.cometClient(context.subscriptionOptions().build());
		AtomicReference<Thread> callbackThread = new AtomicReference<>();

		client.handshake(() -> callbackThread.set(Thread.currentThread()));

		await().atMost(TIMEOUT).until(() -> callbackThread.get() != null);
		assertThat(callbackThread.get()).isNotSameAs(Thread.currentThread());
		assertThat(callbackThread.get().getName()).startsWith("opmonitor-test-");
	}

	@Test
	void playsBackPlaylistInOrderAfterSubscriptionCompletes(MonitorTestContext context) {
		List<Map<String, Object>> playlist = List.of(Map.of("status", "Queued"), Map.of("status", "Running"),
				Map.of("status", "Done"));
		StreamingMockCometClient client = context
			.cometClient(context.subscriptionOptions().messagePlaylist(playlist).build());

		CometSubscription subscription = client.subscribe(CHANNEL, received::add);

		StepVerifier.create(subscription.event())
			.expectNext(SubscriptionEvent.complete())
			.expectComplete()
			.verify(TIMEOUT);
		await().atMost(TIMEOUT).until(() -> received.size() == 3);
		assertThat(received).containsExactlyElementsOf(playlist);
	}

	@Test
	void messagesFollowHandshakeAndCompleteEvent(MonitorTestContext context) {
		StreamingMockCometClient client = context.cometClient(context.subscriptionOptions()
			.messagePlaylist(List.of(Map.of("status", "Queued"), Map.of("status", "Running"), Map.of("status", "Done")))
			.build());
		List<String> timeline = new CopyOnWriteArrayList<>();

		// subscribing from the handshake callback attaches the listener before the event fires
		client.handshake(() -> {
			timeline.add("handshake");
			client.subscribe(CHANNEL, message -> timeline.add("message:" + message.get("status")))
				.onEvent(event -> timeline.add("event:" + event.getClass().getSimpleName()));
		});

		await().atMost(TIMEOUT).until(() -> timeline.size() == 5);
		assertThat(timeline).containsExactly("handshake", "event:Complete", "message:Queued", "message:Running",
				"message:Done");
	}

	@Test
	void defaultPlaylistIsSingleIdMessage(MonitorTestContext context) {
		SubscriptionOptions options = context.subscriptionOptions().id("job-42").build();
		StreamingMockCometClient client = context.cometClient(options);

		client.subscribe(CHANNEL, received::add);

		await().atMost(TIMEOUT).until(() -> !received.isEmpty());
		assertThat(received).containsExactly(Map.of("id", "job-42"));
	}

	@Test
	void errbackDeliversConfiguredErrorAndNoMessages(MonitorTestContext context) {
		IllegalStateException failure = new IllegalStateException("403::Restricted channel");
		StreamingMockCometClient client = context.cometClient(context.subscriptionOptions().errback(failure).build());
		AtomicBoolean marker = new AtomicBoolean();

		CometSubscription subscription = client.subscribe(CHANNEL, received::add);

		StepVerifier.create(subscription.event())
			.assertNext(event -> assertThat(event).isEqualTo(SubscriptionEvent.failed(failure)))
			.expectComplete()
			.verify(TIMEOUT);

		// runs after any delivery the subscription outcome could have scheduled
		client.handshake(() -> marker.set(true));
		await().atMost(TIMEOUT).untilTrue(marker);
		assertThat(received).isEmpty();
	}

	@Test
	void errbackWithoutErrorUsesSubscriptionFailure(MonitorTestContext context) {
		StreamingMockCometClient client = context
			.cometClient(context.subscriptionOptions().outcome(SubscriptionOutcome.ERRORBACK).build());

		StepVerifier.create(client.subscribe(CHANNEL, received::add).event()).assertNext(event -> {
			assertThat(event).isInstanceOf(SubscriptionEvent.Failed.class);
			Throwable error = ((SubscriptionEvent.Failed) event).error();
			assertThat(error).isInstanceOf(SubscriptionFailedException.class).hasMessageContaining(CHANNEL);
			assertThat(((SubscriptionFailedException) error).getName()).isEqualTo("SubscriptionFailure");
		}).expectComplete().verify(TIMEOUT);
	}

	@Test
	void lateListenersSeeTheSameEvent(MonitorTestContext context) {
		StreamingMockCometClient client = context.cometClient(context.subscriptionOptions().build());
		CometSubscription subscription = client.subscribe(CHANNEL, received::add);
		SubscriptionEvent first = subscription.event().block(TIMEOUT);
		List<SubscriptionEvent> late = new ArrayList<>();

		subscription.onEvent(late::add);

		assertThat(late).containsExactly(first);
	}

	@Test
	void disconnectAfterResolvedSubscriptionIsIdempotent(MonitorTestContext context) {
		StreamingMockCometClient client = context.cometClient(context.subscriptionOptions().build());
		CometSubscription subscription = client.subscribe(CHANNEL, received::add);
		StepVerifier.create(subscription.event())
			.expectNext(SubscriptionEvent.complete())
			.expectComplete()
			.verify(TIMEOUT);
		await().atMost(TIMEOUT).until(() -> received.size() == 1);

		for (int i = 0; i < 3; i++) {
			StepVerifier.create(client.disconnect()).expectComplete().verify(TIMEOUT);
		}

		assertThat(client.isDisconnected()).isTrue();
		assertThatIllegalStateException().isThrownBy(() -> client.subscribe(CHANNEL, received::add));
	}

	@Test
	void disconnectDropsUndeliveredMessages(MonitorTestContext context) {
		StreamingMockCometClient client = context.cometClient(context.subscriptionOptions()
			.messagePlaylist(List.of(Map.of("status", "Queued"), Map.of("status", "Running"), Map.of("status", "Done")))
			.build());

		client.subscribe(CHANNEL, message -> {
			received.add(message);
			client.disconnect().subscribe();
		});

		await().atMost(TIMEOUT).until(() -> !received.isEmpty());
		await().during(Duration.ofMillis(200)).atMost(TIMEOUT).until(() -> received.size() == 1);
		assertThat(received).containsExactly(Map.of("status", "Queued"));
	}

	@Test
	void recordsConfigurationCalls(MonitorTestContext context) {
		SubscriptionOptions options = context.subscriptionOptions().build();
		StreamingMockCometClient client = context.cometClient(options);
		ReplayExtension replay = new ReplayExtension(CHANNEL, -2);

		client.addExtension(replay);
		client.disable("websocket");
		client.setHeader("Authorization", "OAuth token");
		client.subscribe(CHANNEL, received::add);

		assertThat(client.extensions()).containsExactly(replay);
		assertThat(client.disabledFeatures()).containsExactly("websocket");
		assertThat(client.headers()).containsExactly(Map.entry("Authorization", "OAuth token"));
		assertThat(client.subscribeMessages()).singleElement()
			.satisfies(message -> assertThat(message).containsEntry("subscription", CHANNEL)
				.containsEntry("clientId", options.id())
				.containsEntry("ext", Map.of("replay", Map.of(CHANNEL, -2L))));
	}

	@Test
	void optionsCopyThePlaylist() {
		List<Map<String, Object>> playlist = new ArrayList<>();
		playlist.add(Map.of("status", "Done"));
		SubscriptionOptions options = SubscriptionOptions.builder()
			.url(MonitorTestContext.DEFAULT_URL)
			.id("job-1")
			.messagePlaylist(playlist)
			.build();

		playlist.add(Map.of("status", "Extra"));

		assertThat(options.messagePlaylist()).containsExactly(Map.of("status", "Done"));
		assertThat(options.outcome()).isEqualTo(SubscriptionOutcome.CALLBACK);
		assertThat(options.errbackError()).isNull();
	}

	@Test
	void optionsRejectSchedulersRunningOnCallingStack() {
		SubscriptionOptions.Builder builder = SubscriptionOptions.builder()
			.url(MonitorTestContext.DEFAULT_URL)
			.id("job-1");

		assertThatIllegalArgumentException().isThrownBy(() -> builder.scheduler(Schedulers.immediate()).build());
		assertThatIllegalArgumentException()
			.isThrownBy(() -> builder.scheduler(VirtualTimeScheduler.create()).build());
	}

	@Test
	void optionsRequireUrlAndId() {
		assertThatIllegalArgumentException().isThrownBy(() -> SubscriptionOptions.builder().id("job-1").build())
			.withMessageContaining("url");
		assertThatIllegalArgumentException()
			.isThrownBy(() -> SubscriptionOptions.builder().url(MonitorTestContext.DEFAULT_URL).id("").build())
			.withMessageContaining("id");
	}

}
