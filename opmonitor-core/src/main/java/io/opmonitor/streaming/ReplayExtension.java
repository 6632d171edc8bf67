/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import java.util.HashMap;
import java.util.Map;

import io.opmonitor.util.Assert;

/**
 * Adds the replay id of a channel to outgoing subscribe messages so the server replays
 * retained events from that point.
 */
public class ReplayExtension implements CometExtension {

	static final String SUBSCRIBE_CHANNEL = "/meta/subscribe";

	static final String EXT_KEY = "ext";

	static final String REPLAY_KEY = "replay";

	private final String channel;

	private volatile long replayId;

	public ReplayExtension(String channel, long replayId) {
		Assert.hasText(channel, "channel must not be empty");
		this.channel = channel;
		this.replayId = replayId;
	}

	public String channel() {
		return this.channel;
	}

	public long replayId() {
		return this.replayId;
	}

	/**
	 * Changes the replay id used by subsequent subscribe messages.
	 * @param replayId the replay id, e.g. {@code -1} for new events only
	 */
	public void setReplayId(long replayId) {
		this.replayId = replayId;
	}

	@Override
	public Map<String, Object> outgoing(Map<String, Object> message) {
		if (!SUBSCRIBE_CHANNEL.equals(message.get("channel")) || !this.channel.equals(message.get("subscription"))) {
			return message;
		}
		Map<String, Object> result = new HashMap<>(message);
		Map<String, Object> ext = new HashMap<>();
		if (message.get(EXT_KEY) instanceof Map<?, ?> existing) {
			existing.forEach((key, value) -> ext.put(String.valueOf(key), value));
		}
		ext.put(REPLAY_KEY, Map.of(this.channel, this.replayId));
		result.put(EXT_KEY, ext);
		return result;
	}

}
