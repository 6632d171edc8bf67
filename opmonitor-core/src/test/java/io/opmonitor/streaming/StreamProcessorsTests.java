/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.opmonitor.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opmonitor.status.StatusResult;
import org.junit.jupiter.api.Test;

class StreamProcessorsTests {

	record JobEvent(String id, String state) {
	}

	private final ObjectMapper mapper = new ObjectMapper();

	private final Function<Map<String, Object>, StatusResult<String>> processor = StreamProcessors
		.typed(JobEvent.class, mapper, event -> "JobComplete".equals(event.state())
				? StatusResult.completed(event.id()) : StatusResult.incomplete());

	@Test
	void convertsMessagesToTypedView() {
		assertThat(processor.apply(Map.of("id", "750xx000000001", "state", "InProgress")))
			.isEqualTo(StatusResult.incomplete());
		assertThat(processor.apply(Map.of("id", "750xx000000001", "state", "JobComplete")))
			.isEqualTo(StatusResult.completed("750xx000000001"));
	}

	@Test
	void unconvertibleMessageFails() {
		assertThatIllegalArgumentException()
			.isThrownBy(() -> processor.apply(Map.of("id", "750xx000000001", "unknown", true)));
	}

	@Test
	void firstMessageCompletesWithTheMessage() {
		Map<String, Object> message = Map.of("id", "42");

		assertThat(StreamProcessors.firstMessage().apply(message)).isEqualTo(StatusResult.completed(message));
	}

	@Test
	void typedRejectsNullArguments() {
		assertThatIllegalArgumentException()
			.isThrownBy(() -> StreamProcessors.typed(null, mapper, event -> StatusResult.incomplete()));
	}

}
