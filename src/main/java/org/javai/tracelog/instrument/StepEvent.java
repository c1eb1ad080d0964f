package org.javai.tracelog.instrument;

import java.time.Instant;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Lifecycle event of a reported step.
 */
public record StepEvent(
		StepEventType type,
		String title,
		Map<String, String> parameters,
		Instant timestamp,
		@Nullable Long durationMs,
		String error) {

	public StepEvent {
		type = type != null ? type : StepEventType.STARTED;
		title = title != null ? title : "";
		parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
		timestamp = timestamp != null ? timestamp : Instant.now();
		error = error != null ? error : "";
	}
}
