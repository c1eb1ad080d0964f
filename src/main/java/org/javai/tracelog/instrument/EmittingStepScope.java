package org.javai.tracelog.instrument;

import java.util.Map;
import java.util.Objects;

/**
 * Emits STARTED when opened, then exactly one of PASSED or FAILED.
 */
final class EmittingStepScope implements StepScope {

	private final StepEmitter emitter;
	private final String title;
	private final Map<String, String> parameters;
	private final long startNanos;
	private boolean closed;

	EmittingStepScope(StepEmitter emitter, String title, Map<String, String> parameters) {
		this.emitter = Objects.requireNonNull(emitter, "emitter must not be null");
		this.title = title != null ? title : "";
		this.parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
		this.startNanos = System.nanoTime();
		emitter.emit(StepEventType.STARTED, this.title, this.parameters, null, null);
	}

	@Override
	public void fail(Throwable failure) {
		if (closed) {
			return;
		}
		closed = true;
		emitter.emit(StepEventType.FAILED, title, parameters, elapsedMillis(), String.valueOf(failure));
	}

	@Override
	public void close() {
		if (closed) {
			return;
		}
		closed = true;
		emitter.emit(StepEventType.PASSED, title, parameters, elapsedMillis(), null);
	}

	private long elapsedMillis() {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}
}
