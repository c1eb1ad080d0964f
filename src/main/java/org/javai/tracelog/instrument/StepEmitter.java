package org.javai.tracelog.instrument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Step reporter that emits step events to registered listeners. Enabled only
 * when at least one listener is registered.
 *
 * <pre>
 * List&lt;StepEvent&gt; events = new ArrayList&lt;&gt;();
 * ClassInstrumentor instrumentor = new ClassInstrumentor(matcher, StepEmitter.of(events::add));
 * </pre>
 */
public class StepEmitter implements StepReporter {

	private static final Logger logger = LoggerFactory.getLogger(StepEmitter.class);

	private final List<StepListener> listeners;

	public StepEmitter(List<StepListener> listeners) {
		this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
	}

	public static StepEmitter of(StepListener... listeners) {
		List<StepListener> list = new ArrayList<>();
		if (listeners != null) {
			for (StepListener l : listeners) {
				if (l != null) {
					list.add(l);
				}
			}
		}
		return new StepEmitter(list);
	}

	@Override
	public boolean isEnabled() {
		return !listeners.isEmpty();
	}

	@Override
	public StepScope openStep(String title, Map<String, String> parameters) {
		return new EmittingStepScope(this, title, parameters);
	}

	void emit(StepEventType type, String title, Map<String, String> parameters, @Nullable Long durationMs,
			@Nullable String error) {
		if (listeners.isEmpty()) {
			return;
		}
		StepEvent event = new StepEvent(type, title, parameters, Instant.now(), durationMs, error);
		for (StepListener listener : listeners) {
			try {
				listener.onEvent(event);
			}
			catch (RuntimeException e) {
				logger.warn("Step listener {} failed on {} event for '{}'", listener, type, title, e);
			}
		}
	}
}
