package org.javai.tracelog.instrument;

import java.util.Map;

/**
 * Optional capability that records each traced call as a named step with its
 * resolved parameters, e.g. in a test report.
 * <p>
 * A reporter is picked up from {@code META-INF/services} by
 * {@link StepReporters#detected()}, or handed to a {@link ClassInstrumentor}
 * directly. Without one, {@link #NONE} disables step reporting.
 */
public interface StepReporter {

	StepReporter NONE = NoOpStepReporter.INSTANCE;

	/**
	 * Opens the step for a call about to run.
	 *
	 * @param title      the rendered title of the call
	 * @param parameters text of the value bound to each parameter, receiver excluded
	 */
	StepScope openStep(String title, Map<String, String> parameters);

	/**
	 * Whether opening steps has any effect; the tracer skips step bookkeeping
	 * for disabled reporters.
	 */
	default boolean isEnabled() {
		return true;
	}
}
