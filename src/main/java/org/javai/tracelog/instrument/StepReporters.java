package org.javai.tracelog.instrument;

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the process-wide {@link StepReporter} once, on first use.
 */
public final class StepReporters {

	private static final Logger logger = LoggerFactory.getLogger(StepReporters.class);

	private StepReporters() {
	}

	/**
	 * The first reporter registered as a {@code java.util.ServiceLoader}
	 * provider of {@link StepReporter}, or {@link StepReporter#NONE}.
	 */
	public static StepReporter detected() {
		return Holder.DETECTED;
	}

	static StepReporter detect(ClassLoader classLoader) {
		try {
			return ServiceLoader.load(StepReporter.class, classLoader)
					.findFirst()
					.map(reporter -> {
						logger.debug("Reporting traced calls as steps through {}", reporter.getClass().getName());
						return reporter;
					})
					.orElse(StepReporter.NONE);
		}
		catch (ServiceConfigurationError e) {
			logger.warn("Step reporter could not be loaded; step reporting is disabled", e);
			return StepReporter.NONE;
		}
	}

	private static final class Holder {

		static final StepReporter DETECTED = detect(StepReporters.class.getClassLoader());
	}
}
