package org.javai.tracelog;

import org.javai.tracelog.config.TraceConfig;
import org.javai.tracelog.config.TraceConfigLoader;
import org.javai.tracelog.instrument.ClassInstrumentor;
import org.javai.tracelog.instrument.InstrumentedClass;
import org.javai.tracelog.instrument.StepReporters;

/**
 * Entry point for instrumenting classes with the process configuration.
 * <p>
 * Classes are selected by the {@code class_name_*} entries of
 * {@code tracelog.yaml}; calls are reported as steps through the
 * {@link org.javai.tracelog.instrument.StepReporter} registered on the
 * classpath, if any.
 */
public final class Tracing {

	private Tracing() {
	}

	public static <T> InstrumentedClass<T> instrument(Class<T> type) {
		return instrumentor().instrument(type);
	}

	public static ClassInstrumentor instrumentor() {
		return Holder.INSTRUMENTOR;
	}

	public static TraceConfig config() {
		return TraceConfigLoader.shared();
	}

	private static final class Holder {

		static final ClassInstrumentor INSTRUMENTOR =
				ClassInstrumentor.fromConfig(TraceConfigLoader.shared(), StepReporters.detected());
	}
}
