package org.javai.tracelog.instrument;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.javai.tracelog.api.Untraced;
import org.javai.tracelog.config.TraceConfig;
import org.javai.tracelog.internal.bind.ArgumentBinder;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.javai.tracelog.internal.bind.DescriptorFactory;
import org.javai.tracelog.internal.instrument.CallTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedMethod;

/**
 * Instruments the public methods of classes whose simple name matches the
 * configured fragments.
 * <p>
 * Instrumentation is idempotent: a method is wrapped at most once per
 * process, and instrumenting a class again, from any instrumentor, hands out
 * the handles created the first time. Methods declared by {@link Object},
 * compiler-generated methods and internal methods (named with a leading
 * {@code _} or annotated {@link Untraced}) are never wrapped.
 */
public class ClassInstrumentor {

	private static final Logger logger = LoggerFactory.getLogger(ClassInstrumentor.class);

	private static final ClassValue<ConcurrentMap<Method, TracedMethod>> marks = new ClassValue<>() {
		@Override
		protected ConcurrentMap<Method, TracedMethod> computeValue(Class<?> type) {
			return new ConcurrentHashMap<>();
		}
	};

	private final ClassNameMatcher matcher;
	private final CallTracer tracer;
	private final ArgumentBinder binder = new ArgumentBinder();

	public ClassInstrumentor(ClassNameMatcher matcher, StepReporter stepReporter) {
		this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
		this.tracer = new CallTracer(Objects.requireNonNull(stepReporter, "stepReporter must not be null"));
	}

	public static ClassInstrumentor fromConfig(TraceConfig config, StepReporter stepReporter) {
		return new ClassInstrumentor(ClassNameMatcher.from(config), stepReporter);
	}

	public ClassNameMatcher matcher() {
		return matcher;
	}

	public StepReporter stepReporter() {
		return tracer.stepReporter();
	}

	public <T> InstrumentedClass<T> instrument(Class<T> type) {
		Objects.requireNonNull(type, "type must not be null");
		ConcurrentMap<Method, TracedMethod> classMarks = marks.get(type);
		Map<Method, TracedMethod> traced = new LinkedHashMap<>();
		for (Method method : type.getMethods()) {
			if (!isCandidate(method) || !matcher.matches(method.getDeclaringClass().getSimpleName())) {
				continue;
			}
			traced.put(method, classMarks.computeIfAbsent(method, this::trace));
		}
		logger.debug("Instrumented {} method(s) of {}", traced.size(), type.getName());
		return new InstrumentedClass<>(type, traced, tracer, binder, matcher.matches(type.getSimpleName()));
	}

	private TracedMethod trace(Method method) {
		return new TracedMethod(method, DescriptorFactory.forMethod(method), tracer, binder);
	}

	static boolean isCandidate(Method method) {
		if (method.getDeclaringClass() == Object.class || method.isBridge() || method.isSynthetic()) {
			return false;
		}
		if (!Modifier.isPublic(method.getModifiers()) || CallableDescriptor.isInternalName(method.getName())) {
			return false;
		}
		return !new AnnotatedMethod(method).hasMethodAnnotation(Untraced.class);
	}
}
