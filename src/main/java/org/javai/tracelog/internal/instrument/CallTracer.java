package org.javai.tracelog.internal.instrument;

import java.util.List;
import java.util.Objects;
import org.javai.tracelog.instrument.StepReporter;
import org.javai.tracelog.instrument.StepScope;
import org.javai.tracelog.internal.bind.ArgumentBinder;
import org.javai.tracelog.internal.bind.ArgumentBindings;
import org.javai.tracelog.internal.bind.ArgumentClassifier;
import org.javai.tracelog.internal.bind.CallArguments;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.javai.tracelog.internal.bind.CallableRole;
import org.javai.tracelog.internal.bind.ParameterDescriptor;
import org.javai.tracelog.internal.template.TitleExtractor;
import org.javai.tracelog.internal.template.TitleRenderer;
import org.javai.tracelog.log.TraceLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps callables so that every call emits one {@code [name]: title} line at
 * INFO and, when a step reporter is enabled, runs inside a step named after
 * the title.
 * <p>
 * Tracing never changes the outcome of a call. When the title cannot be
 * computed the call proceeds untraced; failures of the callable itself are
 * propagated unchanged after the trace line has been written.
 */
public class CallTracer {

	private static final Logger logger = LoggerFactory.getLogger(CallTracer.class);

	private final StepReporter stepReporter;
	private final ArgumentRepresenter representer;

	public CallTracer(StepReporter stepReporter) {
		this(stepReporter, new ArgumentRepresenter());
	}

	public CallTracer(StepReporter stepReporter, ArgumentRepresenter representer) {
		this.stepReporter = Objects.requireNonNull(stepReporter, "stepReporter must not be null");
		this.representer = Objects.requireNonNull(representer, "representer must not be null");
	}

	public TracedCallable wrap(CallableDescriptor descriptor, Invoker invoker) {
		CallableRole role = ArgumentClassifier.classify(descriptor);
		return new TracedCallable(this, descriptor, role, TitleExtractor.extract(descriptor), invoker);
	}

	public StepReporter stepReporter() {
		return stepReporter;
	}

	Object trace(TracedCallable callable, CallArguments arguments) throws Throwable {
		CallableDescriptor descriptor = callable.descriptor();
		Invoker invoker = callable.invoker();
		if (descriptor.isInternal()) {
			return invoker.invoke(arguments);
		}

		Trace trace;
		try {
			trace = prepare(callable, arguments);
		}
		catch (RuntimeException e) {
			logger.warn("Could not compute the trace of {}; calling it untraced", descriptor.qualifiedName(), e);
			return invoker.invoke(arguments);
		}

		TraceLog.info("[%s]: %s".formatted(descriptor.name(), trace.title()), false);

		if (descriptor.constructor() || !stepReporter.isEnabled()) {
			return invoker.invoke(arguments);
		}
		StepScope step = openStep(trace);
		Object result;
		try {
			result = invoker.invoke(arguments);
		}
		catch (Throwable failure) {
			failStep(step, failure, trace);
			closeStep(step, trace);
			throw failure;
		}
		closeStep(step, trace);
		return result;
	}

	private Trace prepare(TracedCallable callable, CallArguments arguments) {
		CallableDescriptor descriptor = callable.descriptor();
		List<ParameterDescriptor> parameters;
		CallArguments effective;
		if (descriptor.constructor() || !callable.role().stripsReceiver()) {
			parameters = descriptor.parameters();
			effective = arguments;
		}
		else {
			parameters = descriptor.templateParameters(callable.role());
			effective = arguments.withoutReceiver();
		}
		ArgumentBindings bindings = ArgumentBinder.bind(parameters, effective);
		String title = descriptor.hasDocumentation()
				? TitleRenderer.render(callable.titleTemplate(), titleBindings(callable, bindings))
				: callable.titleTemplate();
		return new Trace(title, bindings);
	}

	// the type token of a class method is not shown, but its placeholder must not stay literal
	private static ArgumentBindings titleBindings(TracedCallable callable, ArgumentBindings bindings) {
		if (callable.role() != CallableRole.CLASS_METHOD || callable.descriptor().constructor()) {
			return bindings;
		}
		return bindings.withBlank(callable.descriptor().parameters().get(0).name());
	}

	private StepScope openStep(Trace trace) {
		try {
			return stepReporter.openStep(trace.title(), representer.parameters(trace.bindings()));
		}
		catch (RuntimeException e) {
			logger.warn("Step reporter {} could not open a step for '{}'", stepReporter, trace.title(), e);
			return StepScope.NONE;
		}
	}

	private void failStep(StepScope step, Throwable failure, Trace trace) {
		try {
			step.fail(failure);
		}
		catch (RuntimeException e) {
			logger.warn("Step reporter {} could not record the failure of '{}'", stepReporter, trace.title(), e);
		}
	}

	private void closeStep(StepScope step, Trace trace) {
		try {
			step.close();
		}
		catch (RuntimeException e) {
			logger.warn("Step reporter {} could not close the step '{}'", stepReporter, trace.title(), e);
		}
	}

	private record Trace(String title, ArgumentBindings bindings) {
	}
}
