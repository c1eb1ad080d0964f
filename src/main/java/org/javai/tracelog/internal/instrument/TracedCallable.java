package org.javai.tracelog.internal.instrument;

import java.util.Objects;
import org.javai.tracelog.internal.bind.CallArguments;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.javai.tracelog.internal.bind.CallableRole;

/**
 * A callable wrapped by a {@link CallTracer}. Role and title template are
 * derived once, when the callable is wrapped.
 */
public final class TracedCallable {

	private final CallTracer tracer;
	private final CallableDescriptor descriptor;
	private final CallableRole role;
	private final String titleTemplate;
	private final Invoker invoker;

	TracedCallable(CallTracer tracer, CallableDescriptor descriptor, CallableRole role, String titleTemplate,
			Invoker invoker) {
		this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
		this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
		this.role = Objects.requireNonNull(role, "role must not be null");
		this.titleTemplate = Objects.requireNonNull(titleTemplate, "titleTemplate must not be null");
		this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
	}

	/**
	 * Logs the call, reports it as a step when a reporter is enabled, and
	 * returns or throws exactly what the original callable does.
	 *
	 * @param arguments the call-site arguments, receiver first for instance methods
	 */
	public Object call(CallArguments arguments) throws Throwable {
		return tracer.trace(this, arguments);
	}

	public CallableDescriptor descriptor() {
		return descriptor;
	}

	public CallableRole role() {
		return role;
	}

	public String titleTemplate() {
		return titleTemplate;
	}

	Invoker invoker() {
		return invoker;
	}

	@Override
	public String toString() {
		return "TracedCallable[" + descriptor.qualifiedName() + " as " + role + "]";
	}
}
