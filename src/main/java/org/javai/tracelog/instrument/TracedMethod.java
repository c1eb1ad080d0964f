package org.javai.tracelog.instrument;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.tracelog.internal.bind.ArgumentBinder;
import org.javai.tracelog.internal.bind.CallArguments;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.javai.tracelog.internal.bind.ParameterDescriptor;
import org.javai.tracelog.internal.bind.ParameterKind;
import org.javai.tracelog.internal.instrument.CallTracer;
import org.javai.tracelog.internal.instrument.TracedCallable;
import org.springframework.lang.Nullable;
import org.springframework.util.ReflectionUtils;

/**
 * Traced handle of one method of an instrumented class. Calling it logs the
 * title line, reports a step when a reporter is enabled, and then invokes
 * the method, returning or throwing exactly what the method does.
 */
public final class TracedMethod {

	private final Method method;
	private final TracedCallable callable;
	private final boolean instanceMethod;
	private final List<ParameterDescriptor> invocationParameters;
	private final ArgumentBinder binder;

	TracedMethod(Method method, CallableDescriptor descriptor, CallTracer tracer, ArgumentBinder binder) {
		this.method = method;
		this.instanceMethod = !Modifier.isStatic(method.getModifiers());
		this.binder = binder;
		this.invocationParameters = invocationParameters(method, descriptor);
		ReflectionUtils.makeAccessible(method);
		this.callable = tracer.wrap(descriptor, this::invokeUntraced);
	}

	public Method method() {
		return method;
	}

	public CallableDescriptor descriptor() {
		return callable.descriptor();
	}

	public String titleTemplate() {
		return callable.titleTemplate();
	}

	/**
	 * Calls the method with positional arguments.
	 *
	 * @param target the receiver; ignored for static methods
	 */
	public Object invoke(@Nullable Object target, Object... args) throws Throwable {
		CallArguments arguments = CallArguments.of(args != null ? args : new Object[0]);
		return callable.call(instanceMethod ? arguments.withReceiver(target) : arguments);
	}

	/**
	 * Calls the method with arguments passed by parameter name; omitted
	 * parameters take their {@code @Default} or {@code null}.
	 */
	public Object invokeNamed(@Nullable Object target, Map<String, ?> namedArgs) throws Throwable {
		CallArguments arguments = CallArguments.named(namedArgs);
		return callable.call(instanceMethod ? arguments.withReceiver(target) : arguments);
	}

	private Object invokeUntraced(CallArguments arguments) throws Throwable {
		Object target = instanceMethod ? arguments.receiver() : null;
		CallArguments methodArguments = instanceMethod ? arguments.withoutReceiver() : arguments;
		Object[] javaArgs = binder.invocationArguments(method, invocationParameters, methodArguments);
		try {
			return method.invoke(target, javaArgs);
		}
		catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	/**
	 * Parameters the underlying method declares, receiver excluded. Falls back
	 * to the reflected parameters when the descriptor was captured by name only.
	 */
	private static List<ParameterDescriptor> invocationParameters(Method method, CallableDescriptor descriptor) {
		List<ParameterDescriptor> declared = descriptor.parameters();
		if (!declared.isEmpty() && declared.get(0).isReceiver()) {
			declared = declared.subList(1, declared.size());
		}
		if (declared.size() == method.getParameterCount()) {
			return declared;
		}
		List<ParameterDescriptor> reflected = new ArrayList<>();
		Parameter[] parameters = method.getParameters();
		for (int i = 0; i < parameters.length; i++) {
			boolean varargs = method.isVarArgs() && i == parameters.length - 1;
			reflected.add(new ParameterDescriptor(parameters[i].getName(), parameters[i].getType(), null,
					varargs ? ParameterKind.VAR_POSITIONAL : ParameterKind.POSITIONAL_OR_KEYWORD));
		}
		return reflected;
	}

	@Override
	public String toString() {
		return "TracedMethod[" + method.getDeclaringClass().getSimpleName() + "." + method.getName() + "]";
	}
}
