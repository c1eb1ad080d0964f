package org.javai.tracelog.instrument;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.javai.tracelog.api.Title;
import org.javai.tracelog.internal.bind.ArgumentBinder;
import org.javai.tracelog.internal.bind.CallArguments;
import org.javai.tracelog.internal.bind.CallableDescriptor;
import org.javai.tracelog.internal.bind.DescriptorFactory;
import org.javai.tracelog.internal.bind.ExecutableResolver;
import org.javai.tracelog.internal.instrument.CallTracer;
import org.javai.tracelog.internal.instrument.TracedCallable;
import org.springframework.core.BridgeMethodResolver;
import org.springframework.lang.Nullable;
import org.springframework.util.ReflectionUtils;

/**
 * A class whose matching methods have been instrumented. Calls made through
 * this registry, or through a {@link #proxy(Class, Object) proxy}, are traced
 * when the method is; every other call goes straight to the method.
 *
 * <pre>
 * InstrumentedClass&lt;LoginPage&gt; page = Tracing.instrument(LoginPage.class);
 * page.invoke(loginPage, "login", "alice", "secret");
 * // INFO  [login]: Logs in as alice
 * </pre>
 */
public final class InstrumentedClass<T> {

	private final Class<T> type;
	private final Map<Method, TracedMethod> tracedMethods;
	private final CallTracer tracer;
	private final ArgumentBinder binder;
	private final boolean tracesConstructors;
	private final ConcurrentMap<Constructor<?>, TracedCallable> tracedConstructors = new ConcurrentHashMap<>();
	private final ConcurrentMap<Method, Method> implementations = new ConcurrentHashMap<>();

	InstrumentedClass(Class<T> type, Map<Method, TracedMethod> tracedMethods, CallTracer tracer,
			ArgumentBinder binder, boolean tracesConstructors) {
		this.type = type;
		this.tracedMethods = Collections.unmodifiableMap(new LinkedHashMap<>(tracedMethods));
		this.tracer = tracer;
		this.binder = binder;
		this.tracesConstructors = tracesConstructors;
	}

	public Class<T> type() {
		return type;
	}

	public Collection<TracedMethod> tracedMethods() {
		return tracedMethods.values();
	}

	public Optional<TracedMethod> traced(Method method) {
		return Optional.ofNullable(tracedMethods.get(method));
	}

	public boolean isTraced(String methodName) {
		return tracedMethods.keySet().stream().anyMatch(m -> m.getName().equals(methodName));
	}

	/**
	 * Calls the public method named {@code name} that accepts {@code args}.
	 *
	 * @throws IllegalArgumentException when no single method accepts the arguments
	 */
	public Object invoke(T target, String name, Object... args) throws Throwable {
		Objects.requireNonNull(target, "target must not be null");
		Object[] values = args != null ? args : new Object[0];
		Method method = ExecutableResolver.findMethod(type, name, values, false);
		return call(method, target, values);
	}

	public Object invokeStatic(String name, Object... args) throws Throwable {
		Object[] values = args != null ? args : new Object[0];
		Method method = ExecutableResolver.findMethod(type, name, values, true);
		return call(method, null, values);
	}

	/**
	 * Calls the method named {@code name} with arguments passed by parameter
	 * name. The method must not be overloaded.
	 *
	 * @param target the receiver, or {@code null} for a static method
	 */
	public Object invokeNamed(@Nullable T target, String name, Map<String, ?> namedArgs) throws Throwable {
		Method method = ExecutableResolver.findMethodByName(type, name);
		TracedMethod traced = tracedMethods.get(method);
		if (traced == null) {
			traced = new TracedMethod(method, untraced(DescriptorFactory.forMethod(method)), tracer, binder);
		}
		return traced.invokeNamed(target, namedArgs);
	}

	/**
	 * Constructs an instance through the public constructor accepting
	 * {@code args}. A constructor annotated with {@link Title} writes its title
	 * line when the class matched; constructors are never reported as steps.
	 */
	public T newInstance(Object... args) throws Throwable {
		Object[] values = args != null ? args : new Object[0];
		Constructor<T> constructor = ExecutableResolver.findConstructor(type, values);
		ReflectionUtils.makeAccessible(constructor);
		if (!tracesConstructors || !constructor.isAnnotationPresent(Title.class)) {
			return construct(constructor, values);
		}
		TracedCallable traced = tracedConstructors.computeIfAbsent(constructor, c -> tracer.wrap(
				DescriptorFactory.forConstructor(c),
				arguments -> construct(constructor, arguments.positional().toArray())));
		return type.cast(traced.call(CallArguments.of(values)));
	}

	/**
	 * A JDK proxy implementing {@code iface} that forwards to {@code target},
	 * tracing the calls of traced methods.
	 */
	public <I> I proxy(Class<I> iface, T target) {
		Objects.requireNonNull(target, "target must not be null");
		if (!iface.isInterface()) {
			throw new IllegalArgumentException(iface.getName() + " is not an interface");
		}
		if (!iface.isInstance(target)) {
			throw new IllegalArgumentException(type.getName() + " does not implement " + iface.getName());
		}
		InvocationHandler handler = (proxy, method, args) -> {
			Object[] values = args != null ? args : new Object[0];
			if (method.getDeclaringClass() == Object.class) {
				return invokeDirect(method, target, values);
			}
			return call(implementationOf(method), target, values);
		};
		return iface.cast(Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[] { iface }, handler));
	}

	private Object call(Method method, @Nullable Object target, Object[] args) throws Throwable {
		TracedMethod traced = tracedMethods.get(method);
		if (traced != null) {
			return traced.invoke(target, args);
		}
		return invokeDirect(method, target, args);
	}

	private Method implementationOf(Method interfaceMethod) {
		return implementations.computeIfAbsent(interfaceMethod, m -> {
			try {
				return BridgeMethodResolver.findBridgedMethod(type.getMethod(m.getName(), m.getParameterTypes()));
			}
			catch (NoSuchMethodException e) {
				return m;
			}
		});
	}

	private static CallableDescriptor untraced(CallableDescriptor descriptor) {
		return new CallableDescriptor(descriptor.name(), descriptor.ownerType(), descriptor.parameters(),
				descriptor.documentation(), descriptor.constructor(), true);
	}

	private static Object invokeDirect(Method method, @Nullable Object target, Object[] args) throws Throwable {
		ReflectionUtils.makeAccessible(method);
		try {
			return method.invoke(target, args);
		}
		catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	private static <T> T construct(Constructor<T> constructor, Object[] args) throws Throwable {
		try {
			return constructor.newInstance(args);
		}
		catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	@Override
	public String toString() {
		return "InstrumentedClass[" + type.getName() + ", traced=" + tracedMethods.size() + "]";
	}
}
