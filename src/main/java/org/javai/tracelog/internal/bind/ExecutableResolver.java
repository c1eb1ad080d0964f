package org.javai.tracelog.internal.bind;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.util.ClassUtils;

/**
 * Picks the public method or constructor that accepts a given set of runtime
 * arguments.
 */
public final class ExecutableResolver {

	private ExecutableResolver() {
	}

	public static Method findMethod(Class<?> type, String name, Object[] args, boolean staticOnly) {
		List<Method> candidates = Arrays.stream(type.getMethods())
				.filter(m -> !m.isBridge())
				.filter(m -> m.getName().equals(name))
				.filter(m -> !staticOnly || Modifier.isStatic(m.getModifiers()))
				.filter(accepts(args))
				.toList();
		return single(candidates, "method '%s' of %s".formatted(name, type.getName()), args);
	}

	/**
	 * Finds the public method named {@code name}, which must not be overloaded.
	 */
	public static Method findMethodByName(Class<?> type, String name) {
		List<Method> candidates = Arrays.stream(type.getMethods())
				.filter(m -> !m.isBridge())
				.filter(m -> m.getName().equals(name))
				.toList();
		if (candidates.isEmpty()) {
			throw new IllegalArgumentException("No public method '%s' on %s".formatted(name, type.getName()));
		}
		if (candidates.size() > 1) {
			throw new IllegalArgumentException(
					"Method '%s' of %s is overloaded; call it with positional arguments".formatted(name, type.getName()));
		}
		return candidates.get(0);
	}

	@SuppressWarnings("unchecked")
	public static <T> Constructor<T> findConstructor(Class<T> type, Object[] args) {
		List<Constructor<?>> candidates = Arrays.stream(type.getConstructors())
				.filter(accepts(args))
				.toList();
		return (Constructor<T>) single(candidates, "constructor of " + type.getName(), args);
	}

	private static <E extends Executable> E single(List<E> candidates, String what, Object[] args) {
		if (candidates.isEmpty()) {
			throw new IllegalArgumentException("No public %s accepts %s".formatted(what, Arrays.toString(args)));
		}
		if (candidates.size() == 1) {
			return candidates.get(0);
		}
		List<E> exact = candidates.stream().filter(e -> !e.isVarArgs()).toList();
		if (exact.size() == 1) {
			return exact.get(0);
		}
		throw new IllegalArgumentException("Ambiguous %s for %s".formatted(what, Arrays.toString(args)));
	}

	private static Predicate<Executable> accepts(Object[] args) {
		return executable -> {
			Class<?>[] types = executable.getParameterTypes();
			if (matches(types, args, types.length)) {
				return true;
			}
			return executable.isVarArgs() && matchesVarArgs(types, args);
		};
	}

	private static boolean matches(Class<?>[] types, Object[] args, int count) {
		if (args.length != count) {
			return false;
		}
		for (int i = 0; i < count; i++) {
			if (!ClassUtils.isAssignableValue(types[i], args[i])) {
				return false;
			}
		}
		return true;
	}

	private static boolean matchesVarArgs(Class<?>[] types, Object[] args) {
		int fixed = types.length - 1;
		if (args.length < fixed) {
			return false;
		}
		for (int i = 0; i < fixed; i++) {
			if (!ClassUtils.isAssignableValue(types[i], args[i])) {
				return false;
			}
		}
		Class<?> componentType = types[fixed].getComponentType();
		for (int i = fixed; i < args.length; i++) {
			if (!ClassUtils.isAssignableValue(componentType, args[i])) {
				return false;
			}
		}
		return true;
	}
}
