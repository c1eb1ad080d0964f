package org.javai.tracelog.internal.bind;

import java.lang.reflect.Array;
import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.ClassUtils;

/**
 * Maps call-site arguments onto declared parameters.
 */
public final class ArgumentBinder {

	private final ArgumentConverter converter;

	public ArgumentBinder() {
		this(new ArgumentConverter());
	}

	public ArgumentBinder(ArgumentConverter converter) {
		this.converter = Objects.requireNonNull(converter, "converter must not be null");
	}

	/**
	 * Binds each parameter to the positional value at its index, else to the
	 * value passed under its name, else to its declared default, else to
	 * {@code null}. A varargs parameter binds every remaining positional value.
	 */
	public static ArgumentBindings bind(List<ParameterDescriptor> parameters, CallArguments arguments) {
		Map<String, Object> values = new LinkedHashMap<>();
		List<Object> positional = arguments.positional();
		Map<String, Object> named = arguments.named();

		for (int i = 0; i < parameters.size(); i++) {
			ParameterDescriptor parameter = parameters.get(i);
			String name = parameter.name();
			if (parameter.kind() == ParameterKind.VAR_POSITIONAL && i < positional.size()) {
				values.put(name, remaining(positional, i));
			}
			else if (i < positional.size()) {
				values.put(name, positional.get(i));
			}
			else if (named.containsKey(name)) {
				values.put(name, named.get(name));
			}
			else {
				values.put(name, parameter.defaultValue());
			}
		}
		return new ArgumentBindings(values);
	}

	/**
	 * Builds the argument array for a reflective call of {@code executable}.
	 * Omitted parameters take their converted default, or {@code null}; a
	 * primitive parameter with neither is rejected.
	 *
	 * @param parameters declared parameters of {@code executable}, receiver excluded
	 */
	public Object[] invocationArguments(Executable executable, List<ParameterDescriptor> parameters,
			CallArguments arguments) {
		Parameter[] declared = executable.getParameters();
		if (declared.length != parameters.size()) {
			throw new IllegalArgumentException("Descriptor of '%s' declares %d parameters, method has %d"
					.formatted(executable.getName(), parameters.size(), declared.length));
		}
		List<Object> positional = arguments.positional();
		Object[] javaArgs = new Object[declared.length];

		for (int i = 0; i < declared.length; i++) {
			Class<?> type = declared[i].getType();
			ParameterDescriptor parameter = parameters.get(i);

			if (parameter.kind() == ParameterKind.VAR_POSITIONAL && i < positional.size()) {
				javaArgs[i] = packVarArgs(type, positional.subList(i, positional.size()));
				break;
			}
			if (i < positional.size()) {
				javaArgs[i] = positional.get(i);
				continue;
			}
			if (arguments.named().containsKey(parameter.name())) {
				javaArgs[i] = arguments.named().get(parameter.name());
				continue;
			}
			if (parameter.hasDefault()) {
				javaArgs[i] = converter.convert(parameter.defaultValue(), type);
				continue;
			}
			if (parameter.kind() == ParameterKind.VAR_POSITIONAL) {
				javaArgs[i] = Array.newInstance(type.getComponentType(), 0);
				continue;
			}
			if (type.isPrimitive()) {
				throw new IllegalArgumentException(
						"Missing required argument '%s' for '%s'".formatted(parameter.name(), executable.getName()));
			}
			javaArgs[i] = null;
		}
		if (positional.size() > declared.length && !executable.isVarArgs()) {
			throw new IllegalArgumentException("'%s' takes %d arguments but %d were given"
					.formatted(executable.getName(), declared.length, positional.size()));
		}
		return javaArgs;
	}

	private static Object remaining(List<Object> positional, int from) {
		if (positional.size() == from + 1) {
			Object only = positional.get(from);
			if (only != null && only.getClass().isArray()) {
				return only;
			}
		}
		return new ArrayList<>(positional.subList(from, positional.size()));
	}

	private static Object packVarArgs(Class<?> arrayType, List<Object> values) {
		if (values.size() == 1) {
			Object only = values.get(0);
			if (only == null || arrayType.isInstance(only)) {
				return only;
			}
		}
		Class<?> componentType = arrayType.getComponentType();
		Object array = Array.newInstance(componentType, values.size());
		for (int i = 0; i < values.size(); i++) {
			Object value = values.get(i);
			if (!ClassUtils.isAssignableValue(componentType, value)) {
				throw new IllegalArgumentException("Varargs value %s is not a %s"
						.formatted(value, componentType.getName()));
			}
			Array.set(array, i, value);
		}
		return array;
	}
}
