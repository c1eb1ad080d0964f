package org.javai.tracelog.internal.bind;

import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Declared parameter of a traced callable.
 *
 * @param name         the parameter name
 * @param type         the declared Java type
 * @param defaultValue text of the declared default, or {@code null} when the parameter has none
 * @param kind         positional-or-keyword, or varargs
 */
public record ParameterDescriptor(
		String name,
		Class<?> type,
		@Nullable String defaultValue,
		ParameterKind kind
) {

	/**
	 * Name of the synthetic leading parameter standing for the receiver of an
	 * instance method, as in a Java receiver parameter declaration.
	 */
	public static final String RECEIVER_NAME = "this";

	public ParameterDescriptor {
		Objects.requireNonNull(name, "name must not be null");
		type = type != null ? type : Object.class;
		kind = kind != null ? kind : ParameterKind.POSITIONAL_OR_KEYWORD;
	}

	public static ParameterDescriptor of(String name, Class<?> type) {
		return new ParameterDescriptor(name, type, null, ParameterKind.POSITIONAL_OR_KEYWORD);
	}

	public static ParameterDescriptor receiver(Class<?> ownerType) {
		return new ParameterDescriptor(RECEIVER_NAME, ownerType, null, ParameterKind.POSITIONAL_OR_KEYWORD);
	}

	public boolean hasDefault() {
		return defaultValue != null;
	}

	public boolean isReceiver() {
		return RECEIVER_NAME.equals(name);
	}
}
