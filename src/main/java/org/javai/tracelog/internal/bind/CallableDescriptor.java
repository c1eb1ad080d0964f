package org.javai.tracelog.internal.bind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * Everything the tracer needs to know about a callable, captured once when the
 * callable is wrapped rather than re-inspected on every call.
 *
 * @param name          bare name of the callable; the simple type name for constructors
 * @param ownerType     the declaring type, or {@code null} for a free function
 * @param parameters    declared parameters in order, including the synthetic receiver of instance methods
 * @param documentation the title template, or {@code null} when the callable carries none
 * @param constructor   whether the callable creates an instance of {@code ownerType}
 * @param untraced      whether the callable was explicitly excluded from tracing
 */
public record CallableDescriptor(
		String name,
		@Nullable Class<?> ownerType,
		List<ParameterDescriptor> parameters,
		@Nullable String documentation,
		boolean constructor,
		boolean untraced
) {

	/** Leading character of names reserved for internal use. */
	public static final String INTERNAL_MARKER = "_";

	public CallableDescriptor {
		Objects.requireNonNull(name, "name must not be null");
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
	}

	public static Builder builder(String name) {
		return new Builder(name);
	}

	/**
	 * Internal callables are invoked directly, without a log line or a step.
	 */
	public boolean isInternal() {
		return untraced || isInternalName(name);
	}

	public boolean hasDocumentation() {
		return documentation != null && !documentation.isBlank();
	}

	/**
	 * Declared parameters that receive call-site values once the receiver, if
	 * the role has one, has been set aside.
	 */
	public List<ParameterDescriptor> templateParameters(CallableRole role) {
		if (role.stripsReceiver() && !parameters.isEmpty()) {
			return parameters.subList(1, parameters.size());
		}
		return parameters;
	}

	public String qualifiedName() {
		return ownerType != null ? ownerType.getSimpleName() + "." + name : name;
	}

	public static boolean isInternalName(String name) {
		return name.startsWith(INTERNAL_MARKER);
	}

	public static final class Builder {

		private final String name;
		private Class<?> ownerType;
		private final List<ParameterDescriptor> parameters = new ArrayList<>();
		private String documentation;
		private boolean constructor;
		private boolean untraced;

		private Builder(String name) {
			this.name = Objects.requireNonNull(name, "name must not be null");
		}

		public Builder ownerType(Class<?> ownerType) {
			this.ownerType = ownerType;
			return this;
		}

		/**
		 * Adds the synthetic receiver parameter; call before any other parameter.
		 */
		public Builder receiver() {
			Objects.requireNonNull(ownerType, "ownerType must be set before the receiver");
			parameters.add(ParameterDescriptor.receiver(ownerType));
			return this;
		}

		public Builder parameter(String name) {
			return parameter(name, Object.class);
		}

		public Builder parameter(String name, Class<?> type) {
			parameters.add(ParameterDescriptor.of(name, type));
			return this;
		}

		public Builder parameterWithDefault(String name, String defaultValue) {
			parameters.add(new ParameterDescriptor(name, Object.class, defaultValue, ParameterKind.POSITIONAL_OR_KEYWORD));
			return this;
		}

		public Builder varargs(String name) {
			parameters.add(new ParameterDescriptor(name, Object[].class, null, ParameterKind.VAR_POSITIONAL));
			return this;
		}

		public Builder parameter(ParameterDescriptor parameter) {
			parameters.add(Objects.requireNonNull(parameter, "parameter must not be null"));
			return this;
		}

		public Builder documentation(@Nullable String documentation) {
			this.documentation = documentation;
			return this;
		}

		public Builder constructor(boolean constructor) {
			this.constructor = constructor;
			return this;
		}

		public Builder untraced(boolean untraced) {
			this.untraced = untraced;
			return this;
		}

		public CallableDescriptor build() {
			return new CallableDescriptor(name, ownerType, parameters, documentation, constructor, untraced);
		}
	}
}
