package org.javai.tracelog.internal.bind;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the calling convention of a callable from its declared parameters.
 * <ul>
 * <li>no positional parameter: static method, nothing to strip</li>
 * <li>first parameter is the receiver: instance method</li>
 * <li>no owning type: plain function</li>
 * <li>first parameter is a {@link Class}: class method taking its type token</li>
 * <li>anything else owned by a type: static method</li>
 * </ul>
 */
public final class ArgumentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(ArgumentClassifier.class);

	private ArgumentClassifier() {
	}

	/**
	 * Never throws; a descriptor that cannot be classified is treated as a plain
	 * function so no argument is stripped.
	 */
	public static CallableRole classify(CallableDescriptor descriptor) {
		try {
			return classifyParameters(descriptor);
		}
		catch (RuntimeException e) {
			logger.debug("Could not classify '{}', treating it as a plain function", descriptor.name(), e);
			return CallableRole.FUNCTION;
		}
	}

	private static CallableRole classifyParameters(CallableDescriptor descriptor) {
		List<ParameterDescriptor> positional = descriptor.parameters().stream()
				.filter(p -> p.kind() == ParameterKind.POSITIONAL_OR_KEYWORD)
				.toList();
		if (positional.isEmpty()) {
			return CallableRole.STATIC_METHOD;
		}
		ParameterDescriptor first = positional.get(0);
		if (first.isReceiver()) {
			return CallableRole.INSTANCE_METHOD;
		}
		if (descriptor.ownerType() == null) {
			return CallableRole.FUNCTION;
		}
		return first.type() == Class.class ? CallableRole.CLASS_METHOD : CallableRole.STATIC_METHOD;
	}
}
