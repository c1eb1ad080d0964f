package org.javai.tracelog.internal.bind;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.List;
import org.javai.tracelog.api.Default;
import org.javai.tracelog.api.Title;
import org.javai.tracelog.api.Untraced;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.MethodParameter;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.core.annotation.AnnotatedMethod;
import org.springframework.lang.Nullable;

/**
 * Captures {@link CallableDescriptor}s from reflective methods and constructors.
 * <p>
 * {@link Title} and {@link Default} are also found on interface and superclass
 * declarations of an overriding method. A method that cannot be introspected
 * is described by its name alone, so it is traced without a template.
 */
public final class DescriptorFactory {

	private static final Logger logger = LoggerFactory.getLogger(DescriptorFactory.class);

	private static final ParameterNameDiscoverer parameterNames = new DefaultParameterNameDiscoverer();

	private DescriptorFactory() {
	}

	public static CallableDescriptor forMethod(Method method) {
		try {
			AnnotatedMethod annotated = new AnnotatedMethod(method);
			Title title = annotated.getMethodAnnotation(Title.class);

			CallableDescriptor.Builder builder = CallableDescriptor.builder(method.getName())
					.ownerType(method.getDeclaringClass())
					.documentation(title != null ? title.value() : null)
					.untraced(annotated.hasMethodAnnotation(Untraced.class));
			if (!Modifier.isStatic(method.getModifiers())) {
				builder.receiver();
			}
			MethodParameter[] methodParameters = annotated.getMethodParameters();
			String[] names = names(method);
			Parameter[] parameters = method.getParameters();
			for (int i = 0; i < parameters.length; i++) {
				Default declaredDefault = methodParameters[i].getParameterAnnotation(Default.class);
				builder.parameter(createParameter(method, parameters[i], names[i], declaredDefault, i));
			}
			return builder.build();
		}
		catch (RuntimeException | LinkageError e) {
			logger.warn("Could not introspect {}; it will be traced by name only", method, e);
			return CallableDescriptor.builder(method.getName()).build();
		}
	}

	public static CallableDescriptor forConstructor(Constructor<?> constructor) {
		Class<?> type = constructor.getDeclaringClass();
		try {
			Title title = constructor.getAnnotation(Title.class);
			CallableDescriptor.Builder builder = CallableDescriptor.builder(type.getSimpleName())
					.ownerType(type)
					.documentation(title != null ? title.value() : null)
					.constructor(true);
			String[] names = names(constructor);
			Parameter[] parameters = constructor.getParameters();
			for (int i = 0; i < parameters.length; i++) {
				Default declaredDefault = parameters[i].getAnnotation(Default.class);
				builder.parameter(createParameter(constructor, parameters[i], names[i], declaredDefault, i));
			}
			return builder.build();
		}
		catch (RuntimeException | LinkageError e) {
			logger.warn("Could not introspect {}; it will be traced by name only", constructor, e);
			return CallableDescriptor.builder(type.getSimpleName()).ownerType(type).constructor(true).build();
		}
	}

	private static ParameterDescriptor createParameter(Executable executable, Parameter parameter, String name,
			@Nullable Default declaredDefault, int index) {
		boolean varargs = executable.isVarArgs() && index == executable.getParameterCount() - 1;
		return new ParameterDescriptor(
				name,
				parameter.getType(),
				declaredDefault != null ? declaredDefault.value() : null,
				varargs ? ParameterKind.VAR_POSITIONAL : ParameterKind.POSITIONAL_OR_KEYWORD);
	}

	private static String[] names(Method method) {
		String[] discovered = parameterNames.getParameterNames(method);
		return discovered != null ? discovered : reflectedNames(method);
	}

	private static String[] names(Constructor<?> constructor) {
		String[] discovered = parameterNames.getParameterNames(constructor);
		return discovered != null ? discovered : reflectedNames(constructor);
	}

	private static String[] reflectedNames(Executable executable) {
		List<String> names = new ArrayList<>();
		for (Parameter parameter : executable.getParameters()) {
			names.add(parameter.getName());
		}
		return names.toArray(String[]::new);
	}
}
