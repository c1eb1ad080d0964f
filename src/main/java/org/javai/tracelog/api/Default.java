package org.javai.tracelog.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the value a parameter takes when a named-argument call omits it.
 * <p>
 * The text is substituted into the title as-is. When the method is invoked
 * through {@code TracedMethod#invokeNamed} without a value for the parameter,
 * the text is also converted to the parameter type and passed to the method,
 * e.g. {@code @Default("3") int retries}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Default {

	String value();
}
