package org.javai.tracelog.api;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Human-authored title logged whenever a traced method is invoked.
 * <p>
 * Example:
 *
 * <pre>
 * {@code
 * @Title("Open the file {{path}} in {{mode}} mode")
 * public void open(String path, @Default("read") String mode) {
 *     ...
 * }
 * }
 * </pre>
 *
 * Each {@code {{name}}} placeholder is replaced with the value the parameter of
 * that name received at call time. The text may continue with {@code @param} or
 * {@code @return} lines; only the part before the first such marker is used as
 * the title, with line breaks removed.
 * <p>
 * The annotation is looked up on the method itself and on the interface or
 * superclass declarations it overrides. Methods without a title are logged with
 * their bare name.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ ElementType.METHOD, ElementType.CONSTRUCTOR })
public @interface Title {

	/**
	 * The title template.
	 */
	String value();
}
