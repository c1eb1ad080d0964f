package org.javai.tracelog.log;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The caller of a {@link TraceLog} method and the caller's own caller, read
 * from the current thread's stack.
 */
final class CallerFrames {

	private static final Logger logger = LoggerFactory.getLogger(CallerFrames.class);

	private static final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

	private static final String TEST_NAME_PREFIX = "test";

	private static final Set<String> TEST_ANNOTATIONS = Set.of(
			"Test", "ParameterizedTest", "RepeatedTest", "TestFactory", "TestTemplate");

	private static final CallerFrames NONE = new CallerFrames(List.of());

	private final List<StackWalker.StackFrame> frames;

	private CallerFrames(List<StackWalker.StackFrame> frames) {
		this.frames = frames;
	}

	/**
	 * Captures up to two frames above the facade. Yields no frames when the
	 * stack cannot be read.
	 */
	static CallerFrames capture() {
		try {
			List<StackWalker.StackFrame> frames = walker.walk(stream -> stream
					.dropWhile(CallerFrames::isFacadeFrame)
					.limit(2)
					.collect(Collectors.toList()));
			return new CallerFrames(frames);
		}
		catch (RuntimeException e) {
			logger.debug("Could not read the caller frames of a log call", e);
			return NONE;
		}
	}

	Optional<String> callerName() {
		return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(0).getMethodName());
	}

	Optional<String> grandcallerName() {
		return frames.size() < 2 ? Optional.empty() : Optional.of(frames.get(1).getMethodName());
	}

	/**
	 * Whether the caller was invoked directly by a test method: one whose name
	 * starts with {@code test}, or that carries a JUnit or TestNG test annotation.
	 */
	boolean isCalledFromTest() {
		if (frames.size() < 2) {
			return false;
		}
		StackWalker.StackFrame grandcaller = frames.get(1);
		if (grandcaller.getMethodName().startsWith(TEST_NAME_PREFIX)) {
			return true;
		}
		try {
			return hasTestAnnotation(grandcaller.getDeclaringClass(), grandcaller.getMethodName());
		}
		catch (RuntimeException | LinkageError e) {
			logger.debug("Could not inspect {} for test annotations", grandcaller, e);
			return false;
		}
	}

	private static boolean hasTestAnnotation(Class<?> type, String methodName) {
		for (Method method : type.getDeclaredMethods()) {
			if (!method.getName().equals(methodName)) {
				continue;
			}
			for (Annotation annotation : method.getAnnotations()) {
				if (TEST_ANNOTATIONS.contains(annotation.annotationType().getSimpleName())) {
					return true;
				}
			}
		}
		return false;
	}

	private static boolean isFacadeFrame(StackWalker.StackFrame frame) {
		Class<?> type = frame.getDeclaringClass();
		return type == CallerFrames.class || type == TraceLog.class;
	}
}
