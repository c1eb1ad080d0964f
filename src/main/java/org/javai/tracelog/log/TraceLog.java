package org.javai.tracelog.log;

import java.util.Optional;
import org.javai.tracelog.config.TraceConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide log facade. Every call makes sure the sinks are installed
 * and, unless told otherwise, prefixes the message with the calling method's
 * name: {@code [login]: Logged in}.
 * <p>
 * {@link #debug(String)} is promoted to INFO when the calling method was
 * invoked directly from a test method, so steps written by test helpers show
 * on the console at the default level.
 */
public final class TraceLog {

	private static final Logger logger = LoggerFactory.getLogger(TraceLog.class);

	private TraceLog() {
	}

	public static void info(String message) {
		info(message, true);
	}

	public static void info(String message, boolean autoPrefix) {
		ensureConfigured();
		logger.info(autoPrefix ? prefixed(message, CallerFrames.capture()) : message);
	}

	public static void debug(String message) {
		debug(message, true);
	}

	public static void debug(String message, boolean autoPrefix) {
		ensureConfigured();
		CallerFrames frames = CallerFrames.capture();
		String text = autoPrefix ? prefixed(message, frames) : message;
		if (frames.isCalledFromTest()) {
			logger.info(text);
		}
		else {
			logger.debug(text);
		}
	}

	public static void error(String message) {
		error(message, true);
	}

	public static void error(String message, boolean autoPrefix) {
		ensureConfigured();
		logger.error(autoPrefix ? prefixed(message, CallerFrames.capture()) : message);
	}

	public static void warning(String message) {
		warning(message, false);
	}

	public static void warning(String message, boolean autoPrefix) {
		ensureConfigured();
		logger.warn(autoPrefix ? prefixed(message, CallerFrames.capture()) : message);
	}

	/**
	 * Logs {@code message} at ERROR with the stack trace of {@code failure}.
	 */
	public static void exception(String message, Throwable failure) {
		exception(message, failure, false);
	}

	public static void exception(String message, Throwable failure, boolean autoPrefix) {
		ensureConfigured();
		logger.error(autoPrefix ? prefixed(message, CallerFrames.capture()) : message, failure);
	}

	/**
	 * Installs the sinks from the process configuration if no sinks are installed yet.
	 */
	public static SinkConfiguration ensureConfigured() {
		SinkConfiguration sinks = SinkConfiguration.installed();
		return sinks != null ? sinks : SinkConfiguration.ensureInstalled(TraceConfigLoader.shared());
	}

	public static Optional<SinkConfiguration> sinks() {
		return Optional.ofNullable(SinkConfiguration.installed());
	}

	static String prefixed(String message, CallerFrames frames) {
		Optional<String> caller = frames.callerName();
		return caller.map(name -> "[" + name + "]: " + message).orElse(message);
	}
}
