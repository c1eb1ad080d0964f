package org.javai.tracelog.log;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.AbstractConfiguration;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.filter.ThresholdFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.javai.tracelog.cache.InstanceCache;
import org.javai.tracelog.config.TraceConfig;
import org.springframework.lang.Nullable;

/**
 * Output destinations of the process: a colored console and two files under
 * {@code <log_file_path>/logs}, {@code <date>_debug.log} with every level and
 * {@code <date>_error.log} with errors only. Lines read
 * {@code <arch>[-<ip suffix>]: MM/dd HH:mm:ss | LEVEL | message}.
 * <p>
 * Installing replaces every appender of the Log4j2 root logger. Sinks are
 * keyed singletons by log level; {@link #ensureInstalled(TraceConfig)} installs
 * once per process even under concurrent first use.
 */
public final class SinkConfiguration {

	static final String CONSOLE_APPENDER = "tracelog-console";
	static final String DEBUG_APPENDER = "tracelog-debug";
	static final String ERROR_APPENDER = "tracelog-error";

	private static final String APPENDER_PREFIX = "tracelog-";
	private static final String DATE_PATTERN = "%d{MM/dd HH:mm:ss}";
	private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
	private static final String LEVEL_STYLES =
			"{FATAL=bold red, ERROR=bold red, WARN=bold yellow, INFO=bold white, DEBUG=bold blue, TRACE=white}";

	private static final Object lock = new Object();

	private static volatile SinkConfiguration current;

	private final Path logDirectory;
	private final Path debugFile;
	private final Path errorFile;
	private final Level level;
	private final String label;
	private final List<String> ignoredLoggers;

	private SinkConfiguration(TraceConfig config) {
		this.logDirectory = config.logFilePath().resolve("logs");
		String date = LocalDate.now().format(FILE_DATE);
		this.debugFile = logDirectory.resolve(date + "_debug.log");
		this.errorFile = logDirectory.resolve(date + "_error.log");
		this.level = toLevel(config.logLevel());
		this.label = HostLabel.of(config.sysArch(), config.hostIp());
		this.ignoredLoggers = config.ignoredLoggers();
	}

	/**
	 * Installs the sinks for {@code config}; sinks for the same level that are
	 * already installed are kept as they are.
	 *
	 * @throws UncheckedIOException when the log directory or files cannot be created
	 */
	public static SinkConfiguration install(TraceConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		synchronized (lock) {
			SinkConfiguration sinks = InstanceCache.forType(SinkConfiguration.class)
					.getOrCreate(List.of(toLevel(config.logLevel())), Map.of(), () -> new SinkConfiguration(config));
			if (sinks != current) {
				sinks.activate();
				current = sinks;
			}
			return sinks;
		}
	}

	/**
	 * The installed sinks, installing them from {@code config} if there are none yet.
	 */
	public static SinkConfiguration ensureInstalled(TraceConfig config) {
		SinkConfiguration sinks = current;
		if (sinks != null) {
			return sinks;
		}
		synchronized (lock) {
			return current != null ? current : install(config);
		}
	}

	@Nullable
	public static SinkConfiguration installed() {
		return current;
	}

	public Path logDirectory() {
		return logDirectory;
	}

	public Path debugFile() {
		return debugFile;
	}

	public Path errorFile() {
		return errorFile;
	}

	public Level level() {
		return level;
	}

	public String label() {
		return label;
	}

	String filePattern() {
		return escape(label) + ": " + DATE_PATTERN + " | %-5level | %msg%n";
	}

	String consolePattern() {
		return "%style{" + escape(label) + "}{bold,red}: %style{" + DATE_PATTERN + "}{yellow}"
				+ " | %highlight{%-5level}" + LEVEL_STYLES
				+ " | %highlight{%msg}" + LEVEL_STYLES + "%n";
	}

	private void activate() {
		createFiles();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig root = configuration.getRootLogger();

		for (String name : new ArrayList<>(root.getAppenders().keySet())) {
			if (name.startsWith(APPENDER_PREFIX) && configuration instanceof AbstractConfiguration abstractConfiguration) {
				abstractConfiguration.removeAppender(name);
			}
			else {
				root.removeAppender(name);
			}
		}

		PatternLayout fileLayout = layout(configuration, filePattern());
		Appender debugAppender = FileAppender.newBuilder()
				.setName(DEBUG_APPENDER)
				.withFileName(debugFile.toString())
				.withAppend(false)
				.setLayout(fileLayout)
				.setConfiguration(configuration)
				.build();
		Appender errorAppender = FileAppender.newBuilder()
				.setName(ERROR_APPENDER)
				.withFileName(errorFile.toString())
				.withAppend(false)
				.setLayout(fileLayout)
				.setFilter(ThresholdFilter.createFilter(Level.ERROR, Filter.Result.ACCEPT, Filter.Result.DENY))
				.setConfiguration(configuration)
				.build();
		Appender consoleAppender = ConsoleAppender.newBuilder()
				.setName(CONSOLE_APPENDER)
				.setTarget(ConsoleAppender.Target.SYSTEM_OUT)
				.setLayout(layout(configuration, consolePattern()))
				.setConfiguration(configuration)
				.build();

		attach(configuration, root, debugAppender, Level.DEBUG);
		attach(configuration, root, errorAppender, Level.ERROR);
		attach(configuration, root, consoleAppender, level);
		root.setLevel(level);

		for (String name : ignoredLoggers) {
			LoggerConfig ignored = configuration.getLoggerConfig(name);
			if (ignored.getName().equals(name)) {
				ignored.setLevel(Level.OFF);
			}
			else {
				configuration.addLogger(name, new LoggerConfig(name, Level.OFF, false));
			}
		}
		context.updateLoggers();
	}

	private void createFiles() {
		try {
			Files.createDirectories(logDirectory);
			for (Path file : List.of(debugFile, errorFile)) {
				if (Files.notExists(file)) {
					Files.createFile(file);
				}
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Cannot create log files under " + logDirectory, e);
		}
	}

	private static void attach(Configuration configuration, LoggerConfig root, Appender appender, Level threshold) {
		appender.start();
		configuration.addAppender(appender);
		root.addAppender(appender, threshold, null);
	}

	private static PatternLayout layout(Configuration configuration, String pattern) {
		return PatternLayout.newBuilder()
				.withConfiguration(configuration)
				.withPattern(pattern)
				.withCharset(StandardCharsets.UTF_8)
				.build();
	}

	static Level toLevel(String name) {
		String normalized = name.trim().toUpperCase(Locale.ROOT);
		return switch (normalized) {
			case "WARNING" -> Level.WARN;
			case "CRITICAL" -> Level.FATAL;
			default -> Level.toLevel(normalized, Level.DEBUG);
		};
	}

	private static String escape(String text) {
		return text.replace("%", "%%").replace("${", "$${");
	}

	@Override
	public String toString() {
		return "SinkConfiguration[level=" + level + ", directory=" + logDirectory + "]";
	}
}
