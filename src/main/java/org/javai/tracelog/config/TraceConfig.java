package org.javai.tracelog.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settings read by the instrumentor and the log sinks.
 *
 * @param classNameStartsWith instrument classes whose simple name starts with one of these
 * @param classNameEndsWith   instrument classes whose simple name ends with one of these
 * @param classNameContains   instrument classes whose simple name contains one of these
 * @param logLevel            minimum level of the root logger and the console, e.g. {@code DEBUG}
 * @param logFilePath         directory under which the {@code logs} directory is created
 * @param hostIp              address whose last octet labels every line; may be empty
 * @param sysArch             architecture label leading every line
 * @param ignoredLoggers      loggers whose output is dropped from every sink
 */
public record TraceConfig(
		List<String> classNameStartsWith,
		List<String> classNameEndsWith,
		List<String> classNameContains,
		String logLevel,
		Path logFilePath,
		String hostIp,
		String sysArch,
		List<String> ignoredLoggers
) {

	public static final String DEFAULT_LOG_LEVEL = "DEBUG";

	public TraceConfig {
		classNameStartsWith = immutableList(classNameStartsWith);
		classNameEndsWith = immutableList(classNameEndsWith);
		classNameContains = immutableList(classNameContains);
		logLevel = logLevel != null && !logLevel.isBlank() ? logLevel.trim() : DEFAULT_LOG_LEVEL;
		logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
		hostIp = hostIp != null ? hostIp : "";
		sysArch = sysArch != null ? sysArch : "";
		ignoredLoggers = immutableList(ignoredLoggers);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.classNameStartsWith(classNameStartsWith)
				.classNameEndsWith(classNameEndsWith)
				.classNameContains(classNameContains)
				.logLevel(logLevel)
				.logFilePath(logFilePath)
				.hostIp(hostIp)
				.sysArch(sysArch)
				.ignoredLoggers(ignoredLoggers);
	}

	private static List<String> immutableList(List<String> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream().filter(Objects::nonNull).toList();
	}

	public static final class Builder {

		private List<String> classNameStartsWith = new ArrayList<>();
		private List<String> classNameEndsWith = new ArrayList<>();
		private List<String> classNameContains = new ArrayList<>();
		private String logLevel = DEFAULT_LOG_LEVEL;
		private Path logFilePath = Path.of(System.getProperty("user.dir"));
		private String hostIp = "";
		private String sysArch = System.getProperty("os.arch", "");
		private List<String> ignoredLoggers = new ArrayList<>();

		private Builder() {
		}

		public Builder classNameStartsWith(List<String> prefixes) {
			this.classNameStartsWith = new ArrayList<>(prefixes);
			return this;
		}

		public Builder classNameEndsWith(List<String> suffixes) {
			this.classNameEndsWith = new ArrayList<>(suffixes);
			return this;
		}

		public Builder classNameContains(List<String> fragments) {
			this.classNameContains = new ArrayList<>(fragments);
			return this;
		}

		public Builder logLevel(String logLevel) {
			this.logLevel = logLevel;
			return this;
		}

		public Builder logFilePath(Path logFilePath) {
			this.logFilePath = logFilePath;
			return this;
		}

		public Builder hostIp(String hostIp) {
			this.hostIp = hostIp;
			return this;
		}

		public Builder sysArch(String sysArch) {
			this.sysArch = sysArch;
			return this;
		}

		public Builder ignoredLoggers(List<String> ignoredLoggers) {
			this.ignoredLoggers = new ArrayList<>(ignoredLoggers);
			return this;
		}

		public TraceConfig build() {
			return new TraceConfig(classNameStartsWith, classNameEndsWith, classNameContains, logLevel, logFilePath,
					hostIp, sysArch, ignoredLoggers);
		}
	}
}
