package org.javai.tracelog.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link TraceConfig} from the classpath resource {@value #RESOURCE}.
 * <p>
 * Keys are case-insensitive:
 *
 * <pre>
 * class_name_startswith: [Page]
 * class_name_endswith: [Page, Widget]
 * class_name_contain: [Dialog]
 * log_level: INFO
 * log_file_path: /var/tmp/app
 * host_ip: 10.8.0.23
 * sys_arch: x86_64
 * ignored_loggers: [org.apache.http]
 * </pre>
 *
 * A system property {@code tracelog.<key>} overrides the resource; list values
 * are comma separated. Keys missing from both take the process defaults: no
 * class filters, level {@code DEBUG}, the working directory, the local host
 * address and {@code os.arch}.
 */
public class TraceConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(TraceConfigLoader.class);

	public static final String RESOURCE = "tracelog.yaml";

	public static final String PROPERTY_PREFIX = "tracelog.";

	static final String CLASS_NAME_STARTSWITH = "class_name_startswith";
	static final String CLASS_NAME_ENDSWITH = "class_name_endswith";
	static final String CLASS_NAME_CONTAIN = "class_name_contain";
	static final String LOG_LEVEL = "log_level";
	static final String LOG_FILE_PATH = "log_file_path";
	static final String HOST_IP = "host_ip";
	static final String SYS_ARCH = "sys_arch";
	static final String IGNORED_LOGGERS = "ignored_loggers";

	private static final List<String> KEYS = List.of(CLASS_NAME_STARTSWITH, CLASS_NAME_ENDSWITH, CLASS_NAME_CONTAIN,
			LOG_LEVEL, LOG_FILE_PATH, HOST_IP, SYS_ARCH, IGNORED_LOGGERS);

	private final Yaml yaml = new Yaml();
	private final Properties overrides;

	public TraceConfigLoader() {
		this(System.getProperties());
	}

	public TraceConfigLoader(Properties overrides) {
		this.overrides = overrides;
	}

	/**
	 * Configuration of this process, loaded on first use.
	 */
	public static TraceConfig shared() {
		return Holder.SHARED;
	}

	/**
	 * Loads {@value #RESOURCE} from the classpath, or the defaults when the
	 * resource does not exist.
	 */
	public TraceConfig load() {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = TraceConfigLoader.class.getClassLoader();
		}
		try (InputStream in = classLoader.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				logger.debug("No {} on the classpath, using defaults", RESOURCE);
				return fromMap(Map.of());
			}
			return load(in);
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read " + RESOURCE, e);
		}
	}

	public TraceConfig load(InputStream inputStream) {
		try {
			return fromMap(yaml.load(inputStream));
		}
		catch (YAMLException | ClassCastException e) {
			throw new ConfigurationException("Failed to parse tracelog configuration from input stream", e);
		}
	}

	public TraceConfig parseString(String yamlContent) {
		try {
			return fromMap(yaml.load(yamlContent));
		}
		catch (YAMLException | ClassCastException e) {
			throw new ConfigurationException("Failed to parse tracelog configuration from string", e);
		}
	}

	TraceConfig fromMap(Map<String, Object> data) {
		Map<String, Object> values = normalize(data);
		for (String key : KEYS) {
			String override = overrides.getProperty(PROPERTY_PREFIX + key);
			if (override != null) {
				values.put(key, override);
			}
		}

		TraceConfig.Builder builder = TraceConfig.builder()
				.classNameStartsWith(stringList(values.get(CLASS_NAME_STARTSWITH), CLASS_NAME_STARTSWITH))
				.classNameEndsWith(stringList(values.get(CLASS_NAME_ENDSWITH), CLASS_NAME_ENDSWITH))
				.classNameContains(stringList(values.get(CLASS_NAME_CONTAIN), CLASS_NAME_CONTAIN))
				.ignoredLoggers(stringList(values.get(IGNORED_LOGGERS), IGNORED_LOGGERS));

		String level = string(values.get(LOG_LEVEL));
		if (level != null) {
			builder.logLevel(level);
		}
		String path = string(values.get(LOG_FILE_PATH));
		if (path != null) {
			builder.logFilePath(Path.of(path));
		}
		String ip = string(values.get(HOST_IP));
		builder.hostIp(ip != null ? ip : localHostAddress());
		String arch = string(values.get(SYS_ARCH));
		if (arch != null) {
			builder.sysArch(arch);
		}
		return builder.build();
	}

	private static Map<String, Object> normalize(Map<String, Object> data) {
		Map<String, Object> values = new LinkedHashMap<>();
		if (data == null) {
			return values;
		}
		data.forEach((key, value) -> values.put(String.valueOf(key).toLowerCase(Locale.ROOT), value));
		return values;
	}

	private static List<String> stringList(Object value, String key) {
		if (value == null) {
			return List.of();
		}
		if (value instanceof List<?> list) {
			return list.stream().map(String::valueOf).toList();
		}
		if (value instanceof String text) {
			return Arrays.stream(text.split(","))
					.map(String::trim)
					.filter(s -> !s.isEmpty())
					.toList();
		}
		throw new ConfigurationException("'%s' must be a list of strings, was %s".formatted(key, value));
	}

	private static String string(Object value) {
		return value != null ? String.valueOf(value) : null;
	}

	private static String localHostAddress() {
		try {
			return InetAddress.getLocalHost().getHostAddress();
		}
		catch (UnknownHostException e) {
			logger.warn("Could not resolve the local host address; log lines will carry no host label", e);
			return "";
		}
	}

	private static final class Holder {

		static final TraceConfig SHARED = new TraceConfigLoader().load();
	}
}
