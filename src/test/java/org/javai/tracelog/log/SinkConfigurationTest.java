package org.javai.tracelog.log;

import static org.assertj.core.api.Assertions.assertThat;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.tracelog.config.TraceConfig;
import org.javai.tracelog.config.TraceConfigLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SinkConfigurationTest {

	// Sinks are keyed by level, so every test installs a level of its own.
	@TempDir
	Path logRoot;

	@AfterEach
	void restoreProcessSinks() {
		SinkConfiguration.install(TraceConfigLoader.shared());
	}

	@Test
	void writesDebugAndErrorFiles() throws IOException {
		SinkConfiguration sinks = SinkConfiguration.install(config("INFO"));

		TraceLog.info("stored the order");
		TraceLog.error("disk full");

		assertThat(sinks.logDirectory()).isEqualTo(logRoot.resolve("logs"));
		assertThat(sinks.debugFile().getFileName().toString()).endsWith("_debug.log");
		List<String> debugLines = Files.readAllLines(sinks.debugFile(), StandardCharsets.UTF_8);
		List<String> errorLines = Files.readAllLines(sinks.errorFile(), StandardCharsets.UTF_8);
		assertThat(debugLines).anyMatch(line -> line.startsWith("x86_64-7: ")
				&& line.contains(" | INFO  | [writesDebugAndErrorFiles]: stored the order"));
		assertThat(debugLines).anyMatch(line -> line.contains(" | ERROR | [writesDebugAndErrorFiles]: disk full"));
		assertThat(errorLines).hasSize(1);
		assertThat(errorLines.get(0)).contains("disk full");
	}

	@Test
	void ignoredLoggersAreSilenced() throws IOException {
		SinkConfiguration sinks = SinkConfiguration.install(config("WARN"));

		LoggerFactory.getLogger("com.example.noisy.Client").error("chatter");
		TraceLog.error("kept");

		String errors = Files.readString(sinks.errorFile(), StandardCharsets.UTF_8);
		assertThat(errors).contains("kept").doesNotContain("chatter");
	}

	@Test
	void sameLevelReusesTheInstalledSinks() {
		SinkConfiguration first = SinkConfiguration.install(config("ERROR"));
		SinkConfiguration second = SinkConfiguration.install(config("ERROR"));

		assertThat(second).isSameAs(first);
		assertThat(SinkConfiguration.installed()).isSameAs(first);
		assertThat(first.level()).isEqualTo(Level.ERROR);
	}

	@Test
	void levelNamesFollowTheConfiguration() {
		assertThat(SinkConfiguration.toLevel("warning")).isEqualTo(Level.WARN);
		assertThat(SinkConfiguration.toLevel("CRITICAL")).isEqualTo(Level.FATAL);
		assertThat(SinkConfiguration.toLevel(" info ")).isEqualTo(Level.INFO);
		assertThat(SinkConfiguration.toLevel("verbose")).isEqualTo(Level.DEBUG);
	}

	@Test
	void consoleLineIsColored() {
		SinkConfiguration sinks = SinkConfiguration.install(config("FATAL"));

		assertThat(sinks.label()).isEqualTo("x86_64-7");
		assertThat(sinks.consolePattern()).startsWith("%style{x86_64-7}{bold,red}").contains("%highlight{%-5level}");
		assertThat(sinks.filePattern()).isEqualTo("x86_64-7: %d{MM/dd HH:mm:ss} | %-5level | %msg%n");
	}

	private TraceConfig config(String level) {
		return TraceConfig.builder()
				.logLevel(level)
				.logFilePath(logRoot)
				.sysArch("x86_64")
				.hostIp("192.168.0.7")
				.ignoredLoggers(List.of("com.example.noisy"))
				.build();
	}
}
