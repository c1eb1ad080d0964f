package org.javai.tracelog.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.Map;
import org.javai.tracelog.testsupport.RecordingStepReporter;
import org.junit.jupiter.api.Test;

class StepReportersTest {

	@Test
	void registeredReporterIsDetected() {
		assertThat(StepReporters.detected()).isInstanceOf(RecordingStepReporter.class);
		assertThat(StepReporters.detected()).isSameAs(StepReporters.detected());
	}

	@Test
	void withoutProvidersReportingIsOff() throws Exception {
		try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
			StepReporter reporter = StepReporters.detect(empty);

			assertThat(reporter).isSameAs(StepReporter.NONE);
			assertThat(reporter.isEnabled()).isFalse();
			try (StepScope scope = reporter.openStep("ignored", Map.of())) {
				assertThat(scope).isSameAs(StepScope.NONE);
			}
		}
	}
}
