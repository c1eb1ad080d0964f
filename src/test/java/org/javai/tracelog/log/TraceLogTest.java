package org.javai.tracelog.log;

import static org.assertj.core.api.Assertions.assertThat;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.javai.tracelog.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TraceLogTest {

	private LogCaptorAppender captor;

	@BeforeEach
	void captureTraceLog() {
		captor = LogCaptorAppender.create(TraceLog.class, Level.DEBUG);
	}

	@AfterEach
	void releaseCaptor() {
		captor.close();
	}

	@Test
	void prefixesTheCallingMethod() {
		TraceLog.info("page loaded");

		assertThat(captor.messagesAt(Level.INFO)).containsExactly("[prefixesTheCallingMethod]: page loaded");
	}

	@Test
	void prefixCanBeSuppressed() {
		TraceLog.info("[login]: Logs in as alice", false);
		TraceLog.error("raw failure", false);

		assertThat(captor.messages()).containsExactly("[login]: Logs in as alice", "raw failure");
	}

	@Test
	void debugFromAHelperOfATestIsPromoted() {
		openDashboard();

		assertThat(captor.messagesAt(Level.INFO)).containsExactly("[openDashboard]: opening the dashboard");
		assertThat(captor.messagesAt(Level.DEBUG)).isEmpty();
	}

	@Test
	void debugDeeperInTheCallChainStaysDebug() {
		checkoutFlow();

		assertThat(captor.messagesAt(Level.DEBUG)).containsExactly("[confirmOrder]: confirming");
		assertThat(captor.messagesAt(Level.INFO)).isEmpty();
	}

	@Test
	void testPrefixedGrandcallerCountsAsTest() {
		testStyleCaller();

		assertThat(captor.messagesAt(Level.INFO)).containsExactly("[nestedStep]: from a test-named caller");
	}

	@Test
	void severitiesMapToLevels() {
		TraceLog.warning("slow response");
		TraceLog.error("request failed");

		assertThat(captor.messagesAt(Level.WARN)).containsExactly("slow response");
		assertThat(captor.messagesAt(Level.ERROR)).containsExactly("[severitiesMapToLevels]: request failed");
	}

	@Test
	void exceptionCarriesTheFailure() {
		IllegalStateException failure = new IllegalStateException("timeout");

		TraceLog.exception("upload failed", failure);

		LogEvent event = captor.events().get(0);
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMessage().getFormattedMessage()).isEqualTo("upload failed");
		assertThat(event.getThrown()).isSameAs(failure);
	}

	@Test
	void warningAndExceptionArePrefixedOnRequest() {
		IllegalStateException failure = new IllegalStateException("timeout");

		TraceLog.warning("slow response", true);
		TraceLog.exception("upload failed", failure, true);

		assertThat(captor.messagesAt(Level.WARN)).containsExactly("[warningAndExceptionArePrefixedOnRequest]: slow response");
		assertThat(captor.messagesAt(Level.ERROR)).containsExactly("[warningAndExceptionArePrefixedOnRequest]: upload failed");
	}

	@Test
	void bracesInMessagesAreKept() {
		TraceLog.info("payload {}", false);

		assertThat(captor.messages()).containsExactly("payload {}");
	}

	@Test
	void sinksAreInstalledOnFirstUse() {
		TraceLog.debug("anything");

		assertThat(TraceLog.sinks()).isPresent();
		assertThat(TraceLog.ensureConfigured()).isSameAs(TraceLog.sinks().orElseThrow());
	}

	private void openDashboard() {
		TraceLog.debug("opening the dashboard");
	}

	private void checkoutFlow() {
		confirmOrder();
	}

	private void confirmOrder() {
		TraceLog.debug("confirming");
	}

	private void testStyleCaller() {
		nestedStep();
	}

	private void nestedStep() {
		TraceLog.debug("from a test-named caller");
	}
}
