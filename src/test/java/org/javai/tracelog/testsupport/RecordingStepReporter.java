package org.javai.tracelog.testsupport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.javai.tracelog.instrument.StepReporter;
import org.javai.tracelog.instrument.StepScope;

/**
 * Step reporter registered for the test run; remembers the title of every
 * step opened through it.
 */
public class RecordingStepReporter implements StepReporter {

	private static final List<String> titles = new CopyOnWriteArrayList<>();

	public static List<String> titles() {
		return List.copyOf(titles);
	}

	public static void clear() {
		titles.clear();
	}

	@Override
	public StepScope openStep(String title, Map<String, String> parameters) {
		titles.add(title);
		return StepScope.NONE;
	}
}
