package org.javai.tracelog.instrument;

public enum StepEventType {
	STARTED,
	PASSED,
	FAILED
}
