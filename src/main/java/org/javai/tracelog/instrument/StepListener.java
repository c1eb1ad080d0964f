package org.javai.tracelog.instrument;

/**
 * Receives the lifecycle events of steps reported through a {@link StepEmitter}.
 * <p>
 * Each step yields {@link StepEventType#STARTED} followed by exactly one of
 * {@link StepEventType#PASSED} or {@link StepEventType#FAILED}. Events are
 * delivered on the thread making the traced call. An exception thrown by a
 * listener is logged and does not reach the traced call.
 */
@FunctionalInterface
public interface StepListener {

	void onEvent(StepEvent event);
}
