package org.javai.tracelog.instrument;

/**
 * Open step around one traced call, closed on every exit path.
 * <p>
 * Implementations must not throw from {@link #fail(Throwable)} or
 * {@link #close()}; the traced call's own outcome is what the caller sees.
 */
public interface StepScope extends AutoCloseable {

	/**
	 * Scope that records nothing.
	 */
	StepScope NONE = new StepScope() {

		@Override
		public void fail(Throwable failure) {
		}

		@Override
		public void close() {
		}
	};

	/**
	 * Marks the step as failed; called before {@link #close()} when the traced
	 * call throws.
	 */
	void fail(Throwable failure);

	@Override
	void close();
}
