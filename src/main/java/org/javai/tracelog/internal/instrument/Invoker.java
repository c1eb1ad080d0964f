package org.javai.tracelog.internal.instrument;

import org.javai.tracelog.internal.bind.CallArguments;

/**
 * The original callable behind a trace. Receives the call-site arguments
 * unmodified and throws whatever the callable throws.
 */
@FunctionalInterface
public interface Invoker {

	Object invoke(CallArguments arguments) throws Throwable;
}
