/**
 * Call tracing internals.
 * <p>
 * Contains the tracer that wraps a callable with a log line and an optional
 * step, and the representation of bound arguments as step parameters.
 */
@org.springframework.lang.NonNullApi
package org.javai.tracelog.internal.instrument;
