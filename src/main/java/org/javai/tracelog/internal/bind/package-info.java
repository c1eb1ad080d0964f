/**
 * Callable descriptors and argument binding internals.
 * <p>
 * Contains the descriptor captured once per traced method, the classifier that
 * derives its calling convention, and the binder that maps call-site arguments
 * onto declared parameters.
 */
@org.springframework.lang.NonNullApi
package org.javai.tracelog.internal.bind;
