/**
 * Internal implementation details of tracelog.
 * <p>
 * <b>WARNING:</b> Types in this package and its sub-packages are not part of the
 * public API and may change without notice between versions. External code should
 * not depend on these types directly.
 * <p>
 * For public API types, use {@code org.javai.tracelog.instrument},
 * {@code org.javai.tracelog.log} and the annotations in {@code org.javai.tracelog.api}.
 */
@org.springframework.lang.NonNullApi
package org.javai.tracelog.internal;
