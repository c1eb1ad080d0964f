package org.javai.tracelog.cache;

/**
 * Exception thrown when an {@link InstanceCache} cannot construct an instance.
 */
public class InstanceCreationException extends RuntimeException {

	public InstanceCreationException(String message) {
		super(message);
	}

	public InstanceCreationException(String message, Throwable cause) {
		super(message, cause);
	}
}
