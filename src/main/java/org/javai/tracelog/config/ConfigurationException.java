package org.javai.tracelog.config;

/**
 * Exception thrown when the tracelog configuration cannot be read.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
