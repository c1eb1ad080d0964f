package org.javai.tracelog.internal.bind;

/**
 * Calling convention of a traced callable.
 */
public enum CallableRole {

	FUNCTION(false),
	INSTANCE_METHOD(true),
	STATIC_METHOD(false),
	CLASS_METHOD(true);

	private final boolean stripsReceiver;

	CallableRole(boolean stripsReceiver) {
		this.stripsReceiver = stripsReceiver;
	}

	/**
	 * Whether the first call-site argument is the receiver (the instance, or the
	 * type token of a class method) and must be left out of the title.
	 */
	public boolean stripsReceiver() {
		return stripsReceiver;
	}
}
