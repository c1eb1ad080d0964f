package org.javai.tracelog.internal.bind;

public enum ParameterKind {

	POSITIONAL_OR_KEYWORD,

	/** Trailing varargs parameter; binds every remaining positional value. */
	VAR_POSITIONAL
}
