package org.javai.tracelog.instrument;

import java.util.List;
import org.javai.tracelog.config.TraceConfig;

/**
 * Selects the classes whose methods are instrumented by their simple name.
 * A name matches when it starts with, ends with, or contains any configured
 * fragment; with no fragments nothing matches.
 */
public record ClassNameMatcher(List<String> startsWith, List<String> endsWith, List<String> contains) {

	public ClassNameMatcher {
		startsWith = startsWith != null ? List.copyOf(startsWith) : List.of();
		endsWith = endsWith != null ? List.copyOf(endsWith) : List.of();
		contains = contains != null ? List.copyOf(contains) : List.of();
	}

	public static ClassNameMatcher none() {
		return new ClassNameMatcher(List.of(), List.of(), List.of());
	}

	public static ClassNameMatcher from(TraceConfig config) {
		return new ClassNameMatcher(config.classNameStartsWith(), config.classNameEndsWith(),
				config.classNameContains());
	}

	public boolean matches(String simpleName) {
		if (simpleName == null || simpleName.isEmpty()) {
			return false;
		}
		return startsWith.stream().anyMatch(simpleName::startsWith)
				|| endsWith.stream().anyMatch(simpleName::endsWith)
				|| contains.stream().anyMatch(simpleName::contains);
	}
}
