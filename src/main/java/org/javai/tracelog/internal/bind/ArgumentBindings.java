package org.javai.tracelog.internal.bind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Value bound to each declared parameter for one call. Parameters that
 * received nothing and have no default are present with a {@code null} value.
 * Built fresh per invocation.
 */
public final class ArgumentBindings {

	private final Map<String, Object> values;

	ArgumentBindings(Map<String, Object> values) {
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public static ArgumentBindings empty() {
		return new ArgumentBindings(Map.of());
	}

	/**
	 * Copy in which {@code name} is bound to {@code null}, so a placeholder
	 * naming it renders empty.
	 */
	public ArgumentBindings withBlank(String name) {
		Map<String, Object> blanked = new LinkedHashMap<>(values);
		blanked.put(name, null);
		return new ArgumentBindings(blanked);
	}

	public boolean contains(String name) {
		return values.containsKey(name);
	}

	@Nullable
	public Object value(String name) {
		return values.get(name);
	}

	/**
	 * Unmodifiable view; values may be {@code null}.
	 */
	public Map<String, Object> asMap() {
		return values;
	}

	public int size() {
		return values.size();
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
