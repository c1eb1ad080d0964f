package org.javai.tracelog.internal.bind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Arguments as supplied at the call site: positional values, in order, and
 * values passed by parameter name. Either may contain {@code null}.
 * <p>
 * For an instance method the receiver is the first positional value, exactly
 * as it would be handed to the underlying method.
 */
public record CallArguments(List<Object> positional, Map<String, Object> named) {

	private static final CallArguments EMPTY = new CallArguments(List.of(), Map.of());

	public CallArguments {
		positional = positional != null ? Collections.unmodifiableList(new ArrayList<>(positional)) : List.of();
		named = named != null ? Collections.unmodifiableMap(new LinkedHashMap<>(named)) : Map.of();
	}

	public static CallArguments empty() {
		return EMPTY;
	}

	public static CallArguments of(@Nullable Object... values) {
		return new CallArguments(values != null ? Arrays.asList(values) : List.of(), Map.of());
	}

	public static CallArguments named(Map<String, ?> values) {
		return new CallArguments(List.of(), new LinkedHashMap<>(values));
	}

	/**
	 * Copy with {@code receiver} inserted before the positional values.
	 */
	public CallArguments withReceiver(@Nullable Object receiver) {
		List<Object> values = new ArrayList<>(positional.size() + 1);
		values.add(receiver);
		values.addAll(positional);
		return new CallArguments(values, named);
	}

	/**
	 * Copy without the leading positional value; unchanged when there is none.
	 */
	public CallArguments withoutReceiver() {
		if (positional.isEmpty()) {
			return this;
		}
		return new CallArguments(positional.subList(1, positional.size()), named);
	}

	@Nullable
	public Object receiver() {
		return positional.isEmpty() ? null : positional.get(0);
	}

	public int size() {
		return positional.size();
	}
}
