package org.javai.tracelog.internal.bind;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts the text of a declared default into a value of the parameter type,
 * e.g. {@code "3"} for an {@code int}, {@code "READ"} for an enum, or
 * {@code "[1, 2]"} for a list.
 */
public class ArgumentConverter {

	private final ObjectMapper mapper;

	public ArgumentConverter() {
		this(new ObjectMapper().findAndRegisterModules());
	}

	public ArgumentConverter(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public Object convert(String text, Class<?> type) {
		if (type == String.class || type == Object.class || type == CharSequence.class) {
			return text;
		}
		try {
			if (looksLikeJson(text)) {
				return mapper.readValue(text, type);
			}
			return mapper.convertValue(text, type);
		}
		catch (JsonProcessingException | IllegalArgumentException e) {
			throw new IllegalArgumentException(
					"Cannot convert default value '%s' to %s".formatted(text, type.getName()), e);
		}
	}

	private static boolean looksLikeJson(String text) {
		String trimmed = text.trim();
		return trimmed.startsWith("[") || trimmed.startsWith("{");
	}
}
