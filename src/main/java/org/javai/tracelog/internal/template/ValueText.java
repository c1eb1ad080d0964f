package org.javai.tracelog.internal.template;

import java.lang.reflect.Array;
import java.util.Arrays;
import org.springframework.lang.Nullable;

/**
 * Textual form of a bound value as it appears in a title.
 */
public final class ValueText {

	private ValueText() {
	}

	public static String of(@Nullable Object value) {
		if (value == null) {
			return "";
		}
		if (value instanceof CharSequence text) {
			return stripQuotes(text.toString());
		}
		if (value.getClass().isArray()) {
			return Arrays.deepToString(toObjectArray(value));
		}
		return String.valueOf(value);
	}

	static String stripQuotes(String text) {
		int start = 0;
		int end = text.length();
		while (start < end && isQuote(text.charAt(start))) {
			start++;
		}
		while (end > start && isQuote(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(start, end);
	}

	private static boolean isQuote(char c) {
		return c == '\'' || c == '"';
	}

	private static Object[] toObjectArray(Object array) {
		if (array instanceof Object[] objects) {
			return objects;
		}
		int length = Array.getLength(array);
		Object[] boxed = new Object[length];
		for (int i = 0; i < length; i++) {
			boxed[i] = Array.get(array, i);
		}
		return boxed;
	}
}
