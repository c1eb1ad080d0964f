package org.javai.tracelog.internal.template;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.tracelog.internal.bind.ArgumentBindings;

/**
 * Substitutes {@code {{name}}} placeholders with the text of the bound values.
 * <p>
 * A placeholder naming a bound parameter is always replaced, with the empty
 * string when the parameter received nothing. A placeholder naming no
 * parameter is left as written.
 */
public final class TitleRenderer {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^{}]+)}}");

	private TitleRenderer() {
	}

	public static String render(String template, ArgumentBindings bindings) {
		Objects.requireNonNull(bindings, "bindings must not be null");
		if (template.isBlank() || bindings.size() == 0) {
			return template;
		}

		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String key = matcher.group(1).trim();
			if (bindings.contains(key)) {
				matcher.appendReplacement(sb, Matcher.quoteReplacement(ValueText.of(bindings.value(key))));
			}
			else {
				matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(0)));
			}
		}
		matcher.appendTail(sb);
		return sb.toString();
	}
}
