package org.javai.tracelog.internal.template;

import java.util.regex.Pattern;
import org.javai.tracelog.internal.bind.CallableDescriptor;

/**
 * Extracts the title template from a callable's documentation.
 */
public final class TitleExtractor {

	private static final Pattern ANNOTATION_MARKER = Pattern.compile(":param|@param|@return|:return");

	private TitleExtractor() {
	}

	/**
	 * The bare name when the callable has no documentation, otherwise the text
	 * before the first parameter or return marker with every line trimmed and
	 * the lines joined back together.
	 */
	public static String extract(CallableDescriptor descriptor) {
		if (!descriptor.hasDocumentation()) {
			return descriptor.name();
		}
		return extract(descriptor.documentation());
	}

	static String extract(String documentation) {
		String title = ANNOTATION_MARKER.split(documentation, 2)[0];
		StringBuilder joined = new StringBuilder();
		for (String line : title.split("\\R")) {
			joined.append(line.strip());
		}
		return joined.toString();
	}
}
