package org.javai.tracelog.log;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Label leading every log line: the architecture, then a dash and the last
 * octet of the host address when it has one, e.g. {@code x86_64-23}.
 */
public final class HostLabel {

	private static final Pattern LAST_OCTET = Pattern.compile("\\d+\\.\\d+\\.\\d+\\.(\\d+)");

	private HostLabel() {
	}

	public static String of(String sysArch, String hostIp) {
		return sysArch + ipSuffix(hostIp);
	}

	static String ipSuffix(String hostIp) {
		if (hostIp == null) {
			return "";
		}
		Matcher matcher = LAST_OCTET.matcher(hostIp);
		return matcher.find() ? "-" + matcher.group(1) : "";
	}
}
