package works.rpycdec.unparse;

import java.util.regex.Pattern;

public final class SayStrings {
	private SayStrings() { }

	/**
	 * Quotes {@code text} the way dialogue strings are written in scripts.
	 * A space that follows another space is escaped, since the engine
	 * would otherwise collapse the run.
	 */
	public static String encode(String text) {
		String escaped = text
			.replace("\\", "\\\\")
			.replace("\n", "\\n")
			.replace("\"", "\\\"");
		return "\"" + REPEATED_SPACE.matcher(escaped).replaceAll("\\\\ ") + "\"";
	}

	private static final Pattern REPEATED_SPACE = Pattern.compile("(?<= ) ");
}
