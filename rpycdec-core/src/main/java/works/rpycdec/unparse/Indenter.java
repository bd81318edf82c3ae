package works.rpycdec.unparse;

/**
 * Fixed-width indentation. Blank lines stay empty.
 */
record Indenter(String unit) {
	String indent(String text) {
		if (text.isEmpty()) {
			return text;
		}
		StringBuilder sb = new StringBuilder(text.length() + unit.length() * 8);
		String sep = "";
		for (String line : text.split("\n", -1)) {
			sb.append(sep);
			sep = "\n";
			if (!line.isBlank()) {
				sb.append(unit).append(line);
			}
		}
		return sb.toString();
	}

	/**
	 * @return {@code header} followed by the indented {@code body},
	 * or by an indented {@code pass} when the body is empty
	 */
	String block(String header, String body) {
		return header + "\n" + indent(body.isBlank() ? "pass" : body);
	}
}
