package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * A block of embedded code, kept as verbatim source text.
 *
 * @param mode {@code "exec"} for statements, {@code "eval"} for a single expression
 */
public record PyCode(String source, Location location, String mode) {
	public PyCode {
		requireNonNull(source);
		requireNonNull(location);
		requireNonNull(mode);
	}

	public boolean isSingleLine() {
		return source.indexOf('\n') < 0;
	}

	@Override
	public String toString() {
		return source;
	}
}
