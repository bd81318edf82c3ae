package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * A fragment of embedded expression code, kept as the verbatim source text.
 */
public record PyExpr(String source, Location location) {
	public PyExpr {
		requireNonNull(source);
		requireNonNull(location);
	}

	public static PyExpr of(String source) {
		return new PyExpr(source, Location.UNKNOWN);
	}

	/**
	 * @return true if this is the literal {@code True} that marks an unconditional branch
	 */
	public boolean isAlwaysTrue() {
		return source.strip().equals("True");
	}

	@Override
	public String toString() {
		return source;
	}
}
