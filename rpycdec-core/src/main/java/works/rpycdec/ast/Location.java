package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * Where a statement came from in the original script.
 */
public record Location(String filename, int linenumber) {
	public static final Location UNKNOWN = new Location("<unknown>", 0);

	public Location {
		requireNonNull(filename);
		if (linenumber < 0) {
			throw new IllegalArgumentException("Negative line number " + linenumber + " in " + filename);
		}
	}

	@Override
	public String toString() {
		return filename + ":" + linenumber;
	}
}
