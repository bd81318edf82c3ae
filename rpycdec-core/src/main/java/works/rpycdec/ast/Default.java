package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * Gives a variable its value at game start unless a save already provides one.
 */
public record Default(
	Location location,
	String store,
	String varname,
	PyCode code
) implements Node {
	public Default {
		requireNonNull(location);
		requireNonNull(store);
		requireNonNull(varname);
		requireNonNull(code);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitDefault(this);
	}
}
