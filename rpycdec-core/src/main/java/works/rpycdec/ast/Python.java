package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * An embedded code block, run when control reaches it.
 *
 * @param store the variable namespace the code runs in; {@code "store"} is the default
 */
public record Python(
	Location location,
	PyCode code,
	boolean hide,
	String store
) implements Node {
	public Python {
		requireNonNull(location);
		requireNonNull(code);
		requireNonNull(store);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitPython(this);
	}
}
