package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * An embedded code block run while scripts are loading, before any init code.
 */
public record EarlyPython(
	Location location,
	PyCode code,
	boolean hide,
	String store
) implements Node {
	public EarlyPython {
		requireNonNull(location);
		requireNonNull(code);
		requireNonNull(store);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitEarlyPython(this);
	}
}
