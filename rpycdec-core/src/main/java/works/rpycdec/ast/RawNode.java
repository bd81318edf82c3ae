package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * A statement of a kind this model doesn't describe.
 * It survives loading so that tooling can still walk the tree,
 * but it can't be rendered.
 *
 * @param className the fully qualified name of the engine class it was stored as
 */
public record RawNode(Location location, String className) implements Node {
	public RawNode {
		requireNonNull(location);
		requireNonNull(className);
	}

	@Override
	public String kind() {
		return className;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitRawNode(this);
	}
}
