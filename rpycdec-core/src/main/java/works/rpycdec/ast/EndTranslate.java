package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * Marks the end of a translation unit. It has no source form.
 */
public record EndTranslate(Location location) implements Node {
	public EndTranslate {
		requireNonNull(location);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitEndTranslate(this);
	}
}
