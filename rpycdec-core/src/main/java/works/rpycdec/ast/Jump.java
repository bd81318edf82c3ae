package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * @param expression if true, {@code target} is an expression that computes the label name
 */
public record Jump(
	Location location,
	String target,
	boolean expression
) implements Node {
	public Jump {
		requireNonNull(location);
		requireNonNull(target);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitJump(this);
	}
}
