package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * @param expression if true, {@code label} is an expression that computes the label name
 */
public record Call(
	Location location,
	String label,
	boolean expression,
	@Nullable ArgumentList arguments
) implements Node {
	public Call {
		requireNonNull(location);
		requireNonNull(label);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
