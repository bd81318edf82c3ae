package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

public record Return(
	Location location,
	@Nullable PyExpr expression
) implements Node {
	public Return {
		requireNonNull(location);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitReturn(this);
	}
}
