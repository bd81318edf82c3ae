package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Applies a transition.
 * <p>
 * The compiler turns {@code show x with dissolve} into three statements:
 * a {@code With} whose {@code expr} is {@code None} and whose {@code paired}
 * names the transition, the {@code show} itself, and a closing {@code With}
 * that applies the transition.
 */
public record With(Location location, PyExpr expr, @Nullable PyExpr paired) implements Node {
	public With {
		requireNonNull(location);
		requireNonNull(expr);
	}

	/**
	 * @return true if this is the opening half of a statement-level {@code with} clause
	 */
	public boolean opensPair() {
		return paired != null && (expr.source().isBlank() || expr.source().strip().equals("None"));
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitWith(this);
	}
}
