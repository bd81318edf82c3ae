package works.rpycdec.ast.sl;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.ArgumentList;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

import static java.util.Objects.requireNonNull;

/**
 * Includes another screen.
 *
 * @param target the screen name, or an expression computing it when {@code targetIsExpression}
 * @param block content passed to the other screen's {@code transclude}
 */
public record SlUse(
	Location location,
	String target,
	boolean targetIsExpression,
	@Nullable ArgumentList arguments,
	@Nullable PyExpr id,
	@Nullable SlBlock block
) implements SlNode {
	public SlUse {
		requireNonNull(target);
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitUse(this);
	}
}
