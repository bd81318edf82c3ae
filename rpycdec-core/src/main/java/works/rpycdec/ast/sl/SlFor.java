package works.rpycdec.ast.sl;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

import static java.util.Objects.requireNonNull;

/**
 * @param variable the loop target, which may be a tuple pattern like {@code i, name}
 * @param indexExpression for {@code for x index key in ...}
 */
public record SlFor(
	Location location,
	String variable,
	@Nullable PyExpr indexExpression,
	PyExpr expression,
	List<Keyword> keywords,
	List<SlNode> children
) implements SlNode {
	public SlFor {
		requireNonNull(variable);
		requireNonNull(expression);
		keywords = List.copyOf(keywords);
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
