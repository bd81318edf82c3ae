package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Sets a variable at init time.
 *
 * @param index for {@code define x[index] = ...}
 * @param operator {@code =}, {@code +=} or {@code |=}
 */
public record Define(
	Location location,
	String store,
	String varname,
	@Nullable PyExpr index,
	String operator,
	PyCode code
) implements Node {
	public Define {
		requireNonNull(location);
		requireNonNull(store);
		requireNonNull(varname);
		requireNonNull(operator);
		requireNonNull(code);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitDefine(this);
	}
}
