package works.rpycdec.ast.sl;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.PyExpr;

/**
 * One branch of an {@link SlIf} or {@link SlShowIf}.
 *
 * @param condition null or {@code True} for the {@code else} branch
 */
public record SlEntry(@Nullable PyExpr condition, SlBlock block) {
	public boolean isElse() {
		return condition == null || condition.isAlwaysTrue();
	}
}
