package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One choice in a {@link Menu}.
 *
 * @param condition shows the choice only when true; null or {@code True} means always
 * @param block what to do when chosen, or null if this is a caption line rather than a choice
 */
@lombok.With
public record MenuItem(
	String caption,
	@Nullable PyExpr condition,
	@Nullable List<Node> block,
	@Nullable ArgumentList arguments
) {
	public MenuItem {
		requireNonNull(caption);
		if (block != null) {
			block = List.copyOf(block);
		}
	}

	public boolean isCaption() {
		return block == null;
	}
}
