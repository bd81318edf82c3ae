package works.rpycdec.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An in-game choice menu.
 * <p>
 * Each item carries its own arguments, so the item list and the
 * per-item argument list cannot get out of step.
 *
 * @param set the name of a set that records which choices were made
 * @param with a transition used when the menu appears
 * @param statementStartLabel the name of the label created by {@code menu name:}, if any
 */
@lombok.With
public record Menu(
	Location location,
	List<MenuItem> items,
	@Nullable String set,
	@Nullable String with,
	@Nullable ArgumentList arguments,
	@Nullable String statementStartLabel
) implements Node {
	public Menu {
		requireNonNull(location);
		items = List.copyOf(items);
	}

	@Override
	public List<List<Node>> blocks() {
		List<List<Node>> result = new ArrayList<>();
		for (MenuItem item : items) {
			if (item.block() != null) {
				result.add(item.block());
			}
		}
		return result;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitMenu(this);
	}
}
