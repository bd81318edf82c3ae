package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A conditional chain. Entries are tested in order. An {@code else} branch is
 * a last entry whose condition is the literal {@code True}; the same condition
 * elsewhere came from source that wrote it out, as in {@code if True:}.
 */
public record If(Location location, List<Entry> entries) implements Node {
	public If {
		requireNonNull(location);
		entries = List.copyOf(entries);
	}

	/**
	 * @param condition null only in damaged input; it is rendered as an {@code else}
	 */
	public record Entry(@Nullable PyExpr condition, List<Node> block) {
		public Entry {
			block = List.copyOf(block);
		}

		public boolean isElse() {
			return condition != null && condition.isAlwaysTrue();
		}
	}

	@Override
	public List<List<Node>> blocks() {
		return entries.stream().map(Entry::block).toList();
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
