package works.rpycdec.ast;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Runs its block at init time, ordered by {@code priority}.
 */
public record Init(
	Location location,
	int priority,
	List<Node> block
) implements Node {
	public Init {
		requireNonNull(location);
		block = List.copyOf(block);
	}

	@Override
	public List<List<Node>> blocks() {
		return List.of(block);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitInit(this);
	}
}
