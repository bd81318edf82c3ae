package works.rpycdec.ast;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record While(
	Location location,
	PyExpr condition,
	List<Node> block
) implements Node {
	public While {
		requireNonNull(location);
		requireNonNull(condition);
		block = List.copyOf(block);
	}

	@Override
	public List<List<Node>> blocks() {
		return List.of(block);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitWhile(this);
	}
}
