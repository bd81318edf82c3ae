package works.rpycdec.ast;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record Testcase(
	Location location,
	String label,
	List<Node> block
) implements Node {
	public Testcase {
		requireNonNull(location);
		requireNonNull(label);
		block = List.copyOf(block);
	}

	@Override
	public List<List<Node>> blocks() {
		return List.of(block);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTestcase(this);
	}
}
