package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

@lombok.With
public record Label(
	Location location,
	String name,
	List<Node> block,
	@Nullable ParameterSignature parameters,
	boolean hide
) implements Node {
	public Label {
		requireNonNull(location);
		requireNonNull(name);
		block = List.copyOf(block);
	}

	@Override
	public List<List<Node>> blocks() {
		return List.of(block);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitLabel(this);
	}
}
