package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.atl.AtlBlock;

import static java.util.Objects.requireNonNull;

public record Transform(
	Location location,
	String store,
	String name,
	@Nullable ParameterSignature parameters,
	@Nullable AtlBlock atl
) implements Node {
	public Transform {
		requireNonNull(location);
		requireNonNull(store);
		requireNonNull(name);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTransform(this);
	}
}
