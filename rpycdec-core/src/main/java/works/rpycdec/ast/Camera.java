package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.atl.AtlBlock;

import static java.util.Objects.requireNonNull;

public record Camera(
	Location location,
	String layer,
	List<PyExpr> atList,
	@Nullable AtlBlock atl
) implements Node {
	public Camera {
		requireNonNull(location);
		requireNonNull(layer);
		atList = List.copyOf(atList);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitCamera(this);
	}
}
