package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.atl.AtlBlock;

import static java.util.Objects.requireNonNull;

public record Show(
	Location location,
	ImageSpec imspec,
	@Nullable AtlBlock atl
) implements Node {
	public Show {
		requireNonNull(location);
		requireNonNull(imspec);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitShow(this);
	}
}
