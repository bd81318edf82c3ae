package works.rpycdec.ast.atl;

import java.util.List;
import works.rpycdec.ast.Location;

/**
 * Consecutive {@code contains:} blocks, each adding a child displayable.
 */
public record AtlChild(Location location, List<AtlBlock> children) implements AtlStatement {
	public AtlChild {
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitChild(this);
	}
}
