package works.rpycdec.ast.atl;

import java.util.List;
import works.rpycdec.ast.Location;

/**
 * Consecutive {@code parallel:} blocks, which run at the same time.
 */
public record AtlParallel(Location location, List<AtlBlock> blocks) implements AtlStatement {
	public AtlParallel {
		blocks = List.copyOf(blocks);
	}

	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitParallel(this);
	}
}
