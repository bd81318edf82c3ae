package works.rpycdec.ast.atl;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

/**
 * @param repeats how many times to repeat, or null for forever
 */
public record AtlRepeat(Location location, @Nullable PyExpr repeats) implements AtlStatement {
	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitRepeat(this);
	}
}
