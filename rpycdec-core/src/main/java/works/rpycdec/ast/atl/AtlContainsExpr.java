package works.rpycdec.ast.atl;

import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

public record AtlContainsExpr(Location location, PyExpr expression) implements AtlStatement {
	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitContainsExpr(this);
	}
}
