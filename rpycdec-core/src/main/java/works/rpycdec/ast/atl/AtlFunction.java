package works.rpycdec.ast.atl;

import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

public record AtlFunction(Location location, PyExpr expression) implements AtlStatement {
	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitFunction(this);
	}
}
