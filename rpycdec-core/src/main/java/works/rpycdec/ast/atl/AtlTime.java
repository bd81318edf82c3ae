package works.rpycdec.ast.atl;

import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

public record AtlTime(Location location, PyExpr time) implements AtlStatement {
	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitTime(this);
	}
}
