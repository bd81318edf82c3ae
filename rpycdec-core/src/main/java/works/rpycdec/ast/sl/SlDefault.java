package works.rpycdec.ast.sl;

import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

public record SlDefault(Location location, String variable, PyExpr expression) implements SlNode {
	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitDefault(this);
	}
}
