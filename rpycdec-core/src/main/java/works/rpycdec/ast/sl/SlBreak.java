package works.rpycdec.ast.sl;

import works.rpycdec.ast.Location;

public record SlBreak(Location location) implements SlNode {
	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitBreak(this);
	}
}
