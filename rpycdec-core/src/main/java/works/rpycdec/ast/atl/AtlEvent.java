package works.rpycdec.ast.atl;

import works.rpycdec.ast.Location;

public record AtlEvent(Location location, String name) implements AtlStatement {
	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitEvent(this);
	}
}
