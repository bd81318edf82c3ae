package works.rpycdec.ast.sl;

import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyCode;

public record SlPython(Location location, PyCode code) implements SlNode {
	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitPython(this);
	}
}
