package works.rpycdec.ast.sl;

import java.util.List;
import works.rpycdec.ast.Location;

public record SlIf(Location location, List<SlEntry> entries) implements SlNode {
	public SlIf {
		entries = List.copyOf(entries);
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
