package works.rpycdec.ast.sl;

import java.util.List;
import works.rpycdec.ast.Location;

/**
 * Like {@link SlIf}, but the branches stay displayed and receive show and hide events
 * as the conditions change.
 */
public record SlShowIf(Location location, List<SlEntry> entries) implements SlNode {
	public SlShowIf {
		entries = List.copyOf(entries);
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitShowIf(this);
	}
}
