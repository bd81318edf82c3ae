package works.rpycdec.ast.atl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import works.rpycdec.ast.Location;

/**
 * Event handlers, in source order.
 */
public record AtlOn(Location location, Map<String, AtlBlock> handlers) implements AtlStatement {
	public AtlOn {
		handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
	}

	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitOn(this);
	}
}
