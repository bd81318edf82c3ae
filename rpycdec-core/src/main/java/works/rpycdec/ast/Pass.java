package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

public record Pass(Location location) implements Node {
	public Pass {
		requireNonNull(location);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitPass(this);
	}
}
