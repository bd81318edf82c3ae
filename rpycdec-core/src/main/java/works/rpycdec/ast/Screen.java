package works.rpycdec.ast;

import works.rpycdec.ast.sl.SlScreen;

import static java.util.Objects.requireNonNull;

public record Screen(
	Location location,
	SlScreen screen
) implements Node {
	public Screen {
		requireNonNull(location);
		requireNonNull(screen);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitScreen(this);
	}
}
