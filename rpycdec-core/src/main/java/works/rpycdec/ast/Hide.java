package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

public record Hide(
	Location location,
	ImageSpec imspec
) implements Node {
	public Hide {
		requireNonNull(location);
		requireNonNull(imspec);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitHide(this);
	}
}
