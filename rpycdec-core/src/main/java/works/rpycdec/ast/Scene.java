package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.atl.AtlBlock;

import static java.util.Objects.requireNonNull;

/**
 * Clears a layer, then optionally shows an image on it.
 */
public record Scene(
	Location location,
	@Nullable ImageSpec imspec,
	String layer,
	@Nullable AtlBlock atl
) implements Node {
	public Scene {
		requireNonNull(location);
		requireNonNull(layer);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitScene(this);
	}
}
