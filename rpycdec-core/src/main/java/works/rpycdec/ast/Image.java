package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.atl.AtlBlock;

import static java.util.Objects.requireNonNull;

/**
 * Defines an image, either from an expression or from an animation block.
 */
public record Image(
	Location location,
	List<String> name,
	@Nullable PyCode code,
	@Nullable AtlBlock atl
) implements Node {
	public Image {
		requireNonNull(location);
		name = List.copyOf(name);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitImage(this);
	}
}
