package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A language-specific {@code python} or {@code style} block.
 */
public record TranslateBlock(
	Location location,
	@Nullable String language,
	List<Node> block,
	boolean early
) implements Node {
	public TranslateBlock {
		requireNonNull(location);
		block = List.copyOf(block);
	}

	@Override
	public List<List<Node>> blocks() {
		return List.of(block);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTranslateBlock(this);
	}
}
