package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A translation unit. With a null {@code language} it holds the untranslated statements.
 */
public record Translate(
	Location location,
	@Nullable String identifier,
	@Nullable String language,
	List<Node> block,
	@Nullable String alternate
) implements Node {
	public Translate {
		requireNonNull(location);
		block = List.copyOf(block);
	}

	@Override
	public List<List<Node>> blocks() {
		return List.of(block);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTranslate(this);
	}
}
