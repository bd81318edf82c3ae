package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One entry of a {@code translate language strings:} block.
 */
@lombok.With
public record TranslateString(
	Location location,
	@Nullable String language,
	String oldText,
	String newText
) implements Node {
	public TranslateString {
		requireNonNull(location);
		requireNonNull(oldText);
		requireNonNull(newText);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTranslateString(this);
	}
}
