package works.rpycdec.ast;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A say statement that is also its own translation unit.
 */
@lombok.With
public record TranslateSay(
	Location location,
	Say say,
	@Nullable String identifier,
	@Nullable String language,
	@Nullable String alternate
) implements Node {
	public TranslateSay {
		requireNonNull(location);
		requireNonNull(say);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitTranslateSay(this);
	}
}
