package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A line of dialogue or narration.
 * <p>
 * A non-interactive say immediately before a {@link Menu} is that menu's caption.
 */
@lombok.With
public record Say(
	Location location,
	@Nullable String who,
	List<String> attributes,
	List<String> temporaryAttributes,
	String what,
	boolean interact,
	@Nullable String with,
	@Nullable String identifier,
	@Nullable ArgumentList arguments
) implements Node {
	public Say {
		requireNonNull(location);
		requireNonNull(what);
		attributes = List.copyOf(attributes);
		temporaryAttributes = List.copyOf(temporaryAttributes);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitSay(this);
	}
}
