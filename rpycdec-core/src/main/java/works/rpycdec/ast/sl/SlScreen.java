package works.rpycdec.ast.sl;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.ParameterSignature;

import static java.util.Objects.requireNonNull;

/**
 * @param tag the screen's tag, when it differs from its name
 */
public record SlScreen(
	Location location,
	String name,
	@Nullable ParameterSignature parameters,
	List<Keyword> keywords,
	@Nullable String tag,
	List<SlNode> children
) implements SlNode {
	public SlScreen {
		requireNonNull(name);
		keywords = List.copyOf(keywords);
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitScreen(this);
	}
}
