package works.rpycdec.ast.sl;

import java.util.List;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

import static java.util.Objects.requireNonNull;

/**
 * A statement that shows a displayable, such as {@code text}, {@code vbox} or {@code add}.
 *
 * @param keyword the statement's keyword
 */
public record SlDisplayable(
	Location location,
	String keyword,
	List<PyExpr> positional,
	List<Keyword> keywords,
	List<SlNode> children
) implements SlNode {
	public SlDisplayable {
		requireNonNull(keyword);
		positional = List.copyOf(positional);
		keywords = List.copyOf(keywords);
		children = List.copyOf(children);
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitDisplayable(this);
	}
}
