package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A statement defined by game code rather than by the language itself.
 * Only its first line is known to the compiler; anything indented beneath
 * it is kept as raw lexer lines.
 *
 * @param codeBlock statements the user statement asked the compiler to parse for it
 */
public record UserStatement(
	Location location,
	String line,
	List<LexerLine> block,
	@Nullable List<Node> codeBlock
) implements Node {
	public UserStatement {
		requireNonNull(location);
		requireNonNull(line);
		block = List.copyOf(block);
		if (codeBlock != null) {
			codeBlock = List.copyOf(codeBlock);
		}
	}

	@Override
	public List<List<Node>> blocks() {
		return codeBlock == null ? List.of() : List.of(codeBlock);
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitUserStatement(this);
	}
}
