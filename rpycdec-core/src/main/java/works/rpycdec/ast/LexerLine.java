package works.rpycdec.ast;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A source line captured by the lexer for a user-defined statement, with the
 * lines indented beneath it.
 */
public record LexerLine(String filename, int number, String text, List<LexerLine> block) {
	public LexerLine {
		requireNonNull(filename);
		requireNonNull(text);
		block = List.copyOf(block);
	}
}
