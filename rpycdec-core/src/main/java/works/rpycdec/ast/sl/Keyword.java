package works.rpycdec.ast.sl;

import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.PyExpr;

import static java.util.Objects.requireNonNull;

/**
 * A property given to a screen or displayable, like {@code xalign 0.5}.
 *
 * @param value null for a bare keyword
 */
public record Keyword(String name, @Nullable PyExpr value) {
	public Keyword {
		requireNonNull(name);
	}
}
