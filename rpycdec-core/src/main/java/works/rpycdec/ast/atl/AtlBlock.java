package works.rpycdec.ast.atl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import works.rpycdec.ast.Location;

import static java.util.Objects.requireNonNull;

/**
 * A sequence of animation statements.
 *
 * @param statements may contain nulls, which stand for {@code pass}
 * @param animation whether the block starts with the {@code animation} marker
 */
public record AtlBlock(Location location, List<AtlStatement> statements, boolean animation) implements AtlStatement {
	public AtlBlock {
		requireNonNull(location);
		statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public static AtlBlock of(Location location, AtlStatement... statements) {
		return new AtlBlock(location, List.of(statements), false);
	}

	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitBlock(this);
	}
}
