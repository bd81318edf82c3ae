package works.rpycdec.ast.atl;

import java.util.List;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

/**
 * Consecutive {@code choice:} blocks, one of which runs at random.
 */
public record AtlChoice(Location location, List<Option> options) implements AtlStatement {
	public AtlChoice {
		options = List.copyOf(options);
	}

	/**
	 * @param chance the relative weight; {@code 1.0} when written without one
	 */
	public record Option(PyExpr chance, AtlBlock block) {
		public boolean hasDefaultChance() {
			return chance.source().strip().equals("1.0");
		}
	}

	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitChoice(this);
	}
}
