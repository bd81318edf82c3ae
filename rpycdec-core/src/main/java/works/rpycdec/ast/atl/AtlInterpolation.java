package works.rpycdec.ast.atl;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.PyExpr;

import static java.util.Objects.requireNonNull;

/**
 * Changes properties over time, or instantly when there is no warper.
 * This is also how a bare property line or a displayable expression is stored.
 *
 * @param warper a named easing function such as {@code linear}
 * @param warpFunction an easing function given by expression, for {@code warp f duration}
 * @param revolution {@code clockwise} or {@code counterclockwise}
 * @param splines properties that move along a curve; the last knot of each is the target value
 * @param expressions displayables or transforms to apply, each with an optional transition
 */
public record AtlInterpolation(
	Location location,
	@Nullable String warper,
	@Nullable PyExpr warpFunction,
	@Nullable PyExpr duration,
	@Nullable String revolution,
	@Nullable PyExpr circles,
	List<Property> properties,
	List<Spline> splines,
	List<Expression> expressions
) implements AtlStatement {
	public AtlInterpolation {
		requireNonNull(location);
		properties = List.copyOf(properties);
		splines = List.copyOf(splines);
		expressions = List.copyOf(expressions);
	}

	public record Property(String name, PyExpr value) { }

	public record Spline(String name, List<PyExpr> knots) {
		public Spline {
			knots = List.copyOf(knots);
			if (knots.isEmpty()) {
				throw new IllegalArgumentException("Spline for " + name + " has no knots");
			}
		}
	}

	public record Expression(PyExpr expression, @Nullable PyExpr with) { }

	@Override
	public <R> R accept(AtlVisitor<R> visitor) {
		return visitor.visitInterpolation(this);
	}
}
