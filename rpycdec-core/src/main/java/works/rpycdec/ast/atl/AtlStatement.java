package works.rpycdec.ast.atl;

import works.rpycdec.ast.Location;

/**
 * A statement of the animation and transformation language
 * embedded in {@code image}, {@code transform}, {@code show}, {@code scene}
 * and {@code camera} statements.
 */
public sealed interface AtlStatement permits
	AtlBlock,
	AtlChild,
	AtlChoice,
	AtlContainsExpr,
	AtlEvent,
	AtlFunction,
	AtlInterpolation,
	AtlOn,
	AtlParallel,
	AtlRepeat,
	AtlTime
{
	Location location();

	<R> R accept(AtlVisitor<R> visitor);
}
