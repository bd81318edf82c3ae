package works.rpycdec.ast.sl;

import works.rpycdec.ast.Location;

/**
 * A statement of the screen language, which appears only inside
 * a {@link works.rpycdec.ast.Screen Screen} statement.
 */
public sealed interface SlNode permits
	SlBlock,
	SlBreak,
	SlContinue,
	SlDefault,
	SlDisplayable,
	SlFor,
	SlIf,
	SlPass,
	SlPython,
	SlScreen,
	SlShowIf,
	SlTransclude,
	SlUse
{
	Location location();

	<R> R accept(SlVisitor<R> visitor);
}
