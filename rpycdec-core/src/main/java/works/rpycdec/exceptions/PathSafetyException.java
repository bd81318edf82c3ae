package works.rpycdec.exceptions;

/**
 * An archive member's name would place it outside the directory it is being extracted into.
 */
public final class PathSafetyException extends DecompilerException {
	private final String memberName;

	public PathSafetyException(String memberName) {
		super("Archive member escapes the extraction directory: \"" + memberName + "\"");
		this.memberName = memberName;
	}

	public String memberName() {
		return memberName;
	}
}
