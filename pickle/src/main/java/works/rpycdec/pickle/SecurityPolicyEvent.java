package works.rpycdec.pickle;

/**
 * Reported the first time a given {@link Unpickler} substitutes a placeholder
 * for a class outside its {@link AllowList}.
 * This is informational; loading continues.
 */
public record SecurityPolicyEvent(ClassName className) {
	@Override
	public String toString() {
		return "Unknown class " + className + " substituted with a placeholder";
	}
}
