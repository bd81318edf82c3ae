package works.rpycdec.pickle.exceptions;

import works.rpycdec.pickle.ClassName;

/**
 * A class reference was refused by an allow-list that rejects unknown classes
 * rather than substituting placeholders for them.
 */
public final class ForbiddenClassException extends UnpicklingException {
	private final ClassName className;

	public ForbiddenClassException(ClassName className) {
		super("Refusing to unpickle non-primitive class: " + className);
		this.className = className;
	}

	public ClassName className() {
		return className;
	}
}
