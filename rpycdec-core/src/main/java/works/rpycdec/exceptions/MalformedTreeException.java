package works.rpycdec.exceptions;

/**
 * The deserialized records don't have the shape of a statement tree,
 * such as a required attribute that is missing or has the wrong type.
 */
public final class MalformedTreeException extends DecompilerException {
	public MalformedTreeException(String message) {
		super(message);
	}

	public MalformedTreeException(String message, Throwable cause) {
		super(message, cause);
	}
}
