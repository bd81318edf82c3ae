package works.rpycdec.pickle.exceptions;

/**
 * The reconstruction stream is malformed, truncated, or asks for something
 * this reader will not do.
 * <p>
 * This class is concrete because most stream problems have no more specific
 * meaning than "this is not a stream we can read".
 */
public sealed class UnpicklingException extends PickleException permits ForbiddenClassException {
	public UnpicklingException(String message) {
		super(message);
	}

	public UnpicklingException(String message, Throwable cause) {
		super(message, cause);
	}

	public static UnpicklingException at(long offset, String message) {
		return new UnpicklingException(message + " at offset " + offset);
	}
}
