package works.rpycdec.pickle.exceptions;

public sealed abstract class PickleException extends RuntimeException permits UnpicklingException {
	protected PickleException(String message) {
		super(message);
	}

	protected PickleException(String message, Throwable cause) {
		super(message, cause);
	}
}
