package works.rpycdec.exceptions;

/**
 * The file's framing is not recognized, or none of the requested slots is present.
 */
public final class ContainerFormatException extends DecompilerException {
	public ContainerFormatException(String message) {
		super(message);
	}

	public ContainerFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
