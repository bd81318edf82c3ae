package works.rpycdec.exceptions;

public final class DecompressionException extends DecompilerException {
	public DecompressionException(String message) {
		super(message);
	}

	public DecompressionException(String message, Throwable cause) {
		super(message, cause);
	}
}
