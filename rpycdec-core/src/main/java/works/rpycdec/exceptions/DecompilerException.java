package works.rpycdec.exceptions;

/**
 * Something about one compiled script prevents it from being decompiled.
 * Batch processing reports these per file and carries on.
 */
public sealed abstract class DecompilerException extends RuntimeException permits
	ContainerFormatException,
	DecompressionException,
	MalformedTreeException,
	PathSafetyException,
	UnsupportedConstructException
{
	protected DecompilerException(String message) {
		super(message);
	}

	protected DecompilerException(String message, Throwable cause) {
		super(message, cause);
	}
}
