package works.rpycdec.exceptions;

import org.jetbrains.annotations.Nullable;

/**
 * The renderer has no faithful rendering for a node.
 * Rather than guess, it stops and says which node it was.
 */
public final class UnsupportedConstructException extends DecompilerException {
	private final String nodeType;
	private final String filename;
	private final int linenumber;

	public UnsupportedConstructException(String nodeType, String filename, int linenumber) {
		this(nodeType, filename, linenumber, null);
	}

	public UnsupportedConstructException(String nodeType, String filename, int linenumber, @Nullable String detail) {
		super("Cannot render " + nodeType + " at " + filename + ":" + linenumber
			+ (detail == null ? "" : " (" + detail + ")"));
		this.nodeType = nodeType;
		this.filename = filename;
		this.linenumber = linenumber;
	}

	public String nodeType() {
		return nodeType;
	}

	public String filename() {
		return filename;
	}

	public int linenumber() {
		return linenumber;
	}
}
