package works.rpycdec;

import java.util.List;
import java.util.Map;
import works.rpycdec.ast.Node;

import static java.util.Objects.requireNonNull;

/**
 * The deserialized contents of one compiled script.
 *
 * @param metadata what the compiler recorded about the file, such as its {@code version}
 * @param statements the top-level statements, in file order
 */
public record CompiledScript(Map<String, Object> metadata, List<Node> statements) {
	public CompiledScript {
		requireNonNull(metadata);
		statements = List.copyOf(statements);
	}

	/**
	 * @return the key the file was compiled with, or {@code "unlocked"} if none was recorded
	 */
	public String key() {
		Object key = metadata.get("key");
		return key == null ? "unlocked" : key.toString();
	}
}
