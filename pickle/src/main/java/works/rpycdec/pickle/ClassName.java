package works.rpycdec.pickle;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A class reference as the stream spells it: a dotted module path plus a name.
 * <p>
 * Python 2 module names are normalized to their Python 3 equivalents,
 * so {@code __builtin__.set} and {@code builtins.set} are the same {@code ClassName}.
 */
public record ClassName(String module, String name) {
	public ClassName {
		requireNonNull(module);
		requireNonNull(name);
	}

	public static ClassName of(String module, String name) {
		return new ClassName(LEGACY_MODULES.getOrDefault(module, module), name);
	}

	/**
	 * @return true if this class lives in {@code namespace} or one of its submodules
	 */
	public boolean isIn(String namespace) {
		return module.equals(namespace) || module.startsWith(namespace + ".");
	}

	@Override
	public String toString() {
		return module + "." + name;
	}

	private static final Map<String, String> LEGACY_MODULES = Map.of(
		"__builtin__", "builtins",
		"copy_reg", "copyreg",
		"UserDict", "collections",
		"UserList", "collections");
}
