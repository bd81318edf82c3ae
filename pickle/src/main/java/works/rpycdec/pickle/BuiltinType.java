package works.rpycdec.pickle;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An allow-listed class or function with a native Java rendition,
 * such as {@code builtins.set} producing a {@link java.util.Set}.
 */
public record BuiltinType(ClassName className, Constructor constructor) implements PickleType {
	public BuiltinType {
		requireNonNull(className);
		requireNonNull(constructor);
	}

	@FunctionalInterface
	public interface Constructor {
		Object construct(List<Object> args, Map<String, Object> kwargs);
	}

	@Override
	public Object instantiate(List<Object> args, Map<String, Object> kwargs) {
		return constructor.construct(args, kwargs);
	}

	@Override
	public String toString() {
		return "builtin " + className;
	}
}
