package works.rpycdec.pickle;

import java.util.List;
import java.util.Map;

/**
 * Something a class reference in the stream resolves to.
 * The stream may call it with positional and keyword arguments
 * (via {@code REDUCE}, {@code NEWOBJ}, {@code NEWOBJ_EX}, {@code INST} or {@code OBJ}),
 * or may simply store it as a value.
 * <p>
 * Only an {@link AllowList} hands these out; nothing in this package
 * resolves a class name against the host's own types.
 */
public sealed interface PickleType permits BuiltinType, ObjectType {
	ClassName className();

	Object instantiate(List<Object> args, Map<String, Object> kwargs);
}
