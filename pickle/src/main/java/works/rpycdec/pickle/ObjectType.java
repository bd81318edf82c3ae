package works.rpycdec.pickle;

import java.util.List;
import java.util.Map;
import works.rpycdec.pickle.values.PickleObject;

/**
 * Instantiates a generic {@link PickleObject} that remembers its class name
 * and accepts whatever state the stream gives it.
 *
 * @param substituted true if the class was not allow-listed and this
 *                    stands in for it; false if the class belongs to a
 *                    friendly namespace whose records are meant to be generic.
 */
public record ObjectType(ClassName className, boolean substituted) implements PickleType {
	@Override
	public PickleObject instantiate(List<Object> args, Map<String, Object> kwargs) {
		return new PickleObject(className, substituted, args, kwargs);
	}

	@Override
	public String toString() {
		return (substituted ? "placeholder " : "class ") + className;
	}
}
