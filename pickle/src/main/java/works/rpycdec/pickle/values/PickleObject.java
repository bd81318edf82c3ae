package works.rpycdec.pickle.values;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.pickle.ClassName;

import static java.util.Objects.requireNonNull;

/**
 * A generic record standing in for an instance of some class.
 * <p>
 * It supports every reconstruction protocol the stream can invoke on an instance:
 * construction with positional and keyword arguments,
 * whole-state assignment from a map or an opaque value,
 * the {@code (state, slotstate)} pair used by classes with slots,
 * list-style append, and item assignment.
 * The original class name is retained so the record can be inspected
 * or serialized again.
 * <p>
 * Equality is identity: these are mutable, and a graph of them may contain cycles.
 */
public final class PickleObject {
	private final ClassName className;
	private final boolean substituted;
	private final List<Object> args;
	private final Map<String, Object> kwargs;
	private final Map<String, Object> attributes = new LinkedHashMap<>();
	private final List<Object> items = new ArrayList<>();
	private final Map<Object, Object> entries = new LinkedHashMap<>();
	private @Nullable Object state;

	public PickleObject(ClassName className, boolean substituted, List<Object> args, Map<String, Object> kwargs) {
		this.className = requireNonNull(className);
		this.substituted = substituted;
		this.args = Collections.unmodifiableList(new ArrayList<>(args));
		this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
	}

	public ClassName className() {
		return className;
	}

	/**
	 * @return true if this object replaces an instance of a class
	 * that was not on the allow-list
	 */
	public boolean isSubstituted() {
		return substituted;
	}

	public List<Object> args() {
		return args;
	}

	public Map<String, Object> kwargs() {
		return kwargs;
	}

	public Map<String, Object> attributes() {
		return Collections.unmodifiableMap(attributes);
	}

	public boolean has(String attribute) {
		return attributes.containsKey(attribute);
	}

	public @Nullable Object get(String attribute) {
		return attributes.get(attribute);
	}

	/**
	 * @return the state given by {@link #setState} when it was neither a map nor a slot pair
	 */
	public @Nullable Object state() {
		return state;
	}

	public List<Object> items() {
		return Collections.unmodifiableList(items);
	}

	public Map<Object, Object> entries() {
		return Collections.unmodifiableMap(entries);
	}

	public void setState(@Nullable Object newState) {
		Object slotState = null;
		if (newState instanceof PyTuple t
			&& t.size() == 2
			&& isMapOrNull(t.get(0))
			&& isMapOrNull(t.get(1))
		) {
			newState = t.get(0);
			slotState = t.get(1);
		}

		if (newState instanceof Map<?, ?> map) {
			putAttributes(map);
		} else if (newState != null) {
			state = newState;
		}

		if (slotState instanceof Map<?, ?> map) {
			putAttributes(map);
		}
	}

	public void setAttribute(String name, @Nullable Object value) {
		attributes.put(name, value);
	}

	public void append(@Nullable Object value) {
		items.add(value);
	}

	public void setItem(@Nullable Object key, @Nullable Object value) {
		entries.put(key, value);
	}

	private void putAttributes(Map<?, ?> map) {
		map.forEach((k, v) -> attributes.put(attributeName(k), v));
	}

	private static String attributeName(Object key) {
		if (key instanceof byte[] bytes) {
			return new String(bytes, StandardCharsets.UTF_8);
		} else {
			return String.valueOf(key);
		}
	}

	private static boolean isMapOrNull(Object o) {
		return o == null || o instanceof Map;
	}

	@Override
	public String toString() {
		if (state != null) {
			return "<" + className + ": state of " + state.getClass().getSimpleName() + ">";
		}
		return "<" + className + ": " + attributes.keySet() + ">";
	}
}
