package works.rpycdec.ast.build;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.Location;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.values.PickleObject;
import works.rpycdec.pickle.values.PyTuple;

/**
 * Typed access to the attributes of a deserialized engine record.
 * Absent and {@code None} attributes are treated alike.
 */
final class Attributes {
	private final PickleObject object;

	Attributes(PickleObject object) {
		this.object = object;
	}

	PickleObject object() {
		return object;
	}

	String className() {
		return object.className().name();
	}

	@Nullable Object raw(String name) {
		return object.get(name);
	}

	boolean has(String name) {
		return object.get(name) != null;
	}

	/**
	 * Statements record {@code filename} and {@code linenumber};
	 * animation statements use a {@code loc} pair and screen statements a {@code location} pair.
	 */
	Location location() {
		Object filename = object.get("filename");
		if (filename != null) {
			return new Location(Values.text(filename), integer("linenumber", 0));
		}
		for (String pairName : List.of("loc", "location")) {
			if (object.get(pairName) instanceof PyTuple pair && pair.size() >= 2) {
				return new Location(String.valueOf(Values.text(pair.get(0))), Values.integer(pair.get(1)));
			}
		}
		return Location.UNKNOWN;
	}

	String string(String name) {
		String result = optionalString(name);
		if (result == null) {
			throw missing(name);
		}
		return result;
	}

	@Nullable String optionalString(String name) {
		Object value = object.get(name);
		if (value == null) {
			return null;
		}
		String result = Values.text(value);
		if (result == null) {
			throw wrongType(name, value, "string");
		}
		return result;
	}

	boolean bool(String name, boolean defaultValue) {
		Object value = object.get(name);
		if (value == null) {
			return defaultValue;
		} else if (value instanceof Boolean b) {
			return b;
		} else if (value instanceof Number n) {
			return n.longValue() != 0;
		}
		throw wrongType(name, value, "bool");
	}

	int integer(String name, int defaultValue) {
		Object value = object.get(name);
		if (value == null) {
			return defaultValue;
		} else if (value instanceof Number n) {
			return n.intValue();
		}
		throw wrongType(name, value, "int");
	}

	/**
	 * @return the elements of a list or tuple attribute, or an empty list if absent
	 */
	List<Object> list(String name) {
		List<Object> result = optionalList(name);
		return result == null ? List.of() : result;
	}

	@Nullable List<Object> optionalList(String name) {
		Object value = object.get(name);
		if (value == null) {
			return null;
		}
		List<Object> result = Values.sequence(value);
		if (result == null) {
			throw wrongType(name, value, "list");
		}
		return result;
	}

	@Nullable Map<?, ?> optionalMap(String name) {
		Object value = object.get(name);
		if (value == null) {
			return null;
		} else if (value instanceof Map<?, ?> map) {
			return map;
		}
		throw wrongType(name, value, "dict");
	}

	@Nullable PickleObject optionalRecord(String name) {
		Object value = object.get(name);
		if (value == null) {
			return null;
		} else if (value instanceof PickleObject o) {
			return o;
		}
		throw wrongType(name, value, "object");
	}

	MalformedTreeException missing(String name) {
		return new MalformedTreeException(className() + " at " + location() + " has no " + name);
	}

	MalformedTreeException wrongType(String name, Object value, String expected) {
		return new MalformedTreeException(className() + "." + name + " at " + location()
			+ " should be " + expected + ", not " + Values.describe(value));
	}
}
