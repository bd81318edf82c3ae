package works.rpycdec.pickle;

import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import works.rpycdec.pickle.values.PyComplex;
import works.rpycdec.pickle.values.PyTuple;

/**
 * The native renditions of allow-listed standard types.
 * None of these has side effects beyond building the value it returns.
 */
final class BuiltinTypes {
	private BuiltinTypes() { }

	/**
	 * Upper bound for {@code bytes(n)}, which would otherwise let a
	 * few bytes of input request an arbitrarily large array.
	 */
	static final int MAX_ZERO_FILLED_BYTES = 1 << 20;

	/**
	 * Scalars and containers from {@code builtins}, plus the codec helper
	 * that older protocols use to spell byte strings.
	 */
	static Map<ClassName, PickleType> primitives() {
		Map<ClassName, PickleType> result = new LinkedHashMap<>();
		builtin(result, "builtins", "dict", BuiltinTypes::dict);
		builtin(result, "builtins", "list", (args, kwargs) -> new ArrayList<>(iterable(optionalArg(args, 0))));
		builtin(result, "builtins", "tuple", (args, kwargs) -> new PyTuple(new ArrayList<>(iterable(optionalArg(args, 0)))));
		builtin(result, "builtins", "set", (args, kwargs) -> new LinkedHashSet<>(iterable(optionalArg(args, 0))));
		builtin(result, "builtins", "frozenset", (args, kwargs) -> Collections.unmodifiableSet(new LinkedHashSet<>(iterable(optionalArg(args, 0)))));
		builtin(result, "builtins", "bytes", BuiltinTypes::bytes);
		builtin(result, "builtins", "bytearray", BuiltinTypes::bytes);
		builtin(result, "builtins", "str", BuiltinTypes::str);
		builtin(result, "builtins", "int", BuiltinTypes::integer);
		builtin(result, "builtins", "float", (args, kwargs) -> floating(optionalArg(args, 0)));
		builtin(result, "builtins", "bool", (args, kwargs) -> truthy(optionalArg(args, 0)));
		builtin(result, "builtins", "complex", (args, kwargs) -> new PyComplex(floating(optionalArg(args, 0)), floating(optionalArg(args, 1))));
		builtin(result, "_codecs", "encode", (args, kwargs) -> encode((String) args.get(0), args.size() > 1 ? (String) args.get(1) : "utf-8"));
		return result;
	}

	/**
	 * Inert builtins that have no Java rendition; they become generic records.
	 */
	static Map<ClassName, PickleType> inertBuiltins() {
		Map<ClassName, PickleType> result = new LinkedHashMap<>();
		for (String name : List.of("object", "slice", "range", "type")) {
			ClassName className = ClassName.of("builtins", name);
			result.put(className, new ObjectType(className, false));
		}
		return result;
	}

	/**
	 * Known-safe standard library collections and the reconstruction helpers
	 * that the stream uses to create instances of other allowed classes.
	 */
	static Map<ClassName, PickleType> standardCollections() {
		Map<ClassName, PickleType> result = new LinkedHashMap<>();
		builtin(result, "collections", "OrderedDict", BuiltinTypes::dict);
		builtin(result, "collections", "defaultdict", (args, kwargs) -> new LinkedHashMap<>());
		builtin(result, "collections", "Counter", BuiltinTypes::dict);
		builtin(result, "collections", "deque", (args, kwargs) -> new ArrayList<>(iterable(optionalArg(args, 0))));
		builtin(result, "collections", "UserDict", BuiltinTypes::dict);
		builtin(result, "collections", "UserList", (args, kwargs) -> new ArrayList<>(iterable(optionalArg(args, 0))));
		builtin(result, "copyreg", "_reconstructor", (args, kwargs) -> asType(args.get(0)).instantiate(List.of(), Map.of()));
		builtin(result, "copyreg", "__newobj__", (args, kwargs) -> asType(args.get(0)).instantiate(args.subList(1, args.size()), Map.of()));
		builtin(result, "copyreg", "__newobj_ex__", BuiltinTypes::newObjEx);
		// IntEnum pickled by value; only the number is kept
		builtin(result, "inspect", "_ParameterKind", BuiltinTypes::integer);
		return result;
	}

	private static void builtin(Map<ClassName, PickleType> map, String module, String name, BuiltinType.Constructor constructor) {
		ClassName className = ClassName.of(module, name);
		map.put(className, new BuiltinType(className, constructor));
	}

	private static Object optionalArg(List<Object> args, int index) {
		return index < args.size() ? args.get(index) : null;
	}

	private static PickleType asType(Object o) {
		if (o instanceof PickleType t) {
			return t;
		} else {
			throw new IllegalArgumentException("Expected a class, not " + describe(o));
		}
	}

	@SuppressWarnings("unchecked")
	private static Object newObjEx(List<Object> args, Map<String, Object> kwargs) {
		PickleType type = asType(args.get(0));
		PyTuple positional = (PyTuple) args.get(1);
		Map<String, Object> keywords = (Map<String, Object>) args.get(2);
		return type.instantiate(positional.items(), keywords);
	}

	private static Map<Object, Object> dict(List<Object> args, Map<String, Object> kwargs) {
		Map<Object, Object> result = new LinkedHashMap<>();
		Object source = optionalArg(args, 0);
		if (source instanceof Map<?, ?> map) {
			result.putAll(map);
		} else if (source != null) {
			for (Object pair : iterable(source)) {
				Collection<?> kv = iterable(pair);
				if (kv.size() != 2) {
					throw new IllegalArgumentException("Dictionary update sequence element has length " + kv.size());
				}
				var iter = kv.iterator();
				result.put(iter.next(), iter.next());
			}
		}
		result.putAll(kwargs);
		return result;
	}

	private static byte[] bytes(List<Object> args, Map<String, Object> kwargs) {
		Object source = optionalArg(args, 0);
		if (source == null) {
			return new byte[0];
		} else if (source instanceof byte[] b) {
			return b.clone();
		} else if (source instanceof String s) {
			return encode(s, args.size() > 1 ? (String) args.get(1) : "utf-8");
		} else if (source instanceof Long n) {
			if (n < 0 || n > MAX_ZERO_FILLED_BYTES) {
				throw new IllegalArgumentException("Refusing to allocate " + n + " zero bytes");
			}
			return new byte[n.intValue()];
		}
		Collection<?> values = iterable(source);
		byte[] result = new byte[values.size()];
		int i = 0;
		for (Object v : values) {
			result[i++] = (byte) ((Number) v).intValue();
		}
		return result;
	}

	private static String str(List<Object> args, Map<String, Object> kwargs) {
		Object source = optionalArg(args, 0);
		if (source == null) {
			return "";
		} else if (source instanceof byte[] b && args.size() > 1) {
			return new String(b, charset((String) args.get(1)));
		} else {
			return String.valueOf(source);
		}
	}

	private static Object integer(List<Object> args, Map<String, Object> kwargs) {
		Object source = optionalArg(args, 0);
		if (source == null) {
			return 0L;
		} else if (source instanceof Long || source instanceof BigInteger) {
			return source;
		} else if (source instanceof Boolean b) {
			return b ? 1L : 0L;
		} else if (source instanceof Double d) {
			return d.longValue();
		} else if (source instanceof String s) {
			int radix = args.size() > 1 ? ((Number) args.get(1)).intValue() : 10;
			return normalize(new BigInteger(s.trim().replace("_", ""), radix));
		}
		throw new IllegalArgumentException("Cannot convert " + describe(source) + " to int");
	}

	private static double floating(Object source) {
		if (source == null) {
			return 0.0;
		} else if (source instanceof Number n) {
			return n.doubleValue();
		} else if (source instanceof String s) {
			return Double.parseDouble(s.trim());
		}
		throw new IllegalArgumentException("Cannot convert " + describe(source) + " to float");
	}

	private static boolean truthy(Object o) {
		if (o == null) {
			return false;
		} else if (o instanceof Boolean b) {
			return b;
		} else if (o instanceof Number n) {
			return n.doubleValue() != 0.0;
		} else if (o instanceof String s) {
			return !s.isEmpty();
		} else if (o instanceof Collection<?> c) {
			return !c.isEmpty();
		} else if (o instanceof Map<?, ?> m) {
			return !m.isEmpty();
		} else if (o instanceof PyTuple t) {
			return t.size() != 0;
		} else if (o instanceof byte[] b) {
			return b.length != 0;
		}
		return true;
	}

	private static byte[] encode(String s, String encoding) {
		return s.getBytes(charset(encoding));
	}

	private static Charset charset(String encoding) {
		return switch (encoding.toLowerCase().replace('_', '-')) {
			case "latin1", "latin-1", "iso-8859-1" -> StandardCharsets.ISO_8859_1;
			case "ascii", "us-ascii" -> StandardCharsets.US_ASCII;
			case "utf8", "utf-8" -> StandardCharsets.UTF_8;
			default -> Charset.forName(encoding);
		};
	}

	static Collection<?> iterable(Object source) {
		if (source == null) {
			return List.of();
		} else if (source instanceof Collection<?> c) {
			return c;
		} else if (source instanceof PyTuple t) {
			return t.items();
		} else if (source instanceof Map<?, ?> m) {
			return m.keySet();
		} else if (source instanceof String s) {
			List<Object> chars = new ArrayList<>(s.length());
			s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
			return chars;
		} else if (source instanceof byte[] b) {
			List<Object> values = new ArrayList<>(b.length);
			for (byte x : b) {
				values.add((long) (x & 0xff));
			}
			return values;
		}
		throw new IllegalArgumentException(describe(source) + " is not iterable");
	}

	static Object normalize(BigInteger value) {
		return value.bitLength() < 64 ? (Object) value.longValue() : value;
	}

	static String describe(Object o) {
		return o == null ? "None" : o.getClass().getSimpleName();
	}
}
