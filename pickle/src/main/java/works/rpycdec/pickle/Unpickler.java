package works.rpycdec.pickle;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.pickle.exceptions.ForbiddenClassException;
import works.rpycdec.pickle.exceptions.PickleException;
import works.rpycdec.pickle.exceptions.UnpicklingException;
import works.rpycdec.pickle.values.PickleObject;
import works.rpycdec.pickle.values.PyTuple;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static works.rpycdec.pickle.AllowList.UnknownClassPolicy.REJECT;

/**
 * Interprets a reconstruction byte-stream, producing the object graph it describes
 * using only what an {@link AllowList} permits.
 * <p>
 * An {@code Unpickler} remembers which unknown classes it has already reported,
 * so that a stream containing thousands of instances of one unknown class
 * produces one warning. It is not thread-safe; give each worker its own.
 */
public final class Unpickler {
	private final AllowList allowList;
	private final Settings settings;
	private final SecurityPolicyListener listener;
	private final Set<ClassName> reportedUnknownClasses = new HashSet<>();

	public record Settings(
		boolean legacyStringsAsBytes,
		int maxStackDepth
	) {
		public static final Settings DEFAULT = new Settings(false, 1_000_000);

		/**
		 * Python 2 byte strings stay as {@code byte[]}, which is how archive
		 * indexes must be read.
		 */
		public static final Settings LEGACY_BYTES = new Settings(true, 1_000_000);

		public Settings withMaxStackDepth(int maxStackDepth) {
			return new Settings(legacyStringsAsBytes, maxStackDepth);
		}
	}

	public Unpickler(AllowList allowList) {
		this(allowList, Settings.DEFAULT, SecurityPolicyListener.IGNORE);
	}

	public Unpickler(AllowList allowList, Settings settings) {
		this(allowList, settings, SecurityPolicyListener.IGNORE);
	}

	public Unpickler(AllowList allowList, Settings settings, SecurityPolicyListener listener) {
		this.allowList = requireNonNull(allowList);
		this.settings = requireNonNull(settings);
		this.listener = requireNonNull(listener);
	}

	public AllowList allowList() {
		return allowList;
	}

	/**
	 * @return the object at the top of the stack when the stream says {@code STOP}
	 * @throws UnpicklingException if the stream is malformed or truncated,
	 * or if it refers to a class the {@link AllowList} rejects
	 */
	public @Nullable Object load(byte[] data) {
		return new LoadSession(data).run();
	}

	/**
	 * The state of a single {@link #load} call.
	 */
	private final class LoadSession {
		final byte[] data;
		int pos = 0;
		int opcodeOffset = 0;
		final List<Object> stack = new ArrayList<>();
		final Deque<Integer> marks = new ArrayDeque<>();
		final Map<Long, Object> memo = new HashMap<>();

		LoadSession(byte[] data) {
			this.data = requireNonNull(data);
		}

		Object run() {
			while (true) {
				opcodeOffset = pos;
				int code = readUnsignedByte();
				Opcode op = Opcode.forCode(code);
				if (op == null) {
					throw error(String.format("Invalid opcode 0x%02x", code));
				} else if (!op.supported()) {
					throw error("Unsupported opcode " + op);
				}
				if (LOGGER.isTraceEnabled()) {
					LOGGER.trace("{} {} (stack depth {})", opcodeOffset, op, stack.size());
				}
				try {
					if (op == Opcode.STOP) {
						return pop();
					}
					execute(op);
				} catch (PickleException e) {
					throw e;
				} catch (RuntimeException e) {
					throw new UnpicklingException(op + " failed at offset " + opcodeOffset + ": " + e.getMessage(), e);
				}
			}
		}

		private void execute(Opcode op) {
			switch (op) {
				case PROTO -> {
					int protocol = readUnsignedByte();
					if (protocol > 5) {
						throw error("Unsupported protocol " + protocol);
					}
				}
				case FRAME -> readLong64();
				case MARK -> marks.push(stack.size());
				case POP -> {
					if (stack.size() > currentMark()) {
						pop();
					} else {
						popMark();
					}
				}
				case POP_MARK -> popMark();
				case DUP -> push(peek());

				case NONE -> push(null);
				case NEWTRUE -> push(Boolean.TRUE);
				case NEWFALSE -> push(Boolean.FALSE);
				case INT -> push(parseTextInt(readLineAscii()));
				case BININT -> push((long) readInt32());
				case BININT1 -> push((long) readUnsignedByte());
				case BININT2 -> push((long) (readUnsignedByte() | (readUnsignedByte() << 8)));
				case LONG -> {
					String text = readLineAscii();
					if (text.endsWith("L")) {
						text = text.substring(0, text.length() - 1);
					}
					push(BuiltinTypes.normalize(new BigInteger(text.trim())));
				}
				case LONG1 -> push(decodeLong(readBytes(readUnsignedByte())));
				case LONG4 -> push(decodeLong(readBytes(readLength32(true))));
				case FLOAT -> push(Double.parseDouble(readLineAscii().trim()));
				case BINFLOAT -> push(ByteBuffer.wrap(readBytes(8)).getDouble());

				case STRING -> push(legacyString(unquote(readLine())));
				case BINSTRING -> push(legacyString(readBytes(readLength32(true))));
				case SHORT_BINSTRING -> push(legacyString(readBytes(readUnsignedByte())));
				case UNICODE -> push(rawUnicodeEscape(readLine()));
				case BINUNICODE -> push(new String(readBytes(readLength32(false)), UTF_8));
				case SHORT_BINUNICODE -> push(new String(readBytes(readUnsignedByte()), UTF_8));
				case BINUNICODE8 -> push(new String(readBytes(readLength64()), UTF_8));
				case BINBYTES -> push(readBytes(readLength32(false)));
				case SHORT_BINBYTES -> push(readBytes(readUnsignedByte()));
				case BINBYTES8, BYTEARRAY8 -> push(readBytes(readLength64()));
				case READONLY_BUFFER -> peek();

				case EMPTY_LIST -> push(new ArrayList<>());
				case EMPTY_DICT -> push(new LinkedHashMap<>());
				case EMPTY_TUPLE -> push(PyTuple.EMPTY);
				case EMPTY_SET -> push(new LinkedHashSet<>());
				case LIST -> push(new ArrayList<>(popMark()));
				case TUPLE -> push(new PyTuple(popMark()));
				case TUPLE1 -> push(PyTuple.of(pop()));
				case TUPLE2 -> {
					Object b = pop();
					Object a = pop();
					push(PyTuple.of(a, b));
				}
				case TUPLE3 -> {
					Object c = pop();
					Object b = pop();
					Object a = pop();
					push(PyTuple.of(a, b, c));
				}
				case DICT -> {
					List<Object> items = popMark();
					Map<Object, Object> dict = new LinkedHashMap<>();
					putPairs(dict, items);
					push(dict);
				}
				case FROZENSET -> push(Collections.unmodifiableSet(new LinkedHashSet<>(popMark())));

				case APPEND -> {
					Object value = pop();
					append(peek(), value);
				}
				case APPENDS -> {
					List<Object> items = popMark();
					Object target = peek();
					for (Object item : items) {
						append(target, item);
					}
				}
				case SETITEM -> {
					Object value = pop();
					Object key = pop();
					setItem(peek(), key, value);
				}
				case SETITEMS -> {
					List<Object> items = popMark();
					if (items.size() % 2 != 0) {
						throw error("SETITEMS with an odd number of items");
					}
					Object target = peek();
					for (int i = 0; i < items.size(); i += 2) {
						setItem(target, items.get(i), items.get(i + 1));
					}
				}
				case ADDITEMS -> {
					List<Object> items = popMark();
					Object target = peek();
					if (target instanceof Set<?>) {
						@SuppressWarnings("unchecked")
						Set<Object> set = (Set<Object>) target;
						set.addAll(items);
					} else if (target instanceof PickleObject o) {
						items.forEach(o::append);
					} else {
						throw error("ADDITEMS on " + BuiltinTypes.describe(target));
					}
				}

				case GLOBAL -> {
					String module = readLineUtf8();
					String name = readLineUtf8();
					push(findClass(module, name));
				}
				case STACK_GLOBAL -> {
					Object name = pop();
					Object module = pop();
					if (!(module instanceof String m) || !(name instanceof String n)) {
						throw error("STACK_GLOBAL requires two strings");
					}
					push(findClass(m, n));
				}
				case REDUCE -> {
					PyTuple args = asTuple(pop());
					Object callable = pop();
					push(instantiate(callable, args.items(), Map.of()));
				}
				case NEWOBJ -> {
					PyTuple args = asTuple(pop());
					Object cls = pop();
					push(instantiate(cls, args.items(), Map.of()));
				}
				case NEWOBJ_EX -> {
					Object kwargs = pop();
					PyTuple args = asTuple(pop());
					Object cls = pop();
					push(instantiate(cls, args.items(), keywords(kwargs)));
				}
				case INST -> {
					String module = readLineUtf8();
					String name = readLineUtf8();
					List<Object> args = popMark();
					push(instantiate(findClass(module, name), args, Map.of()));
				}
				case OBJ -> {
					List<Object> args = popMark();
					if (args.isEmpty()) {
						throw error("OBJ without a class");
					}
					Object cls = args.get(0);
					push(instantiate(cls, args.subList(1, args.size()), Map.of()));
				}
				case BUILD -> {
					Object state = pop();
					build(peek(), state);
				}

				case GET -> push(memoGet(parseMemoKey(readLineAscii())));
				case BINGET -> push(memoGet(readUnsignedByte()));
				case LONG_BINGET -> push(memoGet(readLength32(false)));
				case PUT -> memo.put(parseMemoKey(readLineAscii()), peek());
				case BINPUT -> memo.put((long) readUnsignedByte(), peek());
				case LONG_BINPUT -> memo.put((long) readLength32(false), peek());
				case MEMOIZE -> memo.put((long) memo.size(), peek());

				default -> throw error("Unsupported opcode " + op);
			}
		}

		// Class resolution

		private PickleType findClass(String module, String name) {
			ClassName className = ClassName.of(module, name);
			PickleType allowed = allowList.lookup(className);
			if (allowed != null) {
				return allowed;
			} else if (allowList.unknownClassPolicy() == REJECT) {
				throw new ForbiddenClassException(className);
			}
			if (reportedUnknownClasses.add(className)) {
				SecurityPolicyEvent event = new SecurityPolicyEvent(className);
				LOGGER.warn("Unknown class encountered: {}. Substituting with a placeholder.", className);
				listener.onSubstitution(event);
			}
			return new ObjectType(className, true);
		}

		private Object instantiate(Object callable, List<Object> args, Map<String, Object> kwargs) {
			if (callable instanceof PickleType type) {
				return type.instantiate(args, kwargs);
			} else {
				throw error("Object of type " + BuiltinTypes.describe(callable) + " is not callable");
			}
		}

		private Map<String, Object> keywords(Object kwargs) {
			if (!(kwargs instanceof Map<?, ?> map)) {
				throw error("Expected keyword arguments dict, not " + BuiltinTypes.describe(kwargs));
			}
			Map<String, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(String.valueOf(k), v));
			return result;
		}

		// Container protocols

		private void append(Object target, Object value) {
			if (target instanceof List<?>) {
				@SuppressWarnings("unchecked")
				List<Object> list = (List<Object>) target;
				list.add(value);
			} else if (target instanceof PickleObject o) {
				o.append(value);
			} else {
				throw error("Cannot append to " + BuiltinTypes.describe(target));
			}
		}

		private void setItem(Object target, Object key, Object value) {
			if (target instanceof Map<?, ?>) {
				@SuppressWarnings("unchecked")
				Map<Object, Object> map = (Map<Object, Object>) target;
				map.put(key, value);
			} else if (target instanceof PickleObject o) {
				o.setItem(key, value);
			} else {
				throw error("Cannot set item on " + BuiltinTypes.describe(target));
			}
		}

		private void build(Object target, Object state) {
			if (target instanceof PickleObject o) {
				o.setState(state);
			} else if (target instanceof Map<?, ?> && state instanceof Map<?, ?> stateMap) {
				// A dict subclass with instance attributes; the attributes are not data
				LOGGER.debug("Ignoring {} attributes built onto a mapping", stateMap.size());
			} else if (state == null) {
				LOGGER.debug("Ignoring empty state built onto {}", BuiltinTypes.describe(target));
			} else {
				throw error("Cannot set state of " + BuiltinTypes.describe(target));
			}
		}

		private void putPairs(Map<Object, Object> dict, List<Object> items) {
			if (items.size() % 2 != 0) {
				throw error("DICT with an odd number of items");
			}
			for (int i = 0; i < items.size(); i += 2) {
				dict.put(items.get(i), items.get(i + 1));
			}
		}

		private PyTuple asTuple(Object o) {
			if (o instanceof PyTuple t) {
				return t;
			} else if (o instanceof List<?> list) {
				return new PyTuple(new ArrayList<>(list));
			} else {
				throw error("Expected argument tuple, not " + BuiltinTypes.describe(o));
			}
		}

		// Stack

		private int currentMark() {
			Integer mark = marks.peek();
			return mark == null ? 0 : mark;
		}

		private void push(@Nullable Object value) {
			if (stack.size() >= settings.maxStackDepth()) {
				throw error("Stack depth exceeds " + settings.maxStackDepth());
			}
			stack.add(value);
		}

		private Object pop() {
			if (stack.size() <= currentMark()) {
				throw error("Stack underflow");
			}
			return stack.remove(stack.size() - 1);
		}

		private Object peek() {
			if (stack.size() <= currentMark()) {
				throw error("Stack underflow");
			}
			return stack.get(stack.size() - 1);
		}

		private List<Object> popMark() {
			Integer mark = marks.poll();
			if (mark == null) {
				throw error("Could not find MARK");
			}
			List<Object> tail = stack.subList(mark, stack.size());
			List<Object> result = new ArrayList<>(tail);
			tail.clear();
			return result;
		}

		private Object memoGet(long key) {
			if (!memo.containsKey(key)) {
				throw error("Memo value not found for key " + key);
			}
			return memo.get(key);
		}

		private long parseMemoKey(String text) {
			try {
				return Long.parseLong(text.trim());
			} catch (NumberFormatException e) {
				throw error("Invalid memo key \"" + text + "\"");
			}
		}

		// Input

		private int readUnsignedByte() {
			if (pos >= data.length) {
				throw truncated();
			}
			return data[pos++] & 0xff;
		}

		private byte[] readBytes(long length) {
			if (length < 0 || length > data.length - pos) {
				throw truncated();
			}
			byte[] result = new byte[(int) length];
			System.arraycopy(data, pos, result, 0, result.length);
			pos += result.length;
			return result;
		}

		private int readInt32() {
			byte[] b = readBytes(4);
			return (b[0] & 0xff)
				| ((b[1] & 0xff) << 8)
				| ((b[2] & 0xff) << 16)
				| ((b[3] & 0xff) << 24);
		}

		private long readLong64() {
			byte[] b = readBytes(8);
			long result = 0;
			for (int i = 7; i >= 0; i--) {
				result = (result << 8) | (b[i] & 0xff);
			}
			return result;
		}

		/**
		 * @param signed if true, the length is read as a signed value and negative lengths are an error
		 */
		private long readLength32(boolean signed) {
			int raw = readInt32();
			if (signed && raw < 0) {
				throw error("Negative byte count");
			}
			return signed ? raw : Integer.toUnsignedLong(raw);
		}

		private long readLength64() {
			long length = readLong64();
			if (length < 0 || length > Integer.MAX_VALUE) {
				throw error("Byte count " + Long.toUnsignedString(length) + " is too large");
			}
			return length;
		}

		private byte[] readLine() {
			int start = pos;
			while (pos < data.length && data[pos] != '\n') {
				pos++;
			}
			if (pos >= data.length) {
				throw truncated();
			}
			byte[] line = new byte[pos - start];
			System.arraycopy(data, start, line, 0, line.length);
			pos++;
			return line;
		}

		private String readLineAscii() {
			return new String(readLine(), ISO_8859_1);
		}

		private String readLineUtf8() {
			return new String(readLine(), UTF_8);
		}

		// Decoding

		private Object parseTextInt(String text) {
			String trimmed = text.trim();
			if (trimmed.equals("00")) {
				return Boolean.FALSE;
			} else if (trimmed.equals("01")) {
				return Boolean.TRUE;
			}
			try {
				return BuiltinTypes.normalize(new BigInteger(trimmed));
			} catch (NumberFormatException e) {
				throw error("Invalid INT \"" + text + "\"");
			}
		}

		private Object legacyString(byte[] bytes) {
			if (settings.legacyStringsAsBytes()) {
				return bytes;
			}
			try {
				return UTF_8.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes))
					.toString();
			} catch (CharacterCodingException e) {
				LOGGER.debug("String at offset {} is not UTF-8; decoding as Latin-1", opcodeOffset);
				return new String(bytes, ISO_8859_1);
			}
		}

		private byte[] unquote(byte[] line) {
			int end = line.length;
			while (end > 0 && (line[end - 1] == '\r' || line[end - 1] == ' ')) {
				end--;
			}
			if (end < 2 || (line[0] != '\'' && line[0] != '"') || line[end - 1] != line[0]) {
				throw error("The STRING opcode argument must be quoted");
			}
			return escapeDecode(line, 1, end - 1);
		}

		private UnpicklingException truncated() {
			return error("Pickle data was truncated");
		}

		private UnpicklingException error(String message) {
			return UnpicklingException.at(opcodeOffset, message);
		}
	}

	static Object decodeLong(byte[] littleEndian) {
		if (littleEndian.length == 0) {
			return 0L;
		}
		byte[] bigEndian = new byte[littleEndian.length];
		for (int i = 0; i < littleEndian.length; i++) {
			bigEndian[i] = littleEndian[littleEndian.length - 1 - i];
		}
		return BuiltinTypes.normalize(new BigInteger(bigEndian));
	}

	/**
	 * Decodes backslash escapes in a quoted byte string literal.
	 */
	static byte[] escapeDecode(byte[] src, int start, int end) {
		ByteArrayOutputStream out = new ByteArrayOutputStream(end - start);
		int i = start;
		while (i < end) {
			byte b = src[i++];
			if (b != '\\' || i >= end) {
				out.write(b);
				continue;
			}
			byte e = src[i++];
			switch (e) {
				case 'n' -> out.write('\n');
				case 't' -> out.write('\t');
				case 'r' -> out.write('\r');
				case 'a' -> out.write(0x07);
				case 'b' -> out.write('\b');
				case 'f' -> out.write('\f');
				case 'v' -> out.write(0x0b);
				case '\\', '\'', '"' -> out.write(e);
				case '\n' -> { }
				case 'x' -> {
					if (i + 2 <= end && isHex(src[i]) && isHex(src[i + 1])) {
						out.write(Integer.parseInt(new String(src, i, 2, ISO_8859_1), 16));
						i += 2;
					} else {
						throw new UnpicklingException("Invalid \\x escape in STRING");
					}
				}
				default -> {
					if (e >= '0' && e <= '7') {
						int value = e - '0';
						for (int n = 0; n < 2 && i < end && src[i] >= '0' && src[i] <= '7'; n++) {
							value = value * 8 + (src[i++] - '0');
						}
						out.write(value & 0xff);
					} else {
						out.write('\\');
						out.write(e);
					}
				}
			}
		}
		return out.toByteArray();
	}

	/**
	 * Decodes Python's {@code raw-unicode-escape} codec: bytes are Latin-1
	 * except for {@code \}{@code uXXXX} and {@code \}{@code UXXXXXXXX} sequences.
	 */
	static String rawUnicodeEscape(byte[] src) {
		StringBuilder sb = new StringBuilder(src.length);
		int i = 0;
		while (i < src.length) {
			int b = src[i] & 0xff;
			if (b == '\\' && i + 1 < src.length && (src[i + 1] == 'u' || src[i + 1] == 'U')) {
				int digits = src[i + 1] == 'u' ? 4 : 8;
				if (i + 2 + digits <= src.length && allHex(src, i + 2, digits)) {
					int cp = Integer.parseUnsignedInt(new String(src, i + 2, digits, ISO_8859_1), 16);
					sb.appendCodePoint(cp);
					i += 2 + digits;
					continue;
				}
			}
			sb.append((char) b);
			i++;
		}
		return sb.toString();
	}

	private static boolean allHex(byte[] src, int start, int count) {
		for (int i = start; i < start + count; i++) {
			if (!isHex(src[i])) {
				return false;
			}
		}
		return true;
	}

	private static boolean isHex(byte b) {
		return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Unpickler.class);
}
