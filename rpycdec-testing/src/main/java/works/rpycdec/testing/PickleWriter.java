package works.rpycdec.testing;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.testing.PyValues.Global;
import works.rpycdec.testing.PyValues.Instance;
import works.rpycdec.testing.PyValues.LegacyString;
import works.rpycdec.testing.PyValues.Reduce;
import works.rpycdec.testing.PyValues.Tuple;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes reconstruction streams the way CPython's pickler does,
 * so tests can build inputs without shipping binary fixtures.
 * <p>
 * {@link #dump} writes a whole value graph, memoizing containers and instances
 * so that shared references come back shared. The opcode-level methods
 * allow hand-built streams, including malformed ones.
 */
public final class PickleWriter {
	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final Map<Object, Integer> memo = new IdentityHashMap<>();
	private final int protocol;

	public static final int MARK = '(';
	public static final int STOP = '.';
	public static final int POP = '0';
	public static final int INT = 'I';
	public static final int BININT = 'J';
	public static final int BININT1 = 'K';
	public static final int BININT2 = 'M';
	public static final int NONE = 'N';
	public static final int REDUCE = 'R';
	public static final int STRING = 'S';
	public static final int BINSTRING = 'T';
	public static final int SHORT_BINSTRING = 'U';
	public static final int UNICODE = 'V';
	public static final int BINUNICODE = 'X';
	public static final int APPEND = 'a';
	public static final int BUILD = 'b';
	public static final int GLOBAL = 'c';
	public static final int DICT = 'd';
	public static final int EMPTY_DICT = '}';
	public static final int APPENDS = 'e';
	public static final int GET = 'g';
	public static final int BINGET = 'h';
	public static final int LONG_BINGET = 'j';
	public static final int LIST = 'l';
	public static final int EMPTY_LIST = ']';
	public static final int PUT = 'p';
	public static final int BINPUT = 'q';
	public static final int LONG_BINPUT = 'r';
	public static final int SETITEM = 's';
	public static final int TUPLE = 't';
	public static final int EMPTY_TUPLE = ')';
	public static final int SETITEMS = 'u';
	public static final int BINFLOAT = 'G';
	public static final int PROTO = 0x80;
	public static final int NEWOBJ = 0x81;
	public static final int EXT1 = 0x82;
	public static final int TUPLE1 = 0x85;
	public static final int TUPLE2 = 0x86;
	public static final int TUPLE3 = 0x87;
	public static final int NEWTRUE = 0x88;
	public static final int NEWFALSE = 0x89;
	public static final int LONG1 = 0x8a;
	public static final int SHORT_BINBYTES = 'C';
	public static final int BINBYTES = 'B';
	public static final int SHORT_BINUNICODE = 0x8c;
	public static final int EMPTY_SET = 0x8f;
	public static final int ADDITEMS = 0x90;
	public static final int FROZENSET = 0x91;
	public static final int STACK_GLOBAL = 0x93;
	public static final int MEMOIZE = 0x94;

	/**
	 * A writer for protocol 2, which is what the script compiler uses.
	 */
	public PickleWriter() {
		this(2);
	}

	public PickleWriter(int protocol) {
		this.protocol = protocol;
	}

	/**
	 * @return a complete protocol-2 stream for {@code value}
	 */
	public static byte[] pickle(@Nullable Object value) {
		return new PickleWriter().proto().dump(value).stop().toByteArray();
	}

	public byte[] toByteArray() {
		return out.toByteArray();
	}

	// Opcode level

	public PickleWriter op(int opcode) {
		out.write(opcode);
		return this;
	}

	public PickleWriter raw(byte... bytes) {
		out.writeBytes(bytes);
		return this;
	}

	public PickleWriter proto() {
		return op(PROTO).raw((byte) protocol);
	}

	public PickleWriter stop() {
		return op(STOP);
	}

	public PickleWriter mark() {
		return op(MARK);
	}

	/**
	 * Writes a text-mode line argument, as protocol 0 opcodes expect.
	 */
	public PickleWriter line(String text) {
		out.writeBytes(text.getBytes(UTF_8));
		out.write('\n');
		return this;
	}

	public PickleWriter global(String module, String name) {
		return op(GLOBAL).line(module).line(name);
	}

	public PickleWriter int32(int value) {
		out.write(value);
		out.write(value >>> 8);
		out.write(value >>> 16);
		out.write(value >>> 24);
		return this;
	}

	public PickleWriter binput(int index) {
		if (index < 256) {
			return op(BINPUT).raw((byte) index);
		} else {
			return op(LONG_BINPUT).int32(index);
		}
	}

	public PickleWriter binget(int index) {
		if (index < 256) {
			return op(BINGET).raw((byte) index);
		} else {
			return op(LONG_BINGET).int32(index);
		}
	}

	public PickleWriter unicode(String s) {
		byte[] utf8 = s.getBytes(UTF_8);
		return op(BINUNICODE).int32(utf8.length).raw(utf8);
	}

	public PickleWriter integer(long value) {
		if (value >= 0 && value < 0x100) {
			return op(BININT1).raw((byte) value);
		} else if (value >= 0 && value < 0x10000) {
			return op(BININT2).raw((byte) value, (byte) (value >>> 8));
		} else if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
			return op(BININT).int32((int) value);
		} else {
			return longInteger(BigInteger.valueOf(value));
		}
	}

	public PickleWriter longInteger(BigInteger value) {
		byte[] bigEndian = value.toByteArray();
		op(LONG1).raw((byte) bigEndian.length);
		for (int i = bigEndian.length - 1; i >= 0; i--) {
			out.write(bigEndian[i]);
		}
		return this;
	}

	// Value level

	/**
	 * Writes the opcodes that push {@code value} onto the stack.
	 */
	public PickleWriter dump(@Nullable Object value) {
		Integer memoized = memo.get(value);
		if (value != null && memoized != null) {
			return binget(memoized);
		}
		if (value == null) {
			op(NONE);
		} else if (value instanceof Boolean b) {
			op(b ? NEWTRUE : NEWFALSE);
		} else if (value instanceof BigInteger big) {
			longInteger(big);
		} else if (value instanceof Double || value instanceof Float) {
			op(BINFLOAT).raw(ByteBuffer.allocate(8).putDouble(((Number) value).doubleValue()).array());
		} else if (value instanceof Number n) {
			integer(n.longValue());
		} else if (value instanceof String s) {
			unicode(s);
		} else if (value instanceof LegacyString legacy) {
			legacyString(legacy.bytes());
		} else if (value instanceof byte[] bytes) {
			bytes(bytes);
		} else if (value instanceof Tuple tuple) {
			tuple(tuple);
		} else if (value instanceof List<?> list) {
			op(EMPTY_LIST);
			memoize(value);
			if (!list.isEmpty()) {
				mark();
				list.forEach(this::dump);
				op(APPENDS);
			}
		} else if (value instanceof Map<?, ?> map) {
			op(EMPTY_DICT);
			memoize(value);
			if (!map.isEmpty()) {
				mark();
				map.forEach((k, v) -> {
					dump(k);
					dump(v);
				});
				op(SETITEMS);
			}
		} else if (value instanceof Set<?> set) {
			dump(new Reduce(new Global("__builtin__", "set"), PyValues.tuple(new ArrayList<>(set))));
		} else if (value instanceof Global g) {
			global(g.module(), g.name());
		} else if (value instanceof Reduce r) {
			dump(r.callable());
			dump(r.args());
			op(REDUCE);
			memoize(value);
		} else if (value instanceof Instance instance) {
			dump(instance.type());
			dump(instance.newArgs());
			op(NEWOBJ);
			memoize(value);
			if (instance.state() != null) {
				dump(instance.state());
				op(BUILD);
			}
		} else {
			throw new IllegalArgumentException("Can't pickle " + value.getClass().getSimpleName());
		}
		return this;
	}

	private void tuple(Tuple tuple) {
		List<Object> items = tuple.items();
		switch (items.size()) {
			case 0 -> op(EMPTY_TUPLE);
			case 1 -> {
				dump(items.get(0));
				op(TUPLE1);
			}
			case 2 -> {
				dump(items.get(0));
				dump(items.get(1));
				op(TUPLE2);
			}
			case 3 -> {
				dump(items.get(0));
				dump(items.get(1));
				dump(items.get(2));
				op(TUPLE3);
			}
			default -> {
				mark();
				items.forEach(this::dump);
				op(TUPLE);
			}
		}
	}

	private void legacyString(byte[] bytes) {
		if (bytes.length < 256) {
			op(SHORT_BINSTRING).raw((byte) bytes.length);
		} else {
			op(BINSTRING).int32(bytes.length);
		}
		raw(bytes);
	}

	private void bytes(byte[] bytes) {
		if (protocol >= 3) {
			if (bytes.length < 256) {
				op(SHORT_BINBYTES).raw((byte) bytes.length);
			} else {
				op(BINBYTES).int32(bytes.length);
			}
			raw(bytes);
		} else {
			// Protocol 2 has no bytes opcode; CPython spells them as a call to the codec
			global("_codecs", "encode");
			unicode(new String(bytes, ISO_8859_1));
			unicode("latin1");
			op(TUPLE2);
			op(REDUCE);
		}
	}

	private void memoize(Object value) {
		int index = memo.size();
		memo.put(value, index);
		binput(index);
	}
}
