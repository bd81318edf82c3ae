package works.rpycdec.pickle;

import org.jetbrains.annotations.Nullable;

/**
 * The instruction set of the reconstruction stream, protocols 0 through 5.
 * <p>
 * Opcodes marked {@link #supported() unsupported} need a collaborator this reader
 * refuses to provide (persistent ID resolution, the extension registry,
 * out-of-band buffers) and cause an {@link works.rpycdec.pickle.exceptions.UnpicklingException}.
 */
public enum Opcode {
	MARK('(', 0),
	STOP('.', 0),
	POP('0', 0),
	POP_MARK('1', 1),
	DUP('2', 0),
	FLOAT('F', 0),
	INT('I', 0),
	BININT('J', 1),
	BININT1('K', 1),
	LONG('L', 0),
	BININT2('M', 1),
	NONE('N', 0),
	PERSID('P', 0, false),
	BINPERSID('Q', 1, false),
	REDUCE('R', 0),
	STRING('S', 0),
	BINSTRING('T', 1),
	SHORT_BINSTRING('U', 1),
	UNICODE('V', 0),
	BINUNICODE('X', 1),
	APPEND('a', 0),
	BUILD('b', 0),
	GLOBAL('c', 0),
	DICT('d', 0),
	EMPTY_DICT('}', 1),
	APPENDS('e', 1),
	GET('g', 0),
	BINGET('h', 1),
	INST('i', 0),
	LONG_BINGET('j', 1),
	LIST('l', 0),
	EMPTY_LIST(']', 1),
	OBJ('o', 1),
	PUT('p', 0),
	BINPUT('q', 1),
	LONG_BINPUT('r', 1),
	SETITEM('s', 0),
	TUPLE('t', 0),
	EMPTY_TUPLE(')', 1),
	SETITEMS('u', 1),
	BINFLOAT('G', 1),

	PROTO(0x80, 2),
	NEWOBJ(0x81, 2),
	EXT1(0x82, 2, false),
	EXT2(0x83, 2, false),
	EXT4(0x84, 2, false),
	TUPLE1(0x85, 2),
	TUPLE2(0x86, 2),
	TUPLE3(0x87, 2),
	NEWTRUE(0x88, 2),
	NEWFALSE(0x89, 2),
	LONG1(0x8a, 2),
	LONG4(0x8b, 2),

	BINBYTES('B', 3),
	SHORT_BINBYTES('C', 3),

	SHORT_BINUNICODE(0x8c, 4),
	BINUNICODE8(0x8d, 4),
	BINBYTES8(0x8e, 4),
	EMPTY_SET(0x8f, 4),
	ADDITEMS(0x90, 4),
	FROZENSET(0x91, 4),
	NEWOBJ_EX(0x92, 4),
	STACK_GLOBAL(0x93, 4),
	MEMOIZE(0x94, 4),
	FRAME(0x95, 4),

	BYTEARRAY8(0x96, 5),
	NEXT_BUFFER(0x97, 5, false),
	READONLY_BUFFER(0x98, 5);

	private final int code;
	private final int protocol;
	private final boolean supported;

	Opcode(int code, int protocol) {
		this(code, protocol, true);
	}

	Opcode(int code, int protocol, boolean supported) {
		this.code = code;
		this.protocol = protocol;
		this.supported = supported;
	}

	public int code() {
		return code;
	}

	/**
	 * @return the lowest protocol version that emits this opcode
	 */
	public int protocol() {
		return protocol;
	}

	public boolean supported() {
		return supported;
	}

	public static @Nullable Opcode forCode(int code) {
		return (code >= 0 && code < BY_CODE.length) ? BY_CODE[code] : null;
	}

	private static final Opcode[] BY_CODE = new Opcode[256];

	static {
		for (Opcode op : values()) {
			assert BY_CODE[op.code] == null: "Duplicate opcode " + op;
			BY_CODE[op.code] = op;
		}
	}
}
