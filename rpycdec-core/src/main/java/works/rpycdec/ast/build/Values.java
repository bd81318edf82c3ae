package works.rpycdec.ast.build;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.ArgumentList;
import works.rpycdec.ast.ArgumentList.Argument;
import works.rpycdec.ast.ImageSpec;
import works.rpycdec.ast.LexerLine;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.ParameterSignature;
import works.rpycdec.ast.ParameterSignature.Kind;
import works.rpycdec.ast.ParameterSignature.Parameter;
import works.rpycdec.ast.PyCode;
import works.rpycdec.ast.PyExpr;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.PickleType;
import works.rpycdec.pickle.values.PickleObject;
import works.rpycdec.pickle.values.PyTuple;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Conversions from deserialized values to the leaf types of the statement model.
 */
final class Values {
	private Values() { }

	/**
	 * @return the string content of a plain string, a byte string, or a code fragment;
	 * null for anything else
	 */
	static @Nullable String text(@Nullable Object value) {
		if (value instanceof String s) {
			return s;
		} else if (value instanceof byte[] b) {
			return new String(b, UTF_8);
		} else if (value instanceof PickleObject o && isExpression(o)) {
			return text(expressionSource(o));
		}
		return null;
	}

	static String requireText(@Nullable Object value, String what) {
		String result = text(value);
		if (result == null) {
			throw new MalformedTreeException(what + " should be a string, not " + describe(value));
		}
		return result;
	}

	static int integer(@Nullable Object value) {
		if (value instanceof Number n) {
			return n.intValue();
		}
		throw new MalformedTreeException("Expected an int, not " + describe(value));
	}

	/**
	 * @return the elements of a list or tuple, or null for anything else
	 */
	static @Nullable List<Object> sequence(@Nullable Object value) {
		if (value instanceof PyTuple t) {
			return t.items();
		} else if (value instanceof List<?> list) {
			return new ArrayList<>(list);
		}
		return null;
	}

	static List<Object> requireSequence(@Nullable Object value, String what) {
		List<Object> result = sequence(value);
		if (result == null) {
			throw new MalformedTreeException(what + " should be a list or tuple, not " + describe(value));
		}
		return result;
	}

	static List<String> strings(@Nullable Object value, String what) {
		if (value == null) {
			return List.of();
		}
		List<String> result = new ArrayList<>();
		for (Object item : requireSequence(value, what)) {
			result.add(requireText(item, what + " element"));
		}
		return result;
	}

	static String describe(@Nullable Object value) {
		if (value == null) {
			return "None";
		} else if (value instanceof PickleObject o) {
			return o.className().toString();
		} else if (value instanceof PickleType t) {
			return "class " + t.className();
		}
		return value.getClass().getSimpleName();
	}

	// Code fragments

	static boolean isExpression(PickleObject o) {
		return o.className().name().equals("PyExpr");
	}

	private static @Nullable Object expressionSource(PickleObject o) {
		if (!o.args().isEmpty()) {
			return o.args().get(0);
		} else if (o.get("expr") != null) {
			return o.get("expr");
		}
		return o.state();
	}

	static @Nullable PyExpr expr(@Nullable Object value, Location fallback) {
		if (value == null) {
			return null;
		}
		String source = requireText(value, "Expression");
		Location location = fallback;
		if (value instanceof PickleObject o && o.args().size() >= 3) {
			String filename = text(o.args().get(1));
			if (filename != null && o.args().get(2) instanceof Number line) {
				location = new Location(filename, line.intValue());
			}
		}
		return new PyExpr(source, location);
	}

	static PyExpr requireExpr(@Nullable Object value, Location fallback, String what) {
		PyExpr result = expr(value, fallback);
		if (result == null) {
			throw new MalformedTreeException(what + " at " + fallback + " is missing");
		}
		return result;
	}

	static List<PyExpr> exprs(@Nullable Object value, Location fallback) {
		if (value == null) {
			return List.of();
		}
		List<PyExpr> result = new ArrayList<>();
		for (Object item : requireSequence(value, "Expression list")) {
			result.add(requireExpr(item, fallback, "Expression list element"));
		}
		return result;
	}

	/**
	 * A compiled code block keeps its source as the second element of its state,
	 * followed by a {@code (filename, line)} pair and the compilation mode.
	 */
	static PyCode code(@Nullable Object value, Location fallback) {
		if (value instanceof PickleObject o && o.className().name().equals("PyCode")) {
			if (o.state() instanceof PyTuple state && state.size() >= 2) {
				Location location = fallback;
				if (state.size() >= 3 && state.get(2) instanceof PyTuple loc && loc.size() >= 2) {
					location = new Location(requireText(loc.get(0), "Code location"), integer(loc.get(1)));
				}
				String mode = state.size() >= 4 && text(state.get(3)) != null ? text(state.get(3)) : "exec";
				return new PyCode(requireText(state.get(1), "Code source"), location, mode);
			} else if (o.get("source") != null) {
				return new PyCode(requireText(o.get("source"), "Code source"), fallback, "exec");
			}
			throw new MalformedTreeException("PyCode at " + fallback + " has no source");
		}
		String source = text(value);
		if (source == null) {
			throw new MalformedTreeException("Expected code at " + fallback + ", not " + describe(value));
		}
		return new PyCode(source, fallback, "exec");
	}

	// Structured leaves

	/**
	 * Image specifiers come in three lengths as the engine has grown:
	 * {@code (name, at_list, layer)}, then
	 * {@code (name, expression, tag, at_list, layer, zorder)}, and finally
	 * the same with {@code behind} appended.
	 */
	static ImageSpec imageSpec(@Nullable Object value, Location location) {
		List<Object> parts = requireSequence(value, "Image specifier");
		List<Object> aligned = new ArrayList<>(7);
		switch (parts.size()) {
			case 3 -> {
				aligned.add(parts.get(0));
				aligned.add(null);
				aligned.add(null);
				aligned.add(parts.get(1));
				aligned.add(parts.get(2));
				aligned.add(null);
				aligned.add(null);
			}
			case 6, 7 -> {
				aligned.addAll(parts);
				if (parts.size() == 6) {
					aligned.add(null);
				}
			}
			default -> throw new MalformedTreeException("Image specifier at " + location
				+ " has " + parts.size() + " elements; expected 3, 6 or 7");
		}
		return new ImageSpec(
			strings(aligned.get(0), "Image name"),
			expr(aligned.get(1), location),
			text(aligned.get(2)),
			exprs(aligned.get(3), location),
			text(aligned.get(4)),
			expr(aligned.get(5), location),
			strings(aligned.get(6), "Image behind list"));
	}

	/**
	 * Handles both the legacy {@code ParameterInfo} form, which lists
	 * {@code (name, default)} pairs and names the positional ones separately,
	 * and the {@code Signature} form, whose parameters carry their own kind.
	 */
	static @Nullable ParameterSignature parameters(@Nullable Object value) {
		if (value == null) {
			return null;
		}
		if (!(value instanceof PickleObject o)) {
			throw new MalformedTreeException("Expected parameters, not " + describe(value));
		}
		Attributes a = new Attributes(o);
		if (a.className().equals("Signature")) {
			return signature(a);
		}

		List<Object> pairs = a.list("parameters");
		Set<String> positional = new HashSet<>(strings(a.raw("positional"), "Positional parameters"));
		Set<String> positionalOnly = new HashSet<>(strings(a.raw("positional_only"), "Positional-only parameters"));
		Set<String> keywordOnly = new HashSet<>(strings(a.raw("keyword_only"), "Keyword-only parameters"));
		String extrapos = a.optionalString("extrapos");
		String extrakw = a.optionalString("extrakw");

		List<Parameter> before = new ArrayList<>();
		List<Parameter> after = new ArrayList<>();
		for (Object pair : pairs) {
			List<Object> nameAndDefault = requireSequence(pair, "Parameter");
			String name = requireText(nameAndDefault.get(0), "Parameter name");
			String defaultValue = nameAndDefault.size() > 1 ? text(nameAndDefault.get(1)) : null;
			if (positionalOnly.contains(name)) {
				before.add(new Parameter(name, Kind.POSITIONAL_ONLY, defaultValue));
			} else if (positional.contains(name) && !keywordOnly.contains(name)) {
				before.add(new Parameter(name, Kind.POSITIONAL_OR_KEYWORD, defaultValue));
			} else {
				after.add(new Parameter(name, Kind.KEYWORD_ONLY, defaultValue));
			}
		}
		List<Parameter> result = new ArrayList<>(before);
		if (extrapos != null) {
			result.add(new Parameter(extrapos, Kind.VAR_POSITIONAL, null));
		}
		result.addAll(after);
		if (extrakw != null) {
			result.add(new Parameter(extrakw, Kind.VAR_KEYWORD, null));
		}
		return new ParameterSignature(result);
	}

	private static ParameterSignature signature(Attributes a) {
		Map<?, ?> parameters = a.optionalMap("parameters");
		List<Parameter> result = new ArrayList<>();
		if (parameters != null) {
			for (var entry : parameters.entrySet()) {
				if (!(entry.getValue() instanceof PickleObject p)) {
					throw new MalformedTreeException("Signature parameter should be an object, not " + describe(entry.getValue()));
				}
				Attributes pa = new Attributes(p);
				String name = pa.optionalString("name");
				result.add(new Parameter(
					name == null ? requireText(entry.getKey(), "Parameter name") : name,
					parameterKind(pa.raw("kind"), pa),
					pa.optionalString("default")));
			}
		}
		return new ParameterSignature(result);
	}

	/**
	 * The kind is an {@code IntEnum}. The allow-list normally reduces it to its
	 * number, but a stricter list leaves a record whose argument is the number.
	 */
	private static Kind parameterKind(@Nullable Object value, Attributes parameter) {
		if (value == null) {
			return Kind.POSITIONAL_OR_KEYWORD;
		}
		Object code = value;
		if (value instanceof PickleObject o && o.args().size() == 1) {
			code = o.args().get(0);
		}
		if (!(code instanceof Long n) || n < 0 || n >= Kind.values().length) {
			throw new MalformedTreeException("Parameter kind at " + parameter.location() + " should be 0 to 4, not " + describe(value));
		}
		return Kind.fromCode(n.intValue());
	}

	/**
	 * Arguments are {@code (keyword, expression)} pairs. Unpacked arguments are
	 * identified by index, or in the oldest form by separate
	 * {@code extrapos} and {@code extrakw} expressions that follow the others.
	 */
	static @Nullable ArgumentList arguments(@Nullable Object value) {
		if (value == null) {
			return null;
		}
		if (!(value instanceof PickleObject o)) {
			throw new MalformedTreeException("Expected arguments, not " + describe(value));
		}
		Attributes a = new Attributes(o);
		Set<Integer> starred = indexes(a.raw("starred_indexes"));
		Set<Integer> doubleStarred = indexes(a.raw("doublestarred_indexes"));
		List<Argument> result = new ArrayList<>();
		List<Object> pairs = a.list("arguments");
		for (int i = 0; i < pairs.size(); i++) {
			List<Object> pair = requireSequence(pairs.get(i), "Argument");
			String name = text(pair.get(0));
			String expression = requireText(pair.get(1), "Argument value");
			if (starred.contains(i)) {
				result.add(new Argument(null, expression, ArgumentList.Kind.STARRED));
			} else if (doubleStarred.contains(i)) {
				result.add(new Argument(null, expression, ArgumentList.Kind.DOUBLE_STARRED));
			} else {
				result.add(new Argument(name, expression, ArgumentList.Kind.PLAIN));
			}
		}
		String extrapos = a.optionalString("extrapos");
		if (extrapos != null) {
			result.add(new Argument(null, extrapos, ArgumentList.Kind.STARRED));
		}
		String extrakw = a.optionalString("extrakw");
		if (extrakw != null) {
			result.add(new Argument(null, extrakw, ArgumentList.Kind.DOUBLE_STARRED));
		}
		return new ArgumentList(result);
	}

	private static Set<Integer> indexes(@Nullable Object value) {
		Set<Integer> result = new HashSet<>();
		if (value instanceof Collection<?> c) {
			c.forEach(i -> result.add(integer(i)));
		} else if (value instanceof PyTuple t) {
			t.items().forEach(i -> result.add(integer(i)));
		} else if (value != null) {
			throw new MalformedTreeException("Expected a set of indexes, not " + describe(value));
		}
		return result;
	}

	/**
	 * Lexer lines are {@code (filename, number, text, block)} tuples,
	 * or {@code GroupedLine} records that also carry the indentation.
	 */
	static List<LexerLine> lexerLines(@Nullable Object value) {
		if (value == null) {
			return List.of();
		}
		List<LexerLine> result = new ArrayList<>();
		for (Object item : requireSequence(value, "Lexer block")) {
			List<Object> fields;
			if (item instanceof PickleObject o && o.className().name().equals("GroupedLine")) {
				fields = o.args();
				if (fields.size() < 5) {
					throw new MalformedTreeException("GroupedLine has " + fields.size() + " fields; expected 5");
				}
				result.add(new LexerLine(requireText(fields.get(0), "Line filename"), integer(fields.get(1)),
					requireText(fields.get(3), "Line text"), lexerLines(fields.get(4))));
			} else {
				fields = requireSequence(item, "Lexer line");
				if (fields.size() < 4) {
					throw new MalformedTreeException("Lexer line has " + fields.size() + " fields; expected 4");
				}
				result.add(new LexerLine(requireText(fields.get(0), "Line filename"), integer(fields.get(1)),
					requireText(fields.get(2), "Line text"), lexerLines(fields.get(3))));
			}
		}
		return result;
	}
}
