package works.rpycdec.ast.build;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.sl.Keyword;
import works.rpycdec.ast.sl.SlBlock;
import works.rpycdec.ast.sl.SlBreak;
import works.rpycdec.ast.sl.SlContinue;
import works.rpycdec.ast.sl.SlDefault;
import works.rpycdec.ast.sl.SlDisplayable;
import works.rpycdec.ast.sl.SlEntry;
import works.rpycdec.ast.sl.SlFor;
import works.rpycdec.ast.sl.SlIf;
import works.rpycdec.ast.sl.SlNode;
import works.rpycdec.ast.sl.SlPass;
import works.rpycdec.ast.sl.SlPython;
import works.rpycdec.ast.sl.SlScreen;
import works.rpycdec.ast.sl.SlShowIf;
import works.rpycdec.ast.sl.SlTransclude;
import works.rpycdec.ast.sl.SlUse;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.PickleType;
import works.rpycdec.pickle.values.PickleObject;

import static works.rpycdec.ast.build.Values.arguments;
import static works.rpycdec.ast.build.Values.code;
import static works.rpycdec.ast.build.Values.describe;
import static works.rpycdec.ast.build.Values.expr;
import static works.rpycdec.ast.build.Values.exprs;
import static works.rpycdec.ast.build.Values.isExpression;
import static works.rpycdec.ast.build.Values.parameters;
import static works.rpycdec.ast.build.Values.requireExpr;
import static works.rpycdec.ast.build.Values.requireSequence;
import static works.rpycdec.ast.build.Values.requireText;
import static works.rpycdec.ast.build.Values.text;

/**
 * Builds screen-language statements from the engine's {@code SL*} records.
 */
final class ScreenBuilder {
	private final Map<String, Converter> converters = new LinkedHashMap<>();

	@FunctionalInterface
	private interface Converter {
		SlNode convert(Attributes a);
	}

	ScreenBuilder() {
		converters.put("SLScreen", this::screenNode);
		converters.put("SLBlock", this::blockNode);
		converters.put("SLDisplayable", this::displayable);
		converters.put("SLIf", a -> new SlIf(a.location(), entries(a)));
		converters.put("SLShowIf", a -> new SlShowIf(a.location(), entries(a)));
		converters.put("SLFor", this::forLoop);
		converters.put("SLPython", a -> new SlPython(a.location(), code(a.raw("code"), a.location())));
		converters.put("SLDefault", a -> new SlDefault(a.location(), a.string("variable"), requireExpr(a.raw("expression"), a.location(), "default value")));
		converters.put("SLUse", this::use);
		converters.put("SLTransclude", a -> new SlTransclude(a.location()));
		converters.put("SLPass", a -> new SlPass(a.location()));
		converters.put("SLContinue", a -> new SlContinue(a.location()));
		converters.put("SLBreak", a -> new SlBreak(a.location()));
	}

	SlScreen screen(Object value) {
		if (node(value) instanceof SlScreen s) {
			return s;
		}
		throw new MalformedTreeException("Expected a screen, not " + describe(value));
	}

	SlNode node(Object value) {
		if (!(value instanceof PickleObject o)) {
			throw new MalformedTreeException("Expected a screen-language statement, not " + describe(value));
		}
		Attributes a = new Attributes(o);
		Converter converter = converters.get(a.className());
		if (converter == null || !o.className().isIn("renpy.sl2")) {
			throw new MalformedTreeException("Unknown screen-language statement " + o.className() + " at " + a.location());
		}
		return converter.convert(a);
	}

	private SlScreen screenNode(Attributes a) {
		return new SlScreen(
			a.location(),
			a.string("name"),
			parameters(a.raw("parameters")),
			keywords(a),
			a.optionalString("tag"),
			children(a));
	}

	private SlBlock blockNode(Attributes a) {
		return new SlBlock(a.location(), keywords(a), children(a));
	}

	private @Nullable SlBlock optionalBlock(@Nullable Object value) {
		if (value == null) {
			return null;
		} else if (node(value) instanceof SlBlock b) {
			return b;
		}
		throw new MalformedTreeException("Expected a screen-language block, not " + describe(value));
	}

	private SlDisplayable displayable(Attributes a) {
		return new SlDisplayable(
			a.location(),
			displayableKeyword(a),
			exprs(a.raw("positional"), a.location()),
			keywords(a),
			children(a));
	}

	/**
	 * Newer engines record the statement's keyword directly. Older ones only
	 * record the function that creates the displayable: those named
	 * {@code sl2xyz} belong to statement {@code xyz}, and generic containers
	 * are known by their style.
	 */
	static String displayableKeyword(Attributes a) {
		String name = a.optionalString("name");
		if (name != null && !name.isEmpty()) {
			return name;
		}
		Object displayable = a.raw("displayable");
		String function;
		if (displayable instanceof PickleType type) {
			function = type.className().name();
		} else if (displayable instanceof PickleObject o) {
			function = o.className().name();
		} else {
			throw a.missing("displayable");
		}
		String lower = function.toLowerCase(Locale.ROOT);
		String keyword;
		if (lower.startsWith("sl2")) {
			keyword = lower.substring(3);
		} else if (lower.equals("onevent")) {
			keyword = "on";
		} else {
			keyword = lower.replace("_", "");
		}
		String style = a.optionalString("style");
		if (style != null && (keyword.equals("multibox") || keyword.equals("window"))) {
			keyword = style;
		}
		return keyword;
	}

	private List<SlEntry> entries(Attributes a) {
		List<SlEntry> result = new ArrayList<>();
		for (Object e : a.list("entries")) {
			List<Object> pair = requireSequence(e, "Screen condition entry");
			SlBlock block = optionalBlock(pair.get(1));
			if (block == null) {
				throw new MalformedTreeException("Screen condition entry at " + a.location() + " has no block");
			}
			result.add(new SlEntry(expr(pair.get(0), a.location()), block));
		}
		return result;
	}

	private SlFor forLoop(Attributes a) {
		return new SlFor(
			a.location(),
			a.string("variable"),
			expr(a.raw("index_expression"), a.location()),
			requireExpr(a.raw("expression"), a.location(), "for expression"),
			keywords(a),
			children(a));
	}

	/**
	 * A target given as a code fragment came from {@code use expression ...};
	 * a plain string is a screen name.
	 */
	private SlUse use(Attributes a) {
		Object target = a.raw("target");
		boolean isExpression = target instanceof PickleObject o && isExpression(o);
		return new SlUse(
			a.location(),
			requireText(target, "use target"),
			isExpression,
			arguments(a.raw("args")),
			expr(a.raw("id"), a.location()),
			optionalBlock(a.raw("block")));
	}

	private List<Keyword> keywords(Attributes a) {
		List<Keyword> result = new ArrayList<>();
		for (Object k : a.list("keyword")) {
			List<Object> pair = requireSequence(k, "Screen keyword");
			String name = requireText(pair.get(0), "Keyword name");
			Object value = pair.size() > 1 ? pair.get(1) : null;
			result.add(new Keyword(name, text(value) == null ? null : expr(value, a.location())));
		}
		return result;
	}

	private List<SlNode> children(Attributes a) {
		List<SlNode> result = new ArrayList<>();
		for (Object c : a.list("children")) {
			result.add(node(c));
		}
		return result;
	}
}
