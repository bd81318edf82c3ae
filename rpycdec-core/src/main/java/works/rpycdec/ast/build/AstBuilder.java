package works.rpycdec.ast.build;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.ast.ArgumentList;
import works.rpycdec.ast.Call;
import works.rpycdec.ast.Camera;
import works.rpycdec.ast.Default;
import works.rpycdec.ast.Define;
import works.rpycdec.ast.EarlyPython;
import works.rpycdec.ast.EndTranslate;
import works.rpycdec.ast.Hide;
import works.rpycdec.ast.If;
import works.rpycdec.ast.Image;
import works.rpycdec.ast.Init;
import works.rpycdec.ast.Jump;
import works.rpycdec.ast.Label;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.Menu;
import works.rpycdec.ast.MenuItem;
import works.rpycdec.ast.Node;
import works.rpycdec.ast.Pass;
import works.rpycdec.ast.PyCode;
import works.rpycdec.ast.PyExpr;
import works.rpycdec.ast.Python;
import works.rpycdec.ast.RawNode;
import works.rpycdec.ast.Return;
import works.rpycdec.ast.Say;
import works.rpycdec.ast.Scene;
import works.rpycdec.ast.Screen;
import works.rpycdec.ast.Show;
import works.rpycdec.ast.ShowLayer;
import works.rpycdec.ast.Style;
import works.rpycdec.ast.Testcase;
import works.rpycdec.ast.Transform;
import works.rpycdec.ast.Translate;
import works.rpycdec.ast.TranslateBlock;
import works.rpycdec.ast.TranslateSay;
import works.rpycdec.ast.TranslateString;
import works.rpycdec.ast.UserStatement;
import works.rpycdec.ast.While;
import works.rpycdec.ast.With;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.values.PickleObject;

import static works.rpycdec.ast.build.Values.arguments;
import static works.rpycdec.ast.build.Values.code;
import static works.rpycdec.ast.build.Values.describe;
import static works.rpycdec.ast.build.Values.expr;
import static works.rpycdec.ast.build.Values.exprs;
import static works.rpycdec.ast.build.Values.imageSpec;
import static works.rpycdec.ast.build.Values.lexerLines;
import static works.rpycdec.ast.build.Values.parameters;
import static works.rpycdec.ast.build.Values.requireExpr;
import static works.rpycdec.ast.build.Values.requireSequence;
import static works.rpycdec.ast.build.Values.requireText;
import static works.rpycdec.ast.build.Values.strings;

/**
 * Turns the records produced by the deserializer into {@link Node}s.
 * <p>
 * Each engine statement class has a converter registered under its name.
 * A class from the engine's namespaces with no converter becomes a {@link RawNode},
 * which can be flattened and scanned but not rendered.
 * Anything else where a statement is expected is a {@link MalformedTreeException}.
 * <p>
 * Not thread-safe: it remembers which unmodeled classes it has already reported.
 */
public final class AstBuilder {
	private final Map<String, Converter> converters = new LinkedHashMap<>();
	private final AtlBuilder atl = new AtlBuilder();
	private final ScreenBuilder screens = new ScreenBuilder();
	private final Set<String> reportedRawClasses = new HashSet<>();

	@FunctionalInterface
	private interface Converter {
		Node convert(Attributes a);
	}

	public AstBuilder() {
		converters.put("Say", this::say);
		converters.put("TranslateSay", this::translateSay);
		converters.put("Label", this::label);
		converters.put("Init", a -> new Init(a.location(), a.integer("priority", 0), block(a, "block")));
		converters.put("Python", a -> new Python(a.location(), code(a.raw("code"), a.location()), a.bool("hide", false), store(a)));
		converters.put("EarlyPython", a -> new EarlyPython(a.location(), code(a.raw("code"), a.location()), a.bool("hide", false), store(a)));
		converters.put("Image", a -> new Image(a.location(), strings(a.raw("imgname"), "Image name"), optionalCode(a, "code"), atl.optionalBlock(a.raw("atl"))));
		converters.put("Transform", a -> new Transform(a.location(), store(a), a.string("varname"), parameters(a.raw("parameters")), atl.optionalBlock(a.raw("atl"))));
		converters.put("Show", a -> new Show(a.location(), imageSpec(a.raw("imspec"), a.location()), atl.optionalBlock(a.raw("atl"))));
		converters.put("ShowLayer", a -> new ShowLayer(a.location(), layer(a), exprs(a.raw("at_list"), a.location()), atl.optionalBlock(a.raw("atl"))));
		converters.put("Scene", a -> new Scene(a.location(), a.has("imspec") ? imageSpec(a.raw("imspec"), a.location()) : null, layer(a), atl.optionalBlock(a.raw("atl"))));
		converters.put("Hide", a -> new Hide(a.location(), imageSpec(a.raw("imspec"), a.location())));
		converters.put("With", a -> new With(a.location(), requireExpr(a.raw("expr"), a.location(), "Transition"), expr(a.raw("paired"), a.location())));
		converters.put("Call", a -> new Call(a.location(), a.string("label"), a.bool("expression", false), arguments(a.raw("arguments"))));
		converters.put("Return", a -> new Return(a.location(), expr(a.raw("expression"), a.location())));
		converters.put("Menu", this::menu);
		converters.put("Jump", a -> new Jump(a.location(), a.string("target"), a.bool("expression", false)));
		converters.put("Pass", a -> new Pass(a.location()));
		converters.put("While", a -> new While(a.location(), requireExpr(a.raw("condition"), a.location(), "While condition"), block(a, "block")));
		converters.put("If", this::ifStatement);
		converters.put("UserStatement", this::userStatement);
		converters.put("Define", a -> new Define(a.location(), store(a), a.string("varname"), expr(a.raw("index"), a.location()), operator(a), code(a.raw("code"), a.location())));
		converters.put("Default", a -> new Default(a.location(), store(a), a.string("varname"), code(a.raw("code"), a.location())));
		converters.put("Screen", a -> new Screen(a.location(), screens.screen(a.raw("screen"))));
		converters.put("Translate", a -> new Translate(a.location(), a.optionalString("identifier"), a.optionalString("language"), block(a, "block"), a.optionalString("alternate")));
		converters.put("EndTranslate", a -> new EndTranslate(a.location()));
		converters.put("TranslateString", a -> new TranslateString(a.location(), a.optionalString("language"), a.string("old"), a.string("new")));
		converters.put("TranslateBlock", a -> new TranslateBlock(a.location(), a.optionalString("language"), block(a, "block"), false));
		converters.put("TranslateEarlyBlock", a -> new TranslateBlock(a.location(), a.optionalString("language"), block(a, "block"), true));
		converters.put("TranslatePython", this::translatePython);
		converters.put("Style", this::style);
		converters.put("Testcase", a -> new Testcase(a.location(), a.string("label"), List.of()));
		converters.put("Camera", a -> new Camera(a.location(), layer(a), exprs(a.raw("at_list"), a.location()), atl.optionalBlock(a.raw("atl"))));
	}

	/**
	 * @param value a list of statement records
	 */
	public List<Node> statements(@Nullable Object value) {
		if (value == null) {
			return List.of();
		}
		List<Node> result = new ArrayList<>();
		for (Object item : requireSequence(value, "Statement list")) {
			result.add(statement(item));
		}
		return result;
	}

	public Node statement(@Nullable Object value) {
		if (!(value instanceof PickleObject o)) {
			throw new MalformedTreeException("Expected a statement, not " + describe(value));
		}
		Attributes a = new Attributes(o);
		if (o.className().isIn("renpy") && !o.className().isIn("renpy.sl2") && !o.className().isIn("renpy.atl")) {
			Converter converter = converters.get(a.className());
			if (converter != null) {
				return converter.convert(a);
			}
		}
		if (o.isSubstituted() || !(o.className().isIn("renpy") || o.className().isIn("store"))) {
			throw new MalformedTreeException("Expected a statement at " + a.location() + ", not " + o.className());
		}
		if (reportedRawClasses.add(o.className().toString())) {
			LOGGER.warn("No statement model for {}; it will be kept opaque", o.className());
		}
		return new RawNode(a.location(), o.className().toString());
	}

	private List<Node> block(Attributes a, String name) {
		return statements(a.raw(name));
	}

	private Say say(Attributes a) {
		return new Say(
			a.location(),
			a.optionalString("who"),
			strings(a.raw("attributes"), "Say attributes"),
			strings(a.raw("temporary_attributes"), "Say temporary attributes"),
			a.string("what"),
			a.bool("interact", true),
			a.optionalString("with_"),
			a.optionalString("identifier"),
			arguments(a.raw("arguments")));
	}

	private TranslateSay translateSay(Attributes a) {
		return new TranslateSay(
			a.location(),
			say(a),
			a.optionalString("identifier"),
			a.optionalString("language"),
			a.optionalString("alternate"));
	}

	private Label label(Attributes a) {
		String name = a.optionalString("name");
		if (name == null) {
			name = a.string("_name");
		}
		return new Label(a.location(), name, block(a, "block"), parameters(a.raw("parameters")), a.bool("hide", false));
	}

	/**
	 * Items are {@code (caption, condition, block)} triples.
	 * Their arguments sit in a separate list at the same positions.
	 */
	private Menu menu(Attributes a) {
		List<Object> items = a.list("items");
		List<Object> itemArguments = a.optionalList("item_arguments");
		if (itemArguments != null && itemArguments.size() != items.size()) {
			throw new MalformedTreeException("Menu at " + a.location() + " has " + items.size()
				+ " items but " + itemArguments.size() + " item argument lists");
		}
		List<MenuItem> result = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			List<Object> triple = requireSequence(items.get(i), "Menu item");
			if (triple.size() != 3) {
				throw new MalformedTreeException("Menu item at " + a.location() + " has " + triple.size() + " elements; expected 3");
			}
			Object block = triple.get(2);
			ArgumentList args = itemArguments == null ? null : arguments(itemArguments.get(i));
			result.add(new MenuItem(
				requireText(triple.get(0), "Menu caption"),
				expr(triple.get(1), a.location()),
				block == null ? null : statements(block),
				args));
		}
		return new Menu(a.location(), result, a.optionalString("set"), a.optionalString("with_"), arguments(a.raw("arguments")), statementStartLabel(a));
	}

	/**
	 * Only the label's name is needed, and converting the label itself would revisit
	 * statements that precede the menu.
	 */
	private static @Nullable String statementStartLabel(Attributes a) {
		if (a.raw("statement_start") instanceof PickleObject start && start.className().name().equals("Label")) {
			Attributes label = new Attributes(start);
			String name = label.optionalString("name");
			return name != null ? name : label.optionalString("_name");
		}
		return null;
	}

	private If ifStatement(Attributes a) {
		List<If.Entry> entries = new ArrayList<>();
		for (Object e : a.list("entries")) {
			List<Object> pair = requireSequence(e, "If entry");
			if (pair.size() != 2) {
				throw new MalformedTreeException("If entry at " + a.location() + " should be a (condition, block) pair, not " + pair.size() + " items");
			}
			entries.add(new If.Entry(expr(pair.get(0), a.location()), statements(pair.get(1))));
		}
		return new If(a.location(), entries);
	}

	private UserStatement userStatement(Attributes a) {
		return new UserStatement(
			a.location(),
			a.string("line"),
			lexerLines(a.raw("block")),
			a.has("code_block") ? statements(a.raw("code_block")) : null);
	}

	private TranslateBlock translatePython(Attributes a) {
		Location location = a.location();
		Python python = new Python(location, code(a.raw("code"), location), false, "store");
		return new TranslateBlock(location, a.optionalString("language"), List.of(python), false);
	}

	private Style style(Attributes a) {
		Map<String, PyExpr> properties = new LinkedHashMap<>();
		Map<?, ?> raw = a.optionalMap("properties");
		if (raw != null) {
			raw.forEach((k, v) -> properties.put(requireText(k, "Style property name"), requireExpr(v, a.location(), "Style property value")));
		}
		return new Style(
			a.location(),
			a.string("style_name"),
			a.optionalString("parent"),
			a.bool("clear", false),
			a.optionalString("take"),
			strings(a.raw("delattr"), "Style delattr"),
			expr(a.raw("variant"), a.location()),
			properties);
	}

	private @Nullable PyCode optionalCode(Attributes a, String name) {
		return a.has(name) ? code(a.raw(name), a.location()) : null;
	}

	private static String store(Attributes a) {
		String store = a.optionalString("store");
		return store == null ? "store" : store;
	}

	private static String layer(Attributes a) {
		String layer = a.optionalString("layer");
		return layer == null ? "master" : layer;
	}

	private static String operator(Attributes a) {
		String operator = a.optionalString("operator");
		return operator == null ? "=" : operator;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AstBuilder.class);
}
