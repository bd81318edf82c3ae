package works.rpycdec.ast.build;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.rpycdec.ast.Call;
import works.rpycdec.ast.Define;
import works.rpycdec.ast.If;
import works.rpycdec.ast.ImageSpec;
import works.rpycdec.ast.Label;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.Menu;
import works.rpycdec.ast.Node;
import works.rpycdec.ast.Python;
import works.rpycdec.ast.RawNode;
import works.rpycdec.ast.Say;
import works.rpycdec.ast.Scene;
import works.rpycdec.ast.Screen;
import works.rpycdec.ast.Show;
import works.rpycdec.ast.Transform;
import works.rpycdec.ast.TranslateBlock;
import works.rpycdec.ast.atl.AtlInterpolation;
import works.rpycdec.ast.sl.SlDisplayable;
import works.rpycdec.ast.sl.SlScreen;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.AllowList;
import works.rpycdec.pickle.Unpickler;
import works.rpycdec.testing.PickleWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.rpycdec.testing.PyValues.dict;
import static works.rpycdec.testing.PyValues.global;
import static works.rpycdec.testing.PyValues.instance;
import static works.rpycdec.testing.PyValues.list;
import static works.rpycdec.testing.PyValues.reduce;
import static works.rpycdec.testing.PyValues.tuple;

class AstBuilderTest {
	static final String FILE = "game/script.rpy";

	final AstBuilder builder = new AstBuilder();

	@Test
	void say() {
		Say say = assertInstanceOf(Say.class, build(node("Say", 3,
			"who", "e",
			"what", "Hello",
			"attributes", tuple("happy"),
			"with_", "dissolve",
			"interact", false)));
		assertEquals(new Location(FILE, 3), say.location());
		assertEquals("e", say.who());
		assertEquals(List.of("happy"), say.attributes());
		assertEquals("Hello", say.what());
		assertEquals("dissolve", say.with());
		assertFalse(say.interact());
		assertNull(say.arguments());
	}

	@Test
	void legacyLabelName() {
		Label label = assertInstanceOf(Label.class, build(node("Label", 1,
			"_name", "start",
			"block", list(node("Pass", 2)))));
		assertEquals("start", label.name());
		assertEquals(1, label.block().size());
		assertFalse(label.hide());
	}

	@Test
	void signatureParameters() {
		Object signature = instance("renpy.parameter", "Signature", dict("parameters", dict(
			"a", parameter("a", 1, null),
			"b", parameter("b", 3, "2"),
			"kw", parameter("kw", 4, null))));
		Label label = assertInstanceOf(Label.class, build(node("Label", 1,
			"name", "greet",
			"block", list(node("Pass", 2)),
			"parameters", signature)));
		assertEquals("(a, *, b=2, **kw)", label.parameters().render());
	}

	@Test
	void signatureParameters_badKind() {
		Object signature = instance("renpy.parameter", "Signature", dict("parameters", dict(
			"a", instance("renpy.parameter", "Parameter", dict("name", "a", "kind", 9)))));
		Object value = load(node("Label", 1, "name", "greet", "block", list(), "parameters", signature));
		assertThrows(MalformedTreeException.class, () -> builder.statement(value));
	}

	@Test
	void expressionsCarryTheirOwnLocation() {
		If node = assertInstanceOf(If.class, build(node("If", 5,
			"entries", list(
				tuple(reduce("renpy.ast", "PyExpr", "x > 1", FILE, 6), list(node("Pass", 7))),
				tuple(reduce("renpy.ast", "PyExpr", "True", FILE, 8), list())))));
		assertEquals("x > 1", node.entries().get(0).condition().source());
		assertEquals(new Location(FILE, 6), node.entries().get(0).condition().location());
		assertTrue(node.entries().get(1).isElse());
	}

	@Test
	void callArguments() {
		Object arguments = instance("renpy.ast", "ArgumentInfo", dict(
			"arguments", list(tuple(null, "x"), tuple("y", "2"), tuple(null, "rest")),
			"starred_indexes", list(2)));
		Call call = assertInstanceOf(Call.class, build(node("Call", 4,
			"label", "sub",
			"arguments", arguments)));
		assertEquals("sub", call.label());
		assertEquals("(x, y=2, *rest)", call.arguments().render());
	}

	@Test
	void writtenOutTrueBeforeElif() {
		If node = assertInstanceOf(If.class, build(node("If", 5,
			"entries", list(
				tuple(reduce("renpy.ast", "PyExpr", "True", FILE, 5), list(node("Pass", 6))),
				tuple(reduce("renpy.ast", "PyExpr", "x", FILE, 7), list(node("Pass", 8)))))));
		assertEquals(2, node.entries().size());
		assertEquals("x", node.entries().get(1).condition().source());
	}

	@Test
	void ifEntryNotAPair() {
		Object value = load(node("If", 5, "entries", list(tuple(reduce("renpy.ast", "PyExpr", "x", FILE, 5)))));
		assertThrows(MalformedTreeException.class, () -> builder.statement(value));
	}

	@Test
	void compiledCode() {
		Python python = assertInstanceOf(Python.class, build(node("Python", 4,
			"code", instance("renpy.ast", "PyCode", tuple(1, "x = 1\ny = 2", tuple(FILE, 5), "exec")))));
		assertEquals("x = 1\ny = 2", python.code().source());
		assertEquals(new Location(FILE, 5), python.code().location());
		assertEquals("store", python.store(), "Missing store defaults to the main store");
		assertFalse(python.hide());
	}

	@Test
	void defaults() {
		Define define = assertInstanceOf(Define.class, build(node("Define", 1, "varname", "x", "code", "1")));
		assertEquals("=", define.operator());
		assertEquals("store", define.store());

		Scene scene = assertInstanceOf(Scene.class, build(node("Scene", 1)));
		assertNull(scene.imspec());
		assertEquals("master", scene.layer());
	}

	@Test
	void legacyImageSpecifier() {
		Show show = assertInstanceOf(Show.class, build(node("Show", 1,
			"imspec", tuple(tuple("eileen", "happy"), list("left"), "overlay"))));
		ImageSpec spec = show.imspec();
		assertEquals(List.of("eileen", "happy"), spec.name());
		assertEquals("left", spec.atList().get(0).source());
		assertEquals("overlay", spec.layer());
		assertNull(spec.tag());
	}

	@Test
	void menuWithStartLabel() {
		Object start = node("Label", 1, "name", "choice", "block", list());
		Menu menu = assertInstanceOf(Menu.class, build(node("Menu", 2,
			"items", list(
				tuple("Caption only", "True", null),
				tuple("Go", "True", list(node("Jump", 3, "target", "go")))),
			"statement_start", start)));
		assertEquals("choice", menu.statementStartLabel());
		assertNull(menu.items().get(0).block());
		assertEquals(1, menu.items().get(1).block().size());
	}

	@Test
	void menuArgumentsMismatch() {
		Object value = load(node("Menu", 2,
			"items", list(tuple("Go", "True", list())),
			"item_arguments", list(null, null)));
		assertThrows(MalformedTreeException.class, () -> builder.statement(value));
	}

	@Test
	void translatePython() {
		TranslateBlock block = assertInstanceOf(TranslateBlock.class, build(node("TranslatePython", 1,
			"language", "french",
			"code", "style.default.font = \"f.ttf\"")));
		assertEquals("french", block.language());
		Python python = assertInstanceOf(Python.class, block.block().get(0));
		assertEquals("style.default.font = \"f.ttf\"", python.code().source());
	}

	@Test
	void transformWithAnimation() {
		Object interpolation = atl("RawMultipurpose", 2,
			"warper", "linear",
			"duration", "1.0",
			"properties", list(tuple("xalign", "1.0")));
		Transform transform = assertInstanceOf(Transform.class, build(node("Transform", 1,
			"varname", "slide",
			"atl", atl("RawBlock", 1, "statements", list(interpolation)))));
		AtlInterpolation statement = assertInstanceOf(AtlInterpolation.class, transform.atl().statements().get(0));
		assertEquals("linear", statement.warper());
		assertEquals("xalign", statement.properties().get(0).name());
	}

	@Test
	void screen() {
		Object vbar = instance("renpy.sl2.slast", "SLDisplayable", dict(
			"location", tuple("game/screens.rpy", 3),
			"displayable", global("renpy.sl2.sldisplayables", "sl2vbar"),
			"positional", list(),
			"keyword", list(tuple("value", "v")),
			"children", list()));
		Object frame = instance("renpy.sl2.slast", "SLDisplayable", dict(
			"location", tuple("game/screens.rpy", 4),
			"displayable", global("renpy.display.layout", "Window"),
			"style", "frame",
			"children", list()));
		Object slScreen = instance("renpy.sl2.slast", "SLScreen", dict(
			"location", tuple("game/screens.rpy", 2),
			"name", "bars",
			"keyword", list(tuple("modal", "True")),
			"children", list(vbar, frame)));
		Screen screen = assertInstanceOf(Screen.class, build(node("Screen", 2, "screen", slScreen)));
		SlScreen sl = screen.screen();
		assertEquals("bars", sl.name());
		assertEquals("modal", sl.keywords().get(0).name());
		assertEquals("vbar", assertInstanceOf(SlDisplayable.class, sl.children().get(0)).keyword());
		assertEquals("frame", assertInstanceOf(SlDisplayable.class, sl.children().get(1)).keyword());
	}

	@Test
	void unmodeledEngineClass_isKeptOpaque() {
		RawNode raw = assertInstanceOf(RawNode.class, build(node("RPY", 1)));
		assertEquals("renpy.ast.RPY", raw.className());
		assertInstanceOf(RawNode.class, build(instance("store", "CustomStatement", dict("filename", FILE, "linenumber", 1))));
	}

	@Test
	void foreignClass_isMalformed() {
		Object value = load(instance("os", "system", dict("filename", FILE, "linenumber", 1)));
		assertThrows(MalformedTreeException.class, () -> builder.statement(value));
		assertThrows(MalformedTreeException.class, () -> builder.statement("just a string"));
	}

	@Test
	void statementList() {
		List<Node> nodes = builder.statements(load(list(node("Pass", 1), node("Pass", 2))));
		assertEquals(2, nodes.size());
		assertEquals(List.of(), builder.statements(null));
	}

	// Fixtures

	/**
	 * An engine statement pickled the way classes with slots are: {@code (None, slots)}.
	 */
	static Object node(String className, int line, Object... keysAndValues) {
		Object[] all = new Object[keysAndValues.length + 4];
		all[0] = "filename";
		all[1] = FILE;
		all[2] = "linenumber";
		all[3] = line;
		System.arraycopy(keysAndValues, 0, all, 4, keysAndValues.length);
		return instance("renpy.ast", className, tuple(null, dict(all)));
	}

	static Object atl(String className, int line, Object... keysAndValues) {
		Object[] all = new Object[keysAndValues.length + 2];
		all[0] = "loc";
		all[1] = tuple(FILE, line);
		System.arraycopy(keysAndValues, 0, all, 2, keysAndValues.length);
		return instance("renpy.atl", className, dict(all));
	}

	/**
	 * A signature parameter whose kind is pickled the way {@code inspect} does it.
	 */
	static Object parameter(String name, int kind, String defaultValue) {
		return instance("renpy.parameter", "Parameter", dict(
			"name", name,
			"kind", reduce("inspect", "_ParameterKind", kind),
			"default", defaultValue));
	}

	static Object load(Object value) {
		return new Unpickler(AllowList.withFriendlyNamespaces("renpy", "store")).load(PickleWriter.pickle(value));
	}

	Node build(Object value) {
		return builder.statement(load(value));
	}
}
