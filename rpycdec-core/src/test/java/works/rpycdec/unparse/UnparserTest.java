package works.rpycdec.unparse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.rpycdec.ast.ArgumentList;
import works.rpycdec.ast.ArgumentList.Argument;
import works.rpycdec.ast.Call;
import works.rpycdec.ast.Define;
import works.rpycdec.ast.EarlyPython;
import works.rpycdec.ast.EndTranslate;
import works.rpycdec.ast.If;
import works.rpycdec.ast.Image;
import works.rpycdec.ast.ImageSpec;
import works.rpycdec.ast.Init;
import works.rpycdec.ast.Jump;
import works.rpycdec.ast.Label;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.Menu;
import works.rpycdec.ast.MenuItem;
import works.rpycdec.ast.Node;
import works.rpycdec.ast.ParameterSignature;
import works.rpycdec.ast.ParameterSignature.Parameter;
import works.rpycdec.ast.Pass;
import works.rpycdec.ast.PyCode;
import works.rpycdec.ast.PyExpr;
import works.rpycdec.ast.Python;
import works.rpycdec.ast.RawNode;
import works.rpycdec.ast.Return;
import works.rpycdec.ast.Say;
import works.rpycdec.ast.Scene;
import works.rpycdec.ast.Show;
import works.rpycdec.ast.Style;
import works.rpycdec.ast.Testcase;
import works.rpycdec.ast.Translate;
import works.rpycdec.ast.TranslateBlock;
import works.rpycdec.ast.TranslateString;
import works.rpycdec.ast.UserStatement;
import works.rpycdec.ast.With;
import works.rpycdec.exceptions.UnsupportedConstructException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnparserTest {
	static final Location L = new Location("game/script.rpy", 10);

	final Unparser unparser = new Unparser();

	// Folding

	@Test
	void nonInteractiveSay_becomesMenuCaption() {
		String actual = unparser.render(List.of(
			say("e", "Choose.").withInteract(false),
			menu(null)));
		assertEquals("""
			menu:
			    e "Choose."
			    "Yes":
			        jump yes
			    "No":
			        jump no""", actual);
	}

	@Test
	void interactiveSay_isNotACaption() {
		String actual = unparser.render(List.of(say("e", "Hmm."), menu(null)));
		assertEquals("""
			e "Hmm."
			menu:
			    "Yes":
			        jump yes
			    "No":
			        jump no""", actual);
	}

	@Test
	void emptyLabel_namesMenu() {
		String actual = unparser.render(List.of(label("choice", List.of()), menu("choice")));
		assertEquals("""
			menu choice:
			    "Yes":
			        jump yes
			    "No":
			        jump no""", actual);
	}

	@Test
	void emptyLabel_andCaption_namesCaptionedMenu() {
		String actual = unparser.render(List.of(
			label("choice", List.of()),
			say(null, "What now?").withInteract(false),
			menu("choice")));
		assertEquals("""
			menu choice:
			    "What now?"
			    "Yes":
			        jump yes
			    "No":
			        jump no""", actual);
	}

	@Test
	void labelForAnotherStatement_isNotFolded() {
		String actual = unparser.render(List.of(label("elsewhere", List.of()), menu("choice"), new Pass(L)));
		assertEquals("""
			label elsewhere:
			menu:
			    "Yes":
			        jump yes
			    "No":
			        jump no
			pass""", actual);
	}

	@Test
	void callAndReturnLabel_becomeCallFrom() {
		String actual = unparser.render(List.of(
			new Call(L, "sub", false, null),
			label("after_sub", List.of()),
			new Pass(L),
			say("e", "Back.")));
		assertEquals("""
			call sub from after_sub
			e "Back.\"""", actual);
	}

	@Test
	void callFrom_withoutPass() {
		String actual = unparser.render(List.of(
			new Call(L, "target_var", true, new ArgumentList(List.of(Argument.positional("1")))),
			label("ret", List.of()),
			say("e", "Back.")));
		assertEquals("""
			call expression target_var pass (1) from ret
			e "Back.\"""", actual);
	}

	@Test
	void transitionPair_becomesWithClause() {
		String actual = unparser.render(List.of(
			new With(L, PyExpr.of("None"), PyExpr.of("dissolve")),
			new Show(L, spec("eileen", "happy"), null),
			new With(L, PyExpr.of("dissolve"), null)));
		assertEquals("show eileen happy with dissolve", actual);
	}

	@Test
	void transitionPair_onStatementWithBlock() {
		String actual = unparser.render(List.of(
			new With(L, PyExpr.of("None"), PyExpr.of("fade")),
			new Scene(L, spec("bg", "room"), "master", null),
			new With(L, PyExpr.of("fade"), null)));
		assertEquals("scene bg room with fade", actual);
	}

	@Test
	void standaloneWith() {
		assertEquals("with dissolve", unparser.render(List.of(new With(L, PyExpr.of("dissolve"), null))));
	}

	@Test
	void unmatchedTransitionOpener() {
		List<Node> nodes = List.of(
			new With(L, PyExpr.of("None"), PyExpr.of("dissolve")),
			new Show(L, spec("eileen"), null));
		assertThrows(UnsupportedConstructException.class, () -> unparser.render(nodes));
	}

	@Test
	void finalReturn_isImplicit() {
		String actual = unparser.render(List.of(
			label("start", List.of(say("e", "Hi"), new Return(L, null)))));
		assertEquals("""
			label start:
			    e "Hi\"""", actual);
	}

	@Test
	void returnBeforeTheEnd_isKept() {
		String actual = unparser.render(List.of(
			label("a", List.of(say("e", "Hi"), new Return(L, null))),
			label("b", List.of(new Return(L, null)))));
		assertEquals("""
			label a:
			    e "Hi"
			    return
			label b:
			    return""", actual);
	}

	@Test
	void returnWithValue_isKept() {
		String actual = unparser.render(List.of(say("e", "Hi"), new Return(L, PyExpr.of("42"))));
		assertEquals("e \"Hi\"\nreturn 42", actual);
	}

	// Individual statements

	@Test
	void say() {
		Say say = new Say(L, "e", List.of("happy"), List.of("surprised"), "Hi", true, "dissolve", "id1",
			new ArgumentList(List.of(Argument.positional("1"), Argument.keyword("x", "2"))));
		assertEquals("e happy @ surprised \"Hi\" with dissolve id id1 (1, x=2)", unparser.render(say));
	}

	@Test
	void sayEscapes() {
		assertEquals("\"He said \\\"hi\\\" \\ twice\\n\"", unparser.render(say(null, "He said \"hi\"  twice\n")));
	}

	@Test
	void nonInteractiveSay() {
		assertEquals("e \"Wait\" nointeract", unparser.render(say("e", "Wait").withInteract(false)));
	}

	@Test
	void labelWithParameters() {
		ParameterSignature params = new ParameterSignature(List.of(
			new Parameter("a", ParameterSignature.Kind.POSITIONAL_OR_KEYWORD, null),
			new Parameter("b", ParameterSignature.Kind.POSITIONAL_OR_KEYWORD, "2")));
		Label label = new Label(L, "greet", List.of(new Pass(L)), params, true);
		assertEquals("label greet(a, b=2) hide:\n    pass", unparser.render(label));
	}

	@Test
	void jumpAndCall() {
		assertEquals("jump start", unparser.render(new Jump(L, "start", false)));
		assertEquals("jump expression target", unparser.render(new Jump(L, "target", true)));
		assertEquals("call greet(\"you\")", unparser.render(new Call(L, "greet", false,
			new ArgumentList(List.of(Argument.positional("\"you\""))))));
	}

	@Test
	void conditional() {
		If node = new If(L, List.of(
			new If.Entry(PyExpr.of("x > 1"), List.of(new Jump(L, "a", false))),
			new If.Entry(PyExpr.of("x < 0"), List.of(new Jump(L, "b", false))),
			new If.Entry(PyExpr.of("True"), List.of(new Pass(L)))));
		assertEquals("""
			if x > 1:
			    jump a
			elif x < 0:
			    jump b
			else:
			    pass""", unparser.render(node));
	}

	@Test
	void writtenOutTrueIsNotElse() {
		If node = new If(L, List.of(
			new If.Entry(PyExpr.of("True"), List.of(new Jump(L, "a", false))),
			new If.Entry(PyExpr.of("x"), List.of(new Jump(L, "b", false)))));
		assertEquals("""
			if True:
			    jump a
			elif x:
			    jump b""", unparser.render(node));
	}

	@Test
	void python() {
		assertEquals("$ x = 1", unparser.render(python("x = 1", false, "store")));
		assertEquals("python hide:\n    x = 1", unparser.render(python("x = 1", true, "store")));
		assertEquals("python in mystore:\n    x = 1", unparser.render(python("x = 1", false, "store.mystore")));
		assertEquals("python:\n    x = 1\n    y = 2", unparser.render(python("x = 1\ny = 2", false, "store")));
		assertEquals("python early hide:\n    x = 1",
			unparser.render(new EarlyPython(L, new PyCode("x = 1", L, "exec"), true, "store")));
	}

	@Test
	void initShorthands() {
		assertEquals("define 5 x = 1", unparser.render(init(5, define("x", "1"))));
		assertEquals("define config.debug = True", unparser.render(init(0,
			new Define(L, "store.config", "debug", null, "=", new PyCode("True", L, "eval")))));
		assertEquals("init python:\n    a = 1", unparser.render(init(0, python("a = 1", false, "store"))));
		assertEquals("init -1 python hide:\n    a = 1", unparser.render(init(-1, python("a = 1", true, "store"))));
		assertEquals("image bg room = Solid(\"#000\")", unparser.render(init(500,
			new Image(L, List.of("bg", "room"), new PyCode("Solid(\"#000\")", L, "eval"), null))));
	}

	@Test
	void initBlock() {
		assertEquals("""
			init 1:
			    jump a
			    jump b""", unparser.render(init(1, new Jump(L, "a", false), new Jump(L, "b", false))));
		assertEquals("init 2 jump a", unparser.render(init(2, new Jump(L, "a", false))));
	}

	@Test
	void emptyInit() {
		assertThrows(UnsupportedConstructException.class, () -> unparser.render(new Init(L, 0, List.of())));
	}

	@Test
	void defineWithIndexAndOperator() {
		Define node = new Define(L, "store", "inventory", PyExpr.of("\"sword\""), "+=", new PyCode("1", L, "eval"));
		assertEquals("define inventory[\"sword\"] += 1", unparser.render(node));
	}

	@Test
	void imageSpecifier() {
		ImageSpec spec = new ImageSpec(List.of("eileen", "happy"), null, "e2",
			List.of(PyExpr.of("left"), PyExpr.of("flip")), "overlay", PyExpr.of("5"), List.of("bg", "lucy"));
		assertEquals("show eileen happy as e2 at left, flip onlayer overlay zorder 5 behind bg, lucy",
			unparser.render(new Show(L, spec, null)));

		ImageSpec expression = new ImageSpec(List.of(), PyExpr.of("portrait"), "p", List.of(), null, null, List.of());
		assertEquals("show expression portrait as p", unparser.render(new Show(L, expression, null)));
	}

	@Test
	void scene() {
		assertEquals("scene", unparser.render(new Scene(L, null, "master", null)));
		assertEquals("scene onlayer overlay", unparser.render(new Scene(L, null, "overlay", null)));
	}

	@Test
	void style() {
		Map<String, PyExpr> two = new LinkedHashMap<>();
		two.put("color", PyExpr.of("\"#fff\""));
		assertEquals("style big is default color \"#fff\"",
			unparser.render(new Style(L, "big", "default", false, null, List.of(), null, two)));

		Map<String, PyExpr> three = new LinkedHashMap<>(two);
		three.put("size", PyExpr.of("40"));
		assertEquals("""
			style big:
			    clear
			    color "#fff"
			    size 40""", unparser.render(new Style(L, "big", null, true, null, List.of(), null, three)));
	}

	@Test
	void userStatement() {
		UserStatement node = new UserStatement(L, "nvl clear", List.of(), null);
		assertEquals("nvl clear", unparser.render(node));
	}

	@Test
	void translations() {
		Translate translate = new Translate(L, "start_abc123", "french", List.of(say("e", "Bonjour")), null);
		assertEquals("translate french start_abc123:\n    e \"Bonjour\"", unparser.render(translate));

		Translate source = new Translate(L, "start_abc123", null, List.of(say("e", "Hello")), null);
		assertEquals("e \"Hello\"", unparser.render(List.of(source, new EndTranslate(L))));

		assertEquals("""
			translate french strings:
			    old "Yes"
			    new "Oui\"""", unparser.render(new TranslateString(L, "french", "Yes", "Oui")));
	}

	@Test
	void noFaithfulRendering() {
		UnsupportedConstructException testcase = assertThrows(UnsupportedConstructException.class,
			() -> unparser.render(new Testcase(L, "smoke", List.of())));
		assertEquals(L.linenumber(), testcase.linenumber());

		UnsupportedConstructException raw = assertThrows(UnsupportedConstructException.class,
			() -> unparser.render(new RawNode(L, "renpy.ast.Future")));
		assertEquals("renpy.ast.Future", raw.nodeType());
	}

	// Settings

	@Test
	void customIndent() {
		Unparser tabs = new Unparser("\t", RenderHook.IDENTITY);
		assertEquals("label start:\n\te \"Hi\"", tabs.render(List.of(label("start", List.of(say("e", "Hi"))))));
	}

	@Test
	void hookRewritesEveryStatement() {
		RenderHook translateHook = n -> n instanceof Say s ? s.withWhat(s.what().toUpperCase()) : n;
		Unparser shouting = new Unparser("    ", translateHook);
		assertEquals("label start:\n    e \"HI\"", shouting.render(List.of(label("start", List.of(say("e", "Hi"))))));
	}

	@Test
	void hookSeesNestedPython() {
		List<Node> seen = new ArrayList<>();
		RenderHook renameHook = n -> {
			seen.add(n);
			return n instanceof Python p ? python(p.code().source().replace("old", "new"), p.hide(), p.store()) : n;
		};
		Unparser renaming = new Unparser("    ", renameHook);

		Init init = init(0, python("old = 1", false, "store"));
		assertEquals("init python:\n    new = 1", renaming.render(init));
		assertEquals(2, seen.size());

		TranslateBlock translated = new TranslateBlock(L, "french", List.of(python("old = 2", false, "store")), false);
		assertEquals("translate french python:\n    new = 2", renaming.render(translated));
	}

	@Test
	void headerSuffix() {
		assertEquals("show x with fade:\n    zoom 2", Unparser.appendToHeader("show x:\n    zoom 2", " with fade"));
		assertEquals("show x with fade", Unparser.appendToHeader("show x", " with fade"));
	}

	// Fixtures

	static Say say(String who, String what) {
		return new Say(L, who, List.of(), List.of(), what, true, null, null, null);
	}

	static Label label(String name, List<Node> block) {
		return new Label(L, name, block, null, false);
	}

	static Menu menu(String statementStartLabel) {
		return new Menu(L, List.of(
			new MenuItem("Yes", PyExpr.of("True"), List.of(new Jump(L, "yes", false)), null),
			new MenuItem("No", PyExpr.of("True"), List.of(new Jump(L, "no", false)), null)),
			null, null, null, statementStartLabel);
	}

	static ImageSpec spec(String... name) {
		return new ImageSpec(List.of(name), null, null, List.of(), null, null, List.of());
	}

	static Python python(String source, boolean hide, String store) {
		return new Python(L, new PyCode(source, L, "exec"), hide, store);
	}

	static Define define(String name, String value) {
		return new Define(L, "store", name, null, "=", new PyCode(value, L, "eval"));
	}

	static Init init(int priority, Node... block) {
		return new Init(L, priority, List.of(block));
	}
}
