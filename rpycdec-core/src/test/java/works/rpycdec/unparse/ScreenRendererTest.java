package works.rpycdec.unparse;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.rpycdec.ast.ArgumentList;
import works.rpycdec.ast.ArgumentList.Argument;
import works.rpycdec.ast.Init;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.ParameterSignature;
import works.rpycdec.ast.PyCode;
import works.rpycdec.ast.PyExpr;
import works.rpycdec.ast.Screen;
import works.rpycdec.ast.sl.Keyword;
import works.rpycdec.ast.sl.SlBlock;
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

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScreenRendererTest {
	static final Location L = new Location("game/screens.rpy", 20);

	final ScreenRenderer renderer = new ScreenRenderer(new Indenter("    "));

	@Test
	void screenAtDefaultPriority_isUnwrapped() {
		SlScreen screen = new SlScreen(L, "hello", null, List.of(keyword("modal", "True")), "menu", List.of(
			new SlDisplayable(L, "text", List.of(PyExpr.of("\"Hello\"")), List.of(keyword("size", "40")), List.of())));
		String actual = new Unparser().render(new Init(L, -500, List.of(new Screen(L, screen))));
		assertEquals("""
			screen hello:
			    modal True
			    tag menu
			    text "Hello" size 40""", actual);
	}

	@Test
	void screenWithParameters() {
		SlScreen screen = new SlScreen(L, "choice", new ParameterSignature(List.of(
			new ParameterSignature.Parameter("items", ParameterSignature.Kind.POSITIONAL_OR_KEYWORD, null))),
			List.of(), null, List.of());
		assertEquals("screen choice(items):\n    pass", renderer.render(screen));
	}

	@Test
	void displayableWithChildren() {
		SlDisplayable vbox = new SlDisplayable(L, "vbox", List.of(), List.of(keyword("xalign", "0.5")), List.of(
			new SlDisplayable(L, "textbutton", List.of(PyExpr.of("\"Start\"")), List.of(keyword("action", "Start()")), List.of()),
			new SlDisplayable(L, "null", List.of(), List.of(keyword("height", "10")), List.of())));
		assertEquals("""
			vbox:
			    xalign 0.5
			    textbutton "Start" action Start()
			    null height 10""", vbox.accept(renderer));
	}

	@Test
	void conditionals() {
		SlIf node = new SlIf(L, List.of(
			new SlEntry(PyExpr.of("a"), block(new SlPass(L))),
			new SlEntry(PyExpr.of("b"), block(new SlDefault(L, "x", PyExpr.of("1")))),
			new SlEntry(null, block())));
		assertEquals("""
			if a:
			    pass
			elif b:
			    default x = 1
			else:
			    pass""", node.accept(renderer));

		SlShowIf showIf = new SlShowIf(L, List.of(new SlEntry(PyExpr.of("visible"), block(new SlTransclude(L)))));
		assertEquals("showif visible:\n    transclude", showIf.accept(renderer));
	}

	@Test
	void loop() {
		SlFor loop = new SlFor(L, "i", PyExpr.of("i"), PyExpr.of("range(3)"), List.of(), List.of(
			new SlPython(L, new PyCode("total += i", L, "exec"))));
		assertEquals("for i index i in range(3):\n    $ total += i", loop.accept(renderer));
	}

	@Test
	void multiLinePython() {
		SlPython python = new SlPython(L, new PyCode("a = 1\nb = 2", L, "exec"));
		assertEquals("python:\n    a = 1\n    b = 2", python.accept(renderer));
	}

	@Test
	void use() {
		SlUse plain = new SlUse(L, "navigation", false, null, null, null);
		assertEquals("use navigation", plain.accept(renderer));

		SlUse full = new SlUse(L, "screen_name", true,
			new ArgumentList(List.of(Argument.keyword("title", "\"Hi\""))), PyExpr.of("\"nav\""),
			block(new SlPass(L)));
		assertEquals("use expression screen_name pass (title=\"Hi\") id \"nav\":\n    pass", full.accept(renderer));
	}

	static Keyword keyword(String name, String value) {
		return new Keyword(name, PyExpr.of(value));
	}

	static SlBlock block(SlNode... children) {
		return new SlBlock(L, List.of(), List.of(children));
	}
}
