package works.rpycdec.ast;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.rpycdec.ast.TranslatableString.Kind.DIALOGUE;
import static works.rpycdec.ast.TranslatableString.Kind.MENU_ITEM;
import static works.rpycdec.ast.TranslatableString.Kind.STRING_NEW;
import static works.rpycdec.ast.TranslatableString.Kind.STRING_OLD;

class NodeScannerTest {
	static final String FILE = "game/script.rpy";

	@Test
	void flattenVisitsParentsBeforeChildren() {
		Say inner = say(3, "Inside");
		Label label = new Label(at(1), "start", List.of(
			new If(at(2), List.of(new If.Entry(PyExpr.of("x"), List.of(inner)))),
			new Pass(at(4))), null, false);
		List<Node> flat = Nodes.flatten(List.of(label));
		assertEquals(List.of("Label", "If", "Say", "Pass"), flat.stream().map(Node::kind).toList());
	}

	@Test
	void translatedSayIsReachable() {
		TranslateSay ts = new TranslateSay(at(5), say(5, "Hi"), "start_1", null, null);
		assertEquals(List.of(ts, ts.say()), Nodes.flatten(ts));
	}

	@Test
	void stringsInSourceOrder() {
		Menu menu = new Menu(at(10), List.of(
			new MenuItem("Left", null, List.of(say(11, "You went left.")), null),
			new MenuItem("Right", null, null, null)), null, null, null, null);
		List<Node> nodes = List.of(
			say(9, "Which way?"),
			menu,
			new Init(at(20), 0, List.of(new TranslateString(at(21), "french", "Left", "Gauche"))));

		List<TranslatableString> expected = List.of(
			new TranslatableString(FILE, 9, "Which way?", DIALOGUE),
			new TranslatableString(FILE, 10, "Left", MENU_ITEM),
			new TranslatableString(FILE, 10, "Right", MENU_ITEM),
			new TranslatableString(FILE, 11, "You went left.", DIALOGUE),
			new TranslatableString(FILE, 21, "Left", STRING_OLD),
			new TranslatableString(FILE, 21, "Gauche", STRING_NEW));
		assertEquals(expected, NodeScanner.strings(nodes));
	}

	static Location at(int line) {
		return new Location(FILE, line);
	}

	static Say say(int line, String what) {
		return new Say(at(line), "e", List.of(), List.of(), what, true, null, null, null);
	}
}
