package works.rpycdec.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static works.rpycdec.ast.TranslatableString.Kind.DIALOGUE;
import static works.rpycdec.ast.TranslatableString.Kind.MENU_ITEM;
import static works.rpycdec.ast.TranslatableString.Kind.STRING_NEW;
import static works.rpycdec.ast.TranslatableString.Kind.STRING_OLD;

/**
 * Finds player-visible text without modifying anything.
 * <p>
 * To change text instead, render with a
 * {@link works.rpycdec.unparse.RenderHook RenderHook}.
 */
public final class NodeScanner {
	private NodeScanner() { }

	public static List<TranslatableString> strings(List<? extends Node> nodes) {
		List<TranslatableString> result = new ArrayList<>();
		scan(nodes, result::add);
		return result;
	}

	/**
	 * Reports the strings in source order.
	 */
	public static void scan(List<? extends Node> nodes, Consumer<TranslatableString> consumer) {
		for (Node node : Nodes.flatten(nodes)) {
			if (node instanceof Say say) {
				consumer.accept(TranslatableString.at(say.location(), say.what(), DIALOGUE));
			} else if (node instanceof Menu menu) {
				for (MenuItem item : menu.items()) {
					consumer.accept(TranslatableString.at(menu.location(), item.caption(), MENU_ITEM));
				}
			} else if (node instanceof TranslateString ts) {
				consumer.accept(TranslatableString.at(ts.location(), ts.oldText(), STRING_OLD));
				consumer.accept(TranslatableString.at(ts.location(), ts.newText(), STRING_NEW));
			}
		}
	}
}
