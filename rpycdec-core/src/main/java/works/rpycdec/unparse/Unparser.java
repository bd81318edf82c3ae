package works.rpycdec.unparse;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.ast.Call;
import works.rpycdec.ast.Label;
import works.rpycdec.ast.Menu;
import works.rpycdec.ast.Node;
import works.rpycdec.ast.Pass;
import works.rpycdec.ast.Return;
import works.rpycdec.ast.Say;
import works.rpycdec.ast.UserStatement;
import works.rpycdec.ast.With;
import works.rpycdec.exceptions.UnsupportedConstructException;

import static java.util.Objects.requireNonNull;

/**
 * Renders statements as script source.
 * <p>
 * The compiler expands some concise forms into several statements.
 * When rendering a list, this recognizes those expansions by looking
 * up to two statements ahead and renders the concise form instead:
 * <ol>
 *     <li>a non-interactive say followed by a menu is the menu's caption;</li>
 *     <li>
 *         a label with an empty block followed by a menu that starts at that label,
 *         possibly with a caption in between, is the name of the menu;
 *     </li>
 *     <li>
 *         a transition opener, a statement, and the matching transition
 *         are the statement's {@code with} clause;
 *     </li>
 *     <li>
 *         a call followed by a label with an empty block, and usually a {@code pass},
 *         is {@code call ... from label};
 *     </li>
 *     <li>a bare {@code return} at the end of the file is implicit.</li>
 * </ol>
 * When more than one applies, the earliest in this list wins.
 * <p>
 * A statement with no faithful rendering throws {@link UnsupportedConstructException}.
 * Instances are immutable and may be shared between threads if the hook allows it.
 */
public final class Unparser {
	private final Indenter indenter;
	private final RenderHook hook;
	private final StatementRenderer statements;

	public Unparser() {
		this("    ", RenderHook.IDENTITY);
	}

	/**
	 * @param indent one level of indentation
	 * @param hook applied to every statement before it is rendered
	 */
	public Unparser(String indent, RenderHook hook) {
		this.indenter = new Indenter(requireNonNull(indent));
		this.hook = requireNonNull(hook);
		this.statements = new StatementRenderer(this, indenter);
	}

	public String render(Node node) {
		return rewrite(node).accept(statements);
	}

	/**
	 * Renders a whole file's statements. The file's final {@code return} is omitted
	 * when it has no value.
	 */
	public String render(List<? extends Node> nodes) {
		return renderList(nodes, true);
	}

	/**
	 * Renders the body of a compound statement.
	 */
	String renderBlock(List<? extends Node> nodes) {
		return renderList(nodes, false);
	}

	String renderList(List<? extends Node> original, boolean endOfFile) {
		return renderRewritten(rewriteAll(original), endOfFile);
	}

	/**
	 * Renders a block whose statements already went through {@link #rewriteAll}.
	 */
	String renderRewrittenBlock(List<Node> nodes) {
		return renderRewritten(nodes, false);
	}

	List<Node> rewriteAll(List<? extends Node> original) {
		List<Node> nodes = new ArrayList<>(original.size());
		original.forEach(n -> nodes.add(rewrite(n)));
		return nodes;
	}

	private String renderRewritten(List<Node> nodes, boolean endOfFile) {
		List<String> out = new ArrayList<>();
		int i = 0;
		while (i < nodes.size()) {
			Node node = nodes.get(i);
			Node next = at(nodes, i + 1);
			Node afterNext = at(nodes, i + 2);
			boolean isLast = i == nodes.size() - 1;

			if (node instanceof Say say && !say.interact() && next instanceof Menu menu) {
				LOGGER.debug("Folding say at {} into menu caption", say.location());
				emit(out, statements.menu(menu, null, statements.visitSay(say.withInteract(true))));
				i += 2;
			} else if (node instanceof Label label && isCaption(next) && afterNext instanceof Menu menu && namesMenu(label, menu)) {
				LOGGER.debug("Folding label {} and caption into menu", label.name());
				emit(out, statements.menu(menu, label.name(), caption(next)));
				i += 3;
			} else if (node instanceof Label label && next instanceof Menu menu && namesMenu(label, menu)) {
				LOGGER.debug("Folding label {} into menu", label.name());
				emit(out, statements.menu(menu, label.name(), null));
				i += 2;
			} else if (node instanceof With opener && opener.opensPair() && next != null && !(next instanceof With)
				&& afterNext instanceof With closer && closes(opener, closer)) {
				LOGGER.debug("Folding transition {} into statement at {}", closer.expr(), next.location());
				emit(out, withClause(next.accept(statements), closer));
				i += 3;
			} else if (node instanceof Call call && next instanceof Label label && label.block().isEmpty() && label.parameters() == null) {
				LOGGER.debug("Folding return label {} into call", label.name());
				emit(out, appendToHeader(call.accept(statements), " from " + label.name()));
				i += (afterNext instanceof Pass) ? 3 : 2;
			} else if (node instanceof Return ret && ret.expression() == null && isLast && endOfFile && nodes.size() > 1) {
				LOGGER.debug("Omitting implicit return at {}", ret.location());
				i += 1;
			} else if (node instanceof Label label && isLast && endOfFile) {
				emit(out, statements.label(label, true));
				i += 1;
			} else if (node instanceof With with && with.opensPair()) {
				throw new UnsupportedConstructException("With", with.location().filename(), with.location().linenumber(),
					"transition opener for " + with.paired() + " has no matching statement");
			} else {
				emit(out, node.accept(statements));
				i += 1;
			}
		}
		return String.join("\n", out);
	}

	Node rewrite(Node node) {
		return requireNonNull(hook.rewrite(node), "Render hook returned null");
	}

	private static void emit(List<String> out, String rendering) {
		if (!rendering.isEmpty()) {
			out.add(rendering);
		}
	}

	private static @Nullable Node at(List<Node> nodes, int index) {
		return index < nodes.size() ? nodes.get(index) : null;
	}

	private static boolean isCaption(@Nullable Node node) {
		return (node instanceof Say say && !say.interact()) || node instanceof UserStatement;
	}

	private String caption(Node node) {
		if (node instanceof Say say) {
			return statements.visitSay(say.withInteract(true));
		}
		return node.accept(statements);
	}

	private static boolean namesMenu(Label label, Menu menu) {
		return label.block().isEmpty()
			&& label.parameters() == null
			&& (menu.statementStartLabel() == null || menu.statementStartLabel().equals(label.name()));
	}

	private static boolean closes(With opener, With closer) {
		return closer.paired() == null
			&& opener.paired() != null
			&& closer.expr().source().strip().equals(opener.paired().source().strip());
	}

	private static String withClause(String rendering, With closer) {
		return appendToHeader(rendering, " with " + closer.expr().source());
	}

	/**
	 * Adds {@code suffix} to the first line, before its trailing colon if it has one.
	 */
	static String appendToHeader(String rendering, String suffix) {
		int newline = rendering.indexOf('\n');
		String first = newline < 0 ? rendering : rendering.substring(0, newline);
		String rest = newline < 0 ? "" : rendering.substring(newline);
		if (first.endsWith(":")) {
			return first.substring(0, first.length() - 1) + suffix + ":" + rest;
		}
		return first + suffix + rest;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Unparser.class);
}
