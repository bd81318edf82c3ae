package works.rpycdec.unparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.ast.Call;
import works.rpycdec.ast.Camera;
import works.rpycdec.ast.Default;
import works.rpycdec.ast.Define;
import works.rpycdec.ast.EarlyPython;
import works.rpycdec.ast.EndTranslate;
import works.rpycdec.ast.Hide;
import works.rpycdec.ast.If;
import works.rpycdec.ast.Image;
import works.rpycdec.ast.ImageSpec;
import works.rpycdec.ast.Init;
import works.rpycdec.ast.Jump;
import works.rpycdec.ast.Label;
import works.rpycdec.ast.LexerLine;
import works.rpycdec.ast.Location;
import works.rpycdec.ast.Menu;
import works.rpycdec.ast.MenuItem;
import works.rpycdec.ast.Node;
import works.rpycdec.ast.NodeVisitor;
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
import works.rpycdec.ast.atl.AtlBlock;
import works.rpycdec.exceptions.UnsupportedConstructException;

/**
 * Renders one statement, delegating nested statement blocks back to the
 * {@link Unparser} so they get the same folding.
 */
final class StatementRenderer implements NodeVisitor<String> {
	private final Unparser unparser;
	private final Indenter indenter;
	private final AtlRenderer atl;
	private final ScreenRenderer screens;

	StatementRenderer(Unparser unparser, Indenter indenter) {
		this.unparser = unparser;
		this.indenter = indenter;
		this.atl = new AtlRenderer(indenter);
		this.screens = new ScreenRenderer(indenter);
	}

	// Dialogue and control flow

	@Override
	public String visitSay(Say node) {
		List<String> parts = new ArrayList<>();
		if (node.who() != null) {
			parts.add(node.who());
		}
		parts.addAll(node.attributes());
		if (!node.temporaryAttributes().isEmpty()) {
			parts.add("@");
			parts.addAll(node.temporaryAttributes());
		}
		parts.add(SayStrings.encode(node.what()));
		if (!node.interact()) {
			parts.add("nointeract");
		}
		if (node.with() != null) {
			parts.add("with " + node.with());
		}
		if (node.identifier() != null) {
			parts.add("id " + node.identifier());
		}
		if (node.arguments() != null) {
			parts.add(node.arguments().render());
		}
		return String.join(" ", parts);
	}

	@Override
	public String visitLabel(Label node) {
		return label(node, false);
	}

	/**
	 * @param endOfFile whether the label is the last statement of its file,
	 * which makes a bare {@code return} at the end of its block implicit
	 */
	String label(Label node, boolean endOfFile) {
		StringBuilder header = new StringBuilder("label ").append(node.name());
		if (node.parameters() != null) {
			header.append(node.parameters().render());
		}
		if (node.hide()) {
			header.append(" hide");
		}
		header.append(":");
		if (node.block().isEmpty()) {
			return header.toString();
		}
		return header + "\n" + indenter.indent(unparser.renderList(node.block(), endOfFile));
	}

	@Override
	public String visitMenu(Menu node) {
		return menu(node, null, null);
	}

	/**
	 * @param label the name from {@code menu name:}
	 * @param caption the rendered say statement shown with the choices
	 */
	String menu(Menu node, @Nullable String label, @Nullable String caption) {
		StringBuilder header = new StringBuilder("menu");
		if (label != null) {
			header.append(" ").append(label);
		}
		if (node.arguments() != null) {
			header.append(node.arguments().render());
		}
		header.append(":");

		List<String> body = new ArrayList<>();
		if (node.with() != null) {
			body.add("with " + node.with());
		}
		if (node.set() != null) {
			body.add("set " + node.set());
		}
		if (caption != null) {
			body.add(caption);
		}
		for (MenuItem item : node.items()) {
			StringBuilder line = new StringBuilder(SayStrings.encode(item.caption()));
			if (item.arguments() != null) {
				line.append(" ").append(item.arguments().render());
			}
			if (item.condition() != null && !item.condition().isAlwaysTrue()) {
				line.append(" if ").append(item.condition().source());
			}
			if (item.block() == null) {
				body.add(line.toString());
			} else {
				body.add(indenter.block(line + ":", unparser.renderBlock(item.block())));
			}
		}
		return indenter.block(header.toString(), String.join("\n", body));
	}

	@Override
	public String visitJump(Jump node) {
		return "jump " + (node.expression() ? "expression " : "") + node.target();
	}

	@Override
	public String visitCall(Call node) {
		StringBuilder sb = new StringBuilder("call ");
		if (node.expression()) {
			sb.append("expression ").append(node.label());
			if (node.arguments() != null) {
				sb.append(" pass ").append(node.arguments().render());
			}
		} else {
			sb.append(node.label());
			if (node.arguments() != null) {
				sb.append(node.arguments().render());
			}
		}
		return sb.toString();
	}

	@Override
	public String visitReturn(Return node) {
		return node.expression() == null ? "return" : "return " + node.expression().source();
	}

	@Override
	public String visitPass(Pass node) {
		return "pass";
	}

	@Override
	public String visitWhile(While node) {
		return indenter.block("while " + node.condition().source() + ":", unparser.renderBlock(node.block()));
	}

	@Override
	public String visitIf(If node) {
		List<String> branches = new ArrayList<>();
		List<If.Entry> entries = node.entries();
		for (int i = 0; i < entries.size(); i++) {
			If.Entry entry = entries.get(i);
			boolean isLast = i == entries.size() - 1;
			PyExpr condition = entry.condition();
			if (condition == null) {
				LOGGER.warn("Branch {} of the conditional at {} has no condition; rendering it as True", i, node.location());
				condition = new PyExpr("True", node.location());
			}
			String header;
			if (i == 0) {
				header = "if " + condition.source() + ":";
			} else if (isLast && condition.isAlwaysTrue()) {
				header = "else:";
			} else {
				header = "elif " + condition.source() + ":";
			}
			branches.add(indenter.block(header, unparser.renderBlock(entry.block())));
		}
		return String.join("\n", branches);
	}

	@Override
	public String visitUserStatement(UserStatement node) {
		if (node.block().isEmpty()) {
			return node.line();
		}
		return node.line() + "\n" + indenter.indent(lexerLines(node.block()));
	}

	private String lexerLines(List<LexerLine> lines) {
		List<String> result = new ArrayList<>();
		for (LexerLine line : lines) {
			result.add(line.text());
			if (!line.block().isEmpty()) {
				result.add(indenter.indent(lexerLines(line.block())));
			}
		}
		return String.join("\n", result);
	}

	// Embedded code and variables

	@Override
	public String visitPython(Python node) {
		if (!node.hide() && node.store().equals("store") && node.code().isSingleLine()) {
			return "$ " + node.code().source();
		}
		return pythonBlock(node.code(), false, node.hide(), node.store());
	}

	@Override
	public String visitEarlyPython(EarlyPython node) {
		return pythonBlock(node.code(), true, node.hide(), node.store());
	}

	private String pythonBlock(PyCode code, boolean early, boolean hide, String store) {
		StringBuilder header = new StringBuilder("python");
		if (early) {
			header.append(" early");
		}
		if (hide) {
			header.append(" hide");
		}
		if (!store.equals("store")) {
			header.append(" in ").append(storeName(store));
		}
		header.append(":");
		return indenter.block(header.toString(), code.source());
	}

	@Override
	public String visitDefine(Define node) {
		StringBuilder sb = new StringBuilder("define ").append(qualified(node.store(), node.varname()));
		if (node.index() != null) {
			sb.append("[").append(node.index().source()).append("]");
		}
		return sb.append(" ").append(node.operator()).append(" ").append(node.code().source()).toString();
	}

	@Override
	public String visitDefault(Default node) {
		return "default " + qualified(node.store(), node.varname()) + " = " + node.code().source();
	}

	/**
	 * Variables live in {@code store} unless named otherwise; a named store
	 * {@code store.x} is written as {@code x}.
	 */
	static String storeName(String store) {
		return store.startsWith("store.") ? store.substring("store.".length()) : store;
	}

	private static String qualified(String store, String name) {
		return store.equals("store") ? name : storeName(store) + "." + name;
	}

	/**
	 * Groups of statements that run at startup. Statements that the engine always
	 * wraps in an init block are shown without it.
	 */
	@Override
	public String visitInit(Init node) {
		List<Node> block = unparser.rewriteAll(node.block());
		String prefix = node.priority() == 0 ? "init" : "init " + node.priority();
		if (block.isEmpty()) {
			throw unsupported(node, "empty init block");
		}
		if (block.size() == 1) {
			Node only = block.get(0);
			if (only instanceof Define || only instanceof Default || only instanceof Transform) {
				return withPriority(unparser.renderRewrittenBlock(block), node.priority());
			} else if (only instanceof Image && node.priority() == 500) {
				return unparser.renderRewrittenBlock(block);
			} else if (only instanceof Screen && node.priority() == -500) {
				return unparser.renderRewrittenBlock(block);
			} else if (only instanceof Python p) {
				return prefix + " " + pythonBlock(p.code(), false, p.hide(), p.store());
			}
		}
		if (node.priority() == 0 && block.stream().allMatch(TranslateString.class::isInstance)) {
			return unparser.renderRewrittenBlock(block);
		}
		String inner = unparser.renderRewrittenBlock(block);
		if (inner.indexOf('\n') < 0) {
			return prefix + " " + inner;
		}
		return indenter.block(prefix + ":", inner);
	}

	/**
	 * {@code define}, {@code default} and {@code transform} take their priority
	 * right after the keyword.
	 */
	private static String withPriority(String rendering, int priority) {
		if (priority == 0) {
			return rendering;
		}
		int space = rendering.indexOf(' ');
		return rendering.substring(0, space) + " " + priority + rendering.substring(space);
	}

	// Images and transitions

	@Override
	public String visitImage(Image node) {
		String header = "image " + String.join(" ", node.name());
		if (node.code() != null && node.atl() != null) {
			throw unsupported(node, "image has both an expression and an animation block");
		} else if (node.code() != null) {
			return header + " = " + node.code().source();
		}
		return withAtl(header, node.atl());
	}

	@Override
	public String visitTransform(Transform node) {
		StringBuilder header = new StringBuilder("transform ").append(qualified(node.store(), node.name()));
		if (node.parameters() != null) {
			header.append(node.parameters().render());
		}
		return indenter.block(header + ":", node.atl() == null ? "" : atl.render(node.atl()));
	}

	@Override
	public String visitShow(Show node) {
		return withAtl("show " + imageSpec(node.imspec()), node.atl());
	}

	@Override
	public String visitShowLayer(ShowLayer node) {
		return withAtl("show layer " + node.layer() + atList(node.atList()), node.atl());
	}

	@Override
	public String visitScene(Scene node) {
		String header;
		if (node.imspec() != null) {
			header = "scene " + imageSpec(node.imspec());
		} else if (!node.layer().equals("master")) {
			header = "scene onlayer " + node.layer();
		} else {
			header = "scene";
		}
		return withAtl(header, node.atl());
	}

	@Override
	public String visitHide(Hide node) {
		return "hide " + imageSpec(node.imspec());
	}

	@Override
	public String visitCamera(Camera node) {
		String header = node.layer().equals("master") ? "camera" : "camera " + node.layer();
		return withAtl(header + atList(node.atList()), node.atl());
	}

	/**
	 * Only the closing half of a transition reaches here on its own.
	 */
	@Override
	public String visitWith(With node) {
		return "with " + node.expr().source();
	}

	private String withAtl(String header, @Nullable AtlBlock block) {
		if (block == null) {
			return header;
		}
		return indenter.block(header + ":", atl.render(block));
	}

	static String imageSpec(ImageSpec spec) {
		StringBuilder sb = new StringBuilder();
		if (spec.expression() != null) {
			sb.append("expression ").append(spec.expression().source());
		} else {
			sb.append(String.join(" ", spec.name()));
		}
		if (spec.tag() != null) {
			sb.append(" as ").append(spec.tag());
		}
		sb.append(atList(spec.atList()));
		if (spec.layer() != null) {
			sb.append(" onlayer ").append(spec.layer());
		}
		if (spec.zorder() != null) {
			sb.append(" zorder ").append(spec.zorder().source());
		}
		if (!spec.behind().isEmpty()) {
			sb.append(" behind ").append(String.join(", ", spec.behind()));
		}
		return sb.toString();
	}

	private static String atList(List<PyExpr> atList) {
		if (atList.isEmpty()) {
			return "";
		}
		List<String> sources = new ArrayList<>(atList.size());
		atList.forEach(e -> sources.add(e.source()));
		return " at " + String.join(", ", sources);
	}

	// Screens and styles

	@Override
	public String visitScreen(Screen node) {
		return screens.render(node.screen());
	}

	@Override
	public String visitStyle(Style node) {
		StringBuilder header = new StringBuilder("style ").append(node.name());
		if (node.parent() != null) {
			header.append(" is ").append(node.parent());
		}
		List<String> properties = new ArrayList<>();
		if (node.clear()) {
			properties.add("clear");
		}
		if (node.take() != null) {
			properties.add("take " + node.take());
		}
		node.delattr().forEach(name -> properties.add("del " + name));
		if (node.variant() != null) {
			properties.add("variant " + node.variant().source());
		}
		for (Map.Entry<String, PyExpr> entry : node.properties().entrySet()) {
			properties.add(entry.getKey() + " " + entry.getValue().source());
		}
		if (properties.isEmpty()) {
			return header.toString();
		} else if (properties.size() < 3) {
			return header + " " + String.join(" ", properties);
		}
		return indenter.block(header + ":", String.join("\n", properties));
	}

	// Translations

	@Override
	public String visitTranslate(Translate node) {
		if (node.language() == null) {
			return unparser.renderBlock(node.block());
		}
		return indenter.block("translate " + node.language() + " " + node.identifier() + ":", unparser.renderBlock(node.block()));
	}

	@Override
	public String visitEndTranslate(EndTranslate node) {
		return "";
	}

	@Override
	public String visitTranslateString(TranslateString node) {
		return indenter.block("translate " + node.language() + " strings:",
			"old " + SayStrings.encode(node.oldText()) + "\nnew " + SayStrings.encode(node.newText()));
	}

	@Override
	public String visitTranslateBlock(TranslateBlock node) {
		List<String> result = new ArrayList<>();
		for (Node child : unparser.rewriteAll(node.block())) {
			String rendering;
			if (child instanceof Python p) {
				rendering = pythonBlock(p.code(), false, p.hide(), p.store());
			} else {
				rendering = child.accept(this);
			}
			result.add("translate " + node.language() + " " + rendering);
		}
		return String.join("\n", result);
	}

	@Override
	public String visitTranslateSay(TranslateSay node) {
		String say = visitSay(node.say());
		if (node.language() == null) {
			return say;
		}
		return indenter.block("translate " + node.language() + " " + node.identifier() + ":", say);
	}

	// No faithful rendering

	@Override
	public String visitTestcase(Testcase node) {
		throw unsupported(node, null);
	}

	@Override
	public String visitRawNode(RawNode node) {
		throw unsupported(node, null);
	}

	private static UnsupportedConstructException unsupported(Node node, @Nullable String detail) {
		Location location = node.location();
		return new UnsupportedConstructException(node.kind(), location.filename(), location.linenumber(), detail);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(StatementRenderer.class);
}
