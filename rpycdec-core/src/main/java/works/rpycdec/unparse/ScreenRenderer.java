package works.rpycdec.unparse;

import java.util.ArrayList;
import java.util.List;
import works.rpycdec.ast.PyExpr;
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
import works.rpycdec.ast.sl.SlVisitor;

/**
 * Renders screen-language statements.
 * Properties go one per line in a block, or inline after a displayable that has no children.
 */
final class ScreenRenderer implements SlVisitor<String> {
	private final Indenter indenter;

	ScreenRenderer(Indenter indenter) {
		this.indenter = indenter;
	}

	String render(SlScreen screen) {
		return visitScreen(screen);
	}

	@Override
	public String visitScreen(SlScreen node) {
		StringBuilder header = new StringBuilder("screen ").append(node.name());
		if (node.parameters() != null) {
			header.append(node.parameters().render());
		}
		List<String> body = keywordLines(node.keywords());
		if (node.tag() != null) {
			body.add("tag " + node.tag());
		}
		body.addAll(children(node.children()));
		return indenter.block(header + ":", String.join("\n", body));
	}

	@Override
	public String visitBlock(SlBlock node) {
		return body(node.keywords(), node.children());
	}

	@Override
	public String visitDisplayable(SlDisplayable node) {
		StringBuilder start = new StringBuilder(node.keyword());
		for (PyExpr p : node.positional()) {
			start.append(" ").append(p.source());
		}
		if (node.children().isEmpty()) {
			for (Keyword k : node.keywords()) {
				start.append(" ").append(keyword(k));
			}
			return start.toString();
		}
		return indenter.block(start + ":", body(node.keywords(), node.children()));
	}

	@Override
	public String visitIf(SlIf node) {
		return conditional("if", node.entries());
	}

	@Override
	public String visitShowIf(SlShowIf node) {
		return conditional("showif", node.entries());
	}

	private String conditional(String keyword, List<SlEntry> entries) {
		List<String> result = new ArrayList<>();
		for (int i = 0; i < entries.size(); i++) {
			SlEntry entry = entries.get(i);
			String header;
			if (i == 0) {
				header = keyword + " " + conditionSource(entry) + ":";
			} else if (entry.isElse() && i == entries.size() - 1) {
				header = "else:";
			} else {
				header = "elif " + conditionSource(entry) + ":";
			}
			result.add(indenter.block(header, visitBlock(entry.block())));
		}
		return String.join("\n", result);
	}

	private static String conditionSource(SlEntry entry) {
		return entry.condition() == null ? "True" : entry.condition().source();
	}

	@Override
	public String visitFor(SlFor node) {
		StringBuilder header = new StringBuilder("for ").append(node.variable());
		if (node.indexExpression() != null) {
			header.append(" index ").append(node.indexExpression().source());
		}
		header.append(" in ").append(node.expression().source()).append(":");
		return indenter.block(header.toString(), body(node.keywords(), node.children()));
	}

	@Override
	public String visitPython(SlPython node) {
		if (node.code().isSingleLine()) {
			return "$ " + node.code().source();
		}
		return indenter.block("python:", node.code().source());
	}

	@Override
	public String visitDefault(SlDefault node) {
		return "default " + node.variable() + " = " + node.expression().source();
	}

	@Override
	public String visitUse(SlUse node) {
		StringBuilder sb = new StringBuilder("use ");
		if (node.targetIsExpression()) {
			sb.append("expression ").append(node.target()).append(" pass");
			if (node.arguments() != null) {
				sb.append(" ").append(node.arguments().render());
			}
		} else {
			sb.append(node.target());
			if (node.arguments() != null) {
				sb.append(node.arguments().render());
			}
		}
		if (node.id() != null) {
			sb.append(" id ").append(node.id().source());
		}
		if (node.block() == null) {
			return sb.toString();
		}
		return indenter.block(sb + ":", visitBlock(node.block()));
	}

	@Override
	public String visitTransclude(SlTransclude node) {
		return "transclude";
	}

	@Override
	public String visitPass(SlPass node) {
		return "pass";
	}

	@Override
	public String visitContinue(SlContinue node) {
		return "continue";
	}

	@Override
	public String visitBreak(SlBreak node) {
		return "break";
	}

	private String body(List<Keyword> keywords, List<SlNode> children) {
		List<String> lines = keywordLines(keywords);
		lines.addAll(children(children));
		return String.join("\n", lines);
	}

	private static List<String> keywordLines(List<Keyword> keywords) {
		List<String> lines = new ArrayList<>();
		keywords.forEach(k -> lines.add(keyword(k)));
		return lines;
	}

	private List<String> children(List<SlNode> children) {
		List<String> lines = new ArrayList<>();
		children.forEach(c -> lines.add(c.accept(this)));
		return lines;
	}

	private static String keyword(Keyword k) {
		return k.value() == null ? k.name() : k.name() + " " + k.value().source();
	}
}
