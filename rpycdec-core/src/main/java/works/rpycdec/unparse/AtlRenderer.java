package works.rpycdec.unparse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.PyExpr;
import works.rpycdec.ast.atl.AtlBlock;
import works.rpycdec.ast.atl.AtlChild;
import works.rpycdec.ast.atl.AtlChoice;
import works.rpycdec.ast.atl.AtlContainsExpr;
import works.rpycdec.ast.atl.AtlEvent;
import works.rpycdec.ast.atl.AtlFunction;
import works.rpycdec.ast.atl.AtlInterpolation;
import works.rpycdec.ast.atl.AtlOn;
import works.rpycdec.ast.atl.AtlParallel;
import works.rpycdec.ast.atl.AtlRepeat;
import works.rpycdec.ast.atl.AtlStatement;
import works.rpycdec.ast.atl.AtlTime;
import works.rpycdec.ast.atl.AtlVisitor;

/**
 * Renders animation blocks. Statements nested in a block render as
 * {@code block:}; everything else is one statement per line.
 */
final class AtlRenderer implements AtlVisitor<String> {
	private final Indenter indenter;

	AtlRenderer(Indenter indenter) {
		this.indenter = indenter;
	}

	/**
	 * Renders the contents of a block, without a header.
	 * The compiler wraps some bodies in a second block, which is unwrapped here.
	 */
	String render(AtlBlock block) {
		List<AtlStatement> statements = block.statements();
		if (!block.animation() && statements.size() == 1 && statements.get(0) instanceof AtlBlock inner) {
			return render(inner);
		}
		List<String> lines = new ArrayList<>();
		if (block.animation()) {
			lines.add("animation");
		}
		for (AtlStatement statement : statements) {
			lines.add(statement == null ? "pass" : statement.accept(this));
		}
		if (lines.isEmpty()) {
			return "pass";
		}
		return String.join("\n", lines);
	}

	@Override
	public String visitBlock(AtlBlock block) {
		return indenter.block("block:", render(block));
	}

	@Override
	public String visitInterpolation(AtlInterpolation node) {
		List<String> parts = new ArrayList<>();
		if (node.warpFunction() != null) {
			parts.add("warp " + node.warpFunction().source() + " " + source(node.duration(), "0"));
		} else if (node.warper() != null) {
			parts.add(node.warper() + " " + source(node.duration(), "0"));
		}
		if (node.revolution() != null) {
			parts.add(node.revolution());
		}
		if (node.circles() != null && !node.circles().source().strip().equals("0")) {
			parts.add("circles " + node.circles().source());
		}
		for (AtlInterpolation.Property p : node.properties()) {
			parts.add(p.name() + " " + p.value().source());
		}
		for (AtlInterpolation.Spline s : node.splines()) {
			List<PyExpr> knots = s.knots();
			StringBuilder sb = new StringBuilder(s.name()).append(" ").append(knots.get(knots.size() - 1).source());
			for (PyExpr knot : knots.subList(0, knots.size() - 1)) {
				sb.append(" knot ").append(knot.source());
			}
			parts.add(sb.toString());
		}
		for (AtlInterpolation.Expression e : node.expressions()) {
			parts.add(e.with() == null ? e.expression().source() : e.expression().source() + " with " + e.with().source());
		}
		if (parts.isEmpty()) {
			return "pass";
		}
		return String.join(" ", parts);
	}

	@Override
	public String visitContainsExpr(AtlContainsExpr node) {
		return "contains " + node.expression().source();
	}

	@Override
	public String visitChild(AtlChild node) {
		return headed("contains:", node.children());
	}

	@Override
	public String visitRepeat(AtlRepeat node) {
		return node.repeats() == null ? "repeat" : "repeat " + node.repeats().source();
	}

	@Override
	public String visitParallel(AtlParallel node) {
		return headed("parallel:", node.blocks());
	}

	@Override
	public String visitChoice(AtlChoice node) {
		List<String> result = new ArrayList<>();
		for (AtlChoice.Option option : node.options()) {
			String header = option.hasDefaultChance() ? "choice:" : "choice " + option.chance().source() + ":";
			result.add(indenter.block(header, render(option.block())));
		}
		return String.join("\n", result);
	}

	@Override
	public String visitTime(AtlTime node) {
		return "time " + node.time().source();
	}

	@Override
	public String visitOn(AtlOn node) {
		List<String> result = new ArrayList<>();
		for (Map.Entry<String, AtlBlock> handler : node.handlers().entrySet()) {
			result.add(indenter.block("on " + handler.getKey() + ":", render(handler.getValue())));
		}
		return String.join("\n", result);
	}

	@Override
	public String visitEvent(AtlEvent node) {
		return "event " + node.name();
	}

	@Override
	public String visitFunction(AtlFunction node) {
		return "function " + node.expression().source();
	}

	private String headed(String header, List<AtlBlock> blocks) {
		List<String> result = new ArrayList<>(blocks.size());
		blocks.forEach(b -> result.add(indenter.block(header, render(b))));
		return String.join("\n", result);
	}

	private static String source(@Nullable PyExpr expr, String ifAbsent) {
		return expr == null ? ifAbsent : expr.source();
	}
}
