package works.rpycdec.ast.build;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.rpycdec.ast.Location;
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
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.values.PickleObject;

import static works.rpycdec.ast.build.Values.describe;
import static works.rpycdec.ast.build.Values.expr;
import static works.rpycdec.ast.build.Values.requireExpr;
import static works.rpycdec.ast.build.Values.requireSequence;
import static works.rpycdec.ast.build.Values.requireText;

/**
 * Builds animation statements from the engine's {@code Raw*} records.
 */
final class AtlBuilder {
	private final Map<String, Converter> converters = new LinkedHashMap<>();

	@FunctionalInterface
	private interface Converter {
		AtlStatement convert(Attributes a);
	}

	AtlBuilder() {
		converters.put("RawBlock", this::rawBlock);
		converters.put("RawMultipurpose", this::multipurpose);
		converters.put("RawContainsExpr", a -> new AtlContainsExpr(a.location(), requireExpr(a.raw("expression"), a.location(), "contains expression")));
		converters.put("RawChild", a -> new AtlChild(a.location(), blocks(a.list("children"))));
		converters.put("RawRepeat", a -> new AtlRepeat(a.location(), expr(a.raw("repeats"), a.location())));
		converters.put("RawParallel", a -> new AtlParallel(a.location(), blocks(a.list("blocks"))));
		converters.put("RawChoice", this::choice);
		converters.put("RawTime", a -> new AtlTime(a.location(), requireExpr(a.raw("time"), a.location(), "time")));
		converters.put("RawOn", this::on);
		converters.put("RawEvent", a -> new AtlEvent(a.location(), a.string("name")));
		converters.put("RawFunction", a -> new AtlFunction(a.location(), requireExpr(a.raw("expr"), a.location(), "function")));
	}

	@Nullable AtlBlock optionalBlock(@Nullable Object value) {
		return value == null ? null : block(value);
	}

	AtlBlock block(Object value) {
		AtlStatement statement = statement(value);
		if (statement instanceof AtlBlock b) {
			return b;
		}
		throw new MalformedTreeException("Expected an animation block, not " + describe(value));
	}

	/**
	 * @return the converted statement, or null for {@code None}
	 */
	@Nullable AtlStatement statement(@Nullable Object value) {
		if (value == null) {
			return null;
		}
		if (!(value instanceof PickleObject o)) {
			throw new MalformedTreeException("Expected an animation statement, not " + describe(value));
		}
		Attributes a = new Attributes(o);
		Converter converter = converters.get(a.className());
		if (converter == null || !o.className().isIn("renpy.atl")) {
			throw new MalformedTreeException("Unknown animation statement " + o.className() + " at " + a.location());
		}
		return converter.convert(a);
	}

	private AtlBlock rawBlock(Attributes a) {
		List<AtlStatement> statements = new ArrayList<>();
		for (Object s : a.list("statements")) {
			statements.add(statement(s));
		}
		return new AtlBlock(a.location(), statements, a.bool("animation", false));
	}

	private List<AtlBlock> blocks(List<Object> values) {
		List<AtlBlock> result = new ArrayList<>();
		for (Object v : values) {
			result.add(block(v));
		}
		return result;
	}

	private AtlInterpolation multipurpose(Attributes a) {
		Location location = a.location();
		List<AtlInterpolation.Property> properties = new ArrayList<>();
		for (Object p : a.list("properties")) {
			List<Object> pair = requireSequence(p, "Animation property");
			properties.add(new AtlInterpolation.Property(requireText(pair.get(0), "Property name"), requireExpr(pair.get(1), location, "Property value")));
		}
		List<AtlInterpolation.Spline> splines = new ArrayList<>();
		for (Object s : a.list("splines")) {
			List<Object> pair = requireSequence(s, "Spline");
			List<PyExpr> knots = new ArrayList<>();
			for (Object k : requireSequence(pair.get(1), "Spline knots")) {
				knots.add(requireExpr(k, location, "Spline knot"));
			}
			splines.add(new AtlInterpolation.Spline(requireText(pair.get(0), "Spline property"), knots));
		}
		List<AtlInterpolation.Expression> expressions = new ArrayList<>();
		for (Object e : a.list("expressions")) {
			List<Object> pair = requireSequence(e, "Animation expression");
			expressions.add(new AtlInterpolation.Expression(requireExpr(pair.get(0), location, "Expression"), expr(pair.size() > 1 ? pair.get(1) : null, location)));
		}
		return new AtlInterpolation(
			location,
			a.optionalString("warper"),
			expr(a.raw("warp_function"), location),
			expr(a.raw("duration"), location),
			a.optionalString("revolution"),
			expr(a.raw("circles"), location),
			properties,
			splines,
			expressions);
	}

	private AtlChoice choice(Attributes a) {
		List<AtlChoice.Option> options = new ArrayList<>();
		for (Object c : a.list("choices")) {
			List<Object> pair = requireSequence(c, "Choice");
			options.add(new AtlChoice.Option(requireExpr(pair.get(0), a.location(), "Choice chance"), block(pair.get(1))));
		}
		return new AtlChoice(a.location(), options);
	}

	private AtlOn on(Attributes a) {
		Map<String, AtlBlock> handlers = new LinkedHashMap<>();
		Map<?, ?> raw = a.optionalMap("handlers");
		if (raw != null) {
			raw.forEach((name, block) -> handlers.put(requireText(name, "Event name"), block(block)));
		}
		return new AtlOn(a.location(), handlers);
	}
}
