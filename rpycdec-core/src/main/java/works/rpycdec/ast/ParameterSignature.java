package works.rpycdec.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The formal parameters of a label, transform or screen.
 */
public record ParameterSignature(List<Parameter> parameters) {
	public ParameterSignature {
		parameters = List.copyOf(parameters);
	}

	public static final ParameterSignature EMPTY = new ParameterSignature(List.of());

	public enum Kind {
		POSITIONAL_ONLY,
		POSITIONAL_OR_KEYWORD,
		VAR_POSITIONAL,
		KEYWORD_ONLY,
		VAR_KEYWORD;

		/**
		 * @param code the numbering used by Python's {@code inspect.Parameter} kinds
		 */
		public static Kind fromCode(int code) {
			Kind[] values = values();
			if (code < 0 || code >= values.length) {
				throw new IllegalArgumentException("No parameter kind " + code);
			}
			return values[code];
		}
	}

	public record Parameter(String name, Kind kind, @Nullable String defaultValue) {
		public Parameter {
			requireNonNull(name);
			requireNonNull(kind);
		}
	}

	/**
	 * Renders the parenthesized parameter list, inserting the {@code /} and {@code *}
	 * separators that positional-only and keyword-only parameters require.
	 */
	public String render() {
		List<String> parts = new ArrayList<>();
		boolean sawPositionalOnly = false;
		boolean sawStar = false;
		for (Parameter p : parameters) {
			if (sawPositionalOnly && p.kind() != Kind.POSITIONAL_ONLY) {
				parts.add("/");
				sawPositionalOnly = false;
			}
			switch (p.kind()) {
				case POSITIONAL_ONLY -> {
					sawPositionalOnly = true;
					parts.add(withDefault(p));
				}
				case POSITIONAL_OR_KEYWORD -> parts.add(withDefault(p));
				case VAR_POSITIONAL -> {
					sawStar = true;
					parts.add("*" + p.name());
				}
				case KEYWORD_ONLY -> {
					if (!sawStar) {
						parts.add("*");
						sawStar = true;
					}
					parts.add(withDefault(p));
				}
				case VAR_KEYWORD -> parts.add("**" + p.name());
			}
		}
		if (sawPositionalOnly) {
			parts.add("/");
		}
		return "(" + String.join(", ", parts) + ")";
	}

	private static String withDefault(Parameter p) {
		return p.defaultValue() == null ? p.name() : p.name() + "=" + p.defaultValue();
	}

	@Override
	public String toString() {
		return render();
	}
}
