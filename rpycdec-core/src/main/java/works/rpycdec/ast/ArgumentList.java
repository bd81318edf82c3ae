package works.rpycdec.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The actual arguments of a call, say, menu item or screen use.
 */
public record ArgumentList(List<Argument> arguments) {
	public ArgumentList {
		arguments = List.copyOf(arguments);
	}

	public enum Kind { PLAIN, STARRED, DOUBLE_STARRED }

	/**
	 * @param name the keyword, or null for a positional or unpacked argument
	 */
	public record Argument(@Nullable String name, String value, Kind kind) {
		public Argument {
			requireNonNull(value);
			requireNonNull(kind);
			if (name != null && kind != Kind.PLAIN) {
				throw new IllegalArgumentException("Unpacked argument cannot have a keyword: " + name);
			}
		}

		public static Argument positional(String value) {
			return new Argument(null, value, Kind.PLAIN);
		}

		public static Argument keyword(String name, String value) {
			return new Argument(name, value, Kind.PLAIN);
		}

		String render() {
			return switch (kind) {
				case PLAIN -> name == null ? value : name + "=" + value;
				case STARRED -> "*" + value;
				case DOUBLE_STARRED -> "**" + value;
			};
		}
	}

	public String render() {
		List<String> parts = new ArrayList<>(arguments.size());
		arguments.forEach(a -> parts.add(a.render()));
		return "(" + String.join(", ", parts) + ")";
	}

	@Override
	public String toString() {
		return render();
	}
}
