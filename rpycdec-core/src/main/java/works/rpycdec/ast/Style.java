package works.rpycdec.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Creates or updates a style.
 *
 * @param parent the style to inherit from, for {@code style a is b}
 * @param clear whether to remove all existing properties first
 * @param take a style whose properties are copied in
 * @param delattr properties to remove
 * @param properties in source order
 */
public record Style(
	Location location,
	String name,
	@Nullable String parent,
	boolean clear,
	@Nullable String take,
	List<String> delattr,
	@Nullable PyExpr variant,
	Map<String, PyExpr> properties
) implements Node {
	public Style {
		requireNonNull(location);
		requireNonNull(name);
		delattr = List.copyOf(delattr);
		properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visitStyle(this);
	}
}
