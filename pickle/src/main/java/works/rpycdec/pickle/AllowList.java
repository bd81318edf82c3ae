package works.rpycdec.pickle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;
import static works.rpycdec.pickle.AllowList.UnknownClassPolicy.REJECT;
import static works.rpycdec.pickle.AllowList.UnknownClassPolicy.SUBSTITUTE;

/**
 * Decides what each class reference in the stream is allowed to become.
 * <p>
 * There are three kinds of allowed reference:
 * <ol>
 *     <li>
 *         explicitly registered {@link PickleType}s, such as {@code builtins.dict};
 *     </li>
 *     <li>
 *         anything in a <em>friendly namespace</em>, which becomes a generic
 *         {@link works.rpycdec.pickle.values.PickleObject PickleObject}
 *         for a later pass to interpret; and
 *     </li>
 *     <li>
 *         nothing else. Other references are handled according to the
 *         {@link UnknownClassPolicy}.
 *     </li>
 * </ol>
 * Class names are never resolved against the host's own types.
 */
public final class AllowList {
	private final Map<ClassName, PickleType> types;
	private final List<String> friendlyNamespaces;
	private final UnknownClassPolicy unknownClassPolicy;

	public enum UnknownClassPolicy {
		/**
		 * Stand in for the class with a placeholder record and keep going.
		 */
		SUBSTITUTE,

		/**
		 * Fail immediately with a {@link works.rpycdec.pickle.exceptions.ForbiddenClassException}.
		 */
		REJECT,
	}

	private AllowList(Map<ClassName, PickleType> types, List<String> friendlyNamespaces, UnknownClassPolicy unknownClassPolicy) {
		this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
		this.friendlyNamespaces = List.copyOf(friendlyNamespaces);
		this.unknownClassPolicy = unknownClassPolicy;
	}

	/**
	 * For data that should contain only scalars and containers, like an archive index.
	 */
	public static AllowList primitivesOnly() {
		return builder()
			.primitives()
			.unknownClassPolicy(REJECT)
			.build();
	}

	/**
	 * Primitives, standard collections, and every class in the given namespaces.
	 * Unknown classes are substituted.
	 */
	public static AllowList withFriendlyNamespaces(String... namespaces) {
		Builder builder = builder()
			.primitives()
			.standardCollections();
		for (String namespace : namespaces) {
			builder.friendlyNamespace(namespace);
		}
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the allowed type for the given name, or null if it is not allowed
	 */
	public @Nullable PickleType lookup(ClassName className) {
		PickleType registered = types.get(className);
		if (registered != null) {
			return registered;
		}
		for (String namespace : friendlyNamespaces) {
			if (className.isIn(namespace)) {
				return new ObjectType(className, false);
			}
		}
		return null;
	}

	public UnknownClassPolicy unknownClassPolicy() {
		return unknownClassPolicy;
	}

	public List<String> friendlyNamespaces() {
		return friendlyNamespaces;
	}

	@Override
	public String toString() {
		return "AllowList(" + types.size() + " types, namespaces=" + friendlyNamespaces + ", " + unknownClassPolicy + ")";
	}

	public static class Builder {
		private final Map<ClassName, PickleType> types = new LinkedHashMap<>();
		private final List<String> friendlyNamespaces = new ArrayList<>();
		private UnknownClassPolicy unknownClassPolicy = SUBSTITUTE;

		Builder() { }

		public Builder primitives() {
			types.putAll(BuiltinTypes.primitives());
			return this;
		}

		public Builder standardCollections() {
			types.putAll(BuiltinTypes.standardCollections());
			types.putAll(BuiltinTypes.inertBuiltins());
			return this;
		}

		public Builder type(PickleType type) {
			types.put(type.className(), requireNonNull(type));
			return this;
		}

		public Builder friendlyNamespace(String namespace) {
			if (namespace.isEmpty() || namespace.startsWith(".") || namespace.endsWith(".")) {
				throw new IllegalArgumentException("Invalid namespace: \"" + namespace + "\"");
			}
			friendlyNamespaces.add(namespace);
			return this;
		}

		public Builder unknownClassPolicy(UnknownClassPolicy policy) {
			this.unknownClassPolicy = requireNonNull(policy);
			return this;
		}

		public AllowList build() {
			return new AllowList(types, friendlyNamespaces, unknownClassPolicy);
		}
	}
}
