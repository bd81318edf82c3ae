package works.rpycdec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.ast.Node;
import works.rpycdec.ast.build.AstBuilder;
import works.rpycdec.container.RpycContainer;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.pickle.AllowList;
import works.rpycdec.pickle.Unpickler;
import works.rpycdec.pickle.values.PyTuple;
import works.rpycdec.unparse.Unparser;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Turns compiled script files back into script source.
 * <p>
 * Each file goes through the same steps: the container yields a compressed slot,
 * the slot deserializes into an object graph limited to the engine's own classes,
 * the graph converts into {@link Node}s, and the nodes render as source.
 * <p>
 * Thread-safe. Every load gets its own deserializer and converter.
 */
public final class Decompiler {
	private final DecompilerSettings settings;
	private final Unparser unparser;

	public Decompiler() {
		this(DecompilerSettings.defaults());
	}

	public Decompiler(DecompilerSettings settings) {
		this.settings = requireNonNull(settings);
		this.unparser = new Unparser(settings.indent(), settings.rewriteHook());
	}

	public DecompilerSettings settings() {
		return settings;
	}

	public CompiledScript load(Path file) throws IOException {
		LOGGER.debug("Loading {}", file);
		return load(Files.readAllBytes(file));
	}

	/**
	 * @throws works.rpycdec.exceptions.DecompilerException if the container or its tree is damaged
	 * @throws works.rpycdec.pickle.exceptions.PickleException if the slot is not a valid stream
	 * or refers to classes outside the engine's namespaces
	 */
	public CompiledScript load(byte[] file) {
		byte[] payload = RpycContainer.readSlot(file, settings.slotPreference());
		Object root = new Unpickler(AllowList.withFriendlyNamespaces(NAMESPACES)).load(payload);
		if (!(root instanceof PyTuple tuple) || tuple.size() != 2) {
			throw new MalformedTreeException("Compiled script should hold a (metadata, statements) pair");
		}
		Map<String, Object> metadata = metadata(tuple.get(0));
		List<Node> statements;
		try {
			statements = new AstBuilder().statements(tuple.get(1));
		} catch (StackOverflowError e) {
			throw new MalformedTreeException("Statements are nested too deeply to convert", e);
		}
		return new CompiledScript(metadata, statements);
	}

	private static Map<String, Object> metadata(Object value) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new MalformedTreeException("Compiled script metadata should be a dict, not " + value.getClass().getSimpleName());
		}
		Map<String, Object> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put(String.valueOf(k), v));
		return result;
	}

	public String decompile(byte[] file) {
		return render(load(file));
	}

	public String decompile(Path file) throws IOException {
		String result = render(load(file));
		LOGGER.info("Decompiled {}", file);
		return result;
	}

	public String render(CompiledScript script) {
		String source;
		try {
			source = unparser.render(script.statements());
		} catch (StackOverflowError e) {
			throw new MalformedTreeException("Statements are nested too deeply to render", e);
		}
		return source.isEmpty() ? source : source + "\n";
	}

	/**
	 * Decompiles {@code input} and writes the source to {@code output},
	 * creating its directory if needed.
	 */
	public void decompileFile(Path input, Path output) throws IOException {
		String source = decompile(input);
		Path parent = output.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(output, source, UTF_8);
		LOGGER.debug("Wrote {}", output);
	}

	private static final String[] NAMESPACES = { "renpy", "store" };

	private static final Logger LOGGER = LoggerFactory.getLogger(Decompiler.class);
}
