package works.rpycdec.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.Decompiler;
import works.rpycdec.DecompilerSettings;

import static java.util.Objects.requireNonNull;

/**
 * Decompiles every matching file under a directory, mirroring the tree into an output directory.
 * <p>
 * {@code game/script.rpyc} becomes {@code game/script.rpy}. A failure in one file
 * is logged and recorded in the {@link BatchResult}; it doesn't stop the others.
 */
public final class BatchDecompiler {
	private final Decompiler decompiler;
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public BatchDecompiler(DecompilerSettings settings) {
		this(new Decompiler(settings));
	}

	public BatchDecompiler(Decompiler decompiler) {
		this.decompiler = requireNonNull(decompiler);
	}

	/**
	 * Files whose work hasn't started yet will be skipped.
	 * Files already in progress finish normally.
	 */
	public void cancel() {
		LOGGER.debug("Cancelling");
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * @return the matching files under {@code inputRoot}, in a stable order
	 */
	public List<Path> findInputs(Path inputRoot) throws IOException {
		DecompilerSettings settings = decompiler.settings();
		try (Stream<Path> files = Files.walk(inputRoot)) {
			return files
				.filter(Files::isRegularFile)
				.filter(p -> settings.inputPattern().matcher(separatorsToSlashes(inputRoot.relativize(p))).matches())
				.sorted()
				.toList();
		}
	}

	public BatchResult run(Path inputRoot, Path outputRoot) throws IOException, InterruptedException {
		List<Path> inputs = findInputs(inputRoot);
		DecompilerSettings settings = decompiler.settings();
		LOGGER.info("Decompiling {} files from {} with {} threads", inputs.size(), inputRoot, settings.parallelism());

		List<Path> succeeded = Collections.synchronizedList(new ArrayList<>());
		List<Path> skipped = Collections.synchronizedList(new ArrayList<>());
		Map<Path, Exception> failed = Collections.synchronizedMap(new LinkedHashMap<>());

		AtomicInteger threadCounter = new AtomicInteger();
		ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, settings.parallelism()), r ->
			new Thread(r, "decompiler-" + threadCounter.incrementAndGet()));
		try {
			List<Future<?>> futures = new ArrayList<>(inputs.size());
			for (Path input : inputs) {
				Path output = outputPath(inputRoot, outputRoot, input);
				futures.add(pool.submit(() -> {
					if (cancelled.get()) {
						skipped.add(input);
						return;
					}
					if (!settings.overwrite() && Files.exists(output)) {
						LOGGER.debug("{} already exists; skipping", output);
						skipped.add(input);
						return;
					}
					try {
						decompiler.decompileFile(input, output);
						succeeded.add(input);
					} catch (IOException | RuntimeException e) {
						LOGGER.error("Failed to decompile {}: {}", input, e.toString());
						LOGGER.debug("Failure details for {}", input, e);
						failed.put(input, e);
					}
				}));
			}
			for (Future<?> future : futures) {
				try {
					future.get();
				} catch (ExecutionException e) {
					// Tasks record their own failures; anything else is a bug
					throw new IllegalStateException("Unexpected failure in batch task", e.getCause());
				}
			}
		} finally {
			pool.shutdownNow();
		}

		BatchResult result = new BatchResult(sortedCopy(succeeded), failed, sortedCopy(skipped));
		LOGGER.info("Finished: {} succeeded, {} failed, {} skipped",
			result.succeeded().size(), result.failed().size(), result.skipped().size());
		return result;
	}

	/**
	 * Mirrors {@code input} under {@code outputRoot}, dropping the trailing {@code c}
	 * from the compiled extension.
	 */
	static Path outputPath(Path inputRoot, Path outputRoot, Path input) {
		Path relative = inputRoot.relativize(input);
		String name = relative.getFileName().toString();
		if (name.endsWith("c")) {
			name = name.substring(0, name.length() - 1);
		}
		Path parent = relative.getParent();
		return parent == null ? outputRoot.resolve(name) : outputRoot.resolve(parent).resolve(name);
	}

	private static String separatorsToSlashes(Path path) {
		return path.toString().replace(path.getFileSystem().getSeparator(), "/");
	}

	private static List<Path> sortedCopy(List<Path> paths) {
		synchronized (paths) {
			List<Path> result = new ArrayList<>(paths);
			Collections.sort(result);
			return result;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BatchDecompiler.class);
}
