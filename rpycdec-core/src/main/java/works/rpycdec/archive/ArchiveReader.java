package works.rpycdec.archive;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.container.RpycContainer;
import works.rpycdec.exceptions.ContainerFormatException;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.exceptions.PathSafetyException;
import works.rpycdec.pickle.AllowList;
import works.rpycdec.pickle.Unpickler;
import works.rpycdec.pickle.values.PyTuple;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads {@code RPA-3.0} asset archives.
 * <p>
 * The archive starts with the line {@code RPA-3.0 <index offset> <key>}, both in hex.
 * The index at that offset is a compressed, serialized map from member name
 * to a list of {@code (offset, length, prefix)} segments, with offset and length
 * XORed with the key. The index may only contain primitive values;
 * anything else is refused rather than substituted.
 */
public final class ArchiveReader {
	public static final String MAGIC = "RPA-3.0";

	private final byte[] archive;
	private final Map<String, List<Segment>> index;

	private ArchiveReader(byte[] archive, Map<String, List<Segment>> index) {
		this.archive = archive;
		this.index = index;
	}

	public static ArchiveReader open(Path file) throws IOException {
		return open(Files.readAllBytes(file));
	}

	/**
	 * @throws ContainerFormatException if the header or index is damaged
	 * @throws works.rpycdec.pickle.exceptions.PickleException if the index is not a valid primitive stream
	 */
	public static ArchiveReader open(byte[] archive) {
		int newline = -1;
		for (int i = 0; i < Math.min(archive.length, HEADER_LIMIT); i++) {
			if (archive[i] == '\n') {
				newline = i;
				break;
			}
		}
		if (newline < 0) {
			throw new ContainerFormatException("Not an archive: no header line");
		}
		String[] fields = new String(archive, 0, newline, ISO_8859_1).trim().split(" +");
		if (fields.length < 3 || !fields[0].equals(MAGIC)) {
			throw new ContainerFormatException("Not an " + MAGIC + " archive");
		}
		long indexOffset;
		long key;
		try {
			indexOffset = Long.parseUnsignedLong(fields[1], 16);
			key = Long.parseUnsignedLong(fields[2], 16);
		} catch (NumberFormatException e) {
			throw new ContainerFormatException("Archive header has a malformed number: " + e.getMessage(), e);
		}
		if (indexOffset <= newline || indexOffset >= archive.length) {
			throw new ContainerFormatException("Archive index offset " + indexOffset + " is outside the file");
		}
		byte[] compressed = Arrays.copyOfRange(archive, (int) indexOffset, archive.length);
		Object raw = new Unpickler(AllowList.primitivesOnly(), Unpickler.Settings.LEGACY_BYTES)
			.load(RpycContainer.inflate(compressed));
		LOGGER.debug("Archive index at {} with key {}", indexOffset, Long.toHexString(key));
		return new ArchiveReader(archive, decodeIndex(raw, key));
	}

	private static Map<String, List<Segment>> decodeIndex(Object raw, long key) {
		if (!(raw instanceof Map<?, ?> map)) {
			throw new MalformedTreeException("Archive index should be a dict");
		}
		Map<String, List<Segment>> result = new LinkedHashMap<>();
		for (var entry : map.entrySet()) {
			String name = text(entry.getKey(), UTF_8);
			if (!(entry.getValue() instanceof List<?> segments)) {
				throw new MalformedTreeException("Archive index entry for " + name + " should be a list");
			}
			List<Segment> decoded = segments.stream()
				.map(s -> segment(name, s, key))
				.toList();
			result.put(name, decoded);
		}
		return Collections.unmodifiableMap(result);
	}

	/**
	 * Segments are tuples in newer archives and lists in older ones.
	 * The prefix is absent in the oldest.
	 */
	private static Segment segment(String name, Object value, long key) {
		List<?> fields;
		if (value instanceof PyTuple t) {
			fields = t.items();
		} else if (value instanceof List<?> l) {
			fields = l;
		} else {
			throw new MalformedTreeException("Archive segment for " + name + " should be a tuple");
		}
		if (fields.size() < 2 || !(fields.get(0) instanceof Number offset) || !(fields.get(1) instanceof Number length)) {
			throw new MalformedTreeException("Archive segment for " + name + " should start with offset and length");
		}
		byte[] prefix = new byte[0];
		if (fields.size() > 2 && fields.get(2) != null) {
			prefix = fields.get(2) instanceof byte[] b ? b : text(fields.get(2), ISO_8859_1).getBytes(ISO_8859_1);
		}
		try {
			return new Segment(offset.longValue() ^ key, length.longValue() ^ key, prefix);
		} catch (IllegalArgumentException e) {
			throw new ContainerFormatException("Archive segment for " + name + " is damaged: " + e.getMessage(), e);
		}
	}

	private static String text(Object value, Charset bytesCharset) {
		if (value instanceof String s) {
			return s;
		} else if (value instanceof byte[] b) {
			return new String(b, bytesCharset);
		}
		throw new MalformedTreeException("Expected a string in the archive index, not " + describe(value));
	}

	private static String describe(@Nullable Object value) {
		return value == null ? "None" : value.getClass().getSimpleName();
	}

	public Set<String> names() {
		return index.keySet();
	}

	public List<Segment> segments(String name) {
		List<Segment> result = index.get(name);
		if (result == null) {
			throw new NoSuchElementException("No archive member " + name);
		}
		return result;
	}

	/**
	 * A segment that doesn't start with its recorded prefix is kept whole, with a warning.
	 */
	public byte[] read(String name) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (Segment segment : segments(name)) {
			if (segment.end() > archive.length) {
				throw new ContainerFormatException("Archive member " + name + " extends past the end of the file ("
					+ segment.end() + " > " + archive.length + ")");
			}
			int from = (int) segment.offset();
			int to = (int) segment.end();
			byte[] prefix = segment.prefix();
			if (prefix.length > 0) {
				if (to - from >= prefix.length && Arrays.equals(archive, from, from + prefix.length, prefix, 0, prefix.length)) {
					from += prefix.length;
				} else {
					LOGGER.warn("{} does not start with its expected prefix", name);
				}
			}
			out.write(archive, from, to - from);
		}
		return out.toByteArray();
	}

	/**
	 * Writes every member under {@code root}.
	 * Members whose names would land outside {@code root} are skipped with a warning.
	 *
	 * @return the number of members written
	 */
	public int extractAll(Path root) throws IOException {
		int count = 0;
		for (String name : index.keySet()) {
			Path destination;
			try {
				destination = safePath(root, name);
			} catch (PathSafetyException e) {
				LOGGER.warn("Skipping archive member: {}", e.getMessage());
				continue;
			}
			Path parent = destination.getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.write(destination, read(name));
			LOGGER.info("Extracted {} -> {}", name, destination);
			count++;
		}
		return count;
	}

	/**
	 * @return where the member {@code name} belongs under {@code root}
	 * @throws PathSafetyException if that is not strictly inside {@code root}
	 */
	public static Path safePath(Path root, String name) {
		Path base = root.toAbsolutePath().normalize();
		Path result;
		try {
			Path relative = Path.of(name);
			if (relative.isAbsolute() || relative.getRoot() != null) {
				throw new PathSafetyException(name);
			}
			result = base.resolve(relative).normalize();
		} catch (InvalidPathException e) {
			throw new PathSafetyException(name);
		}
		if (result.equals(base) || !result.startsWith(base)) {
			throw new PathSafetyException(name);
		}
		return result;
	}

	/**
	 * The header line must end within this many bytes.
	 */
	private static final int HEADER_LIMIT = 256;

	private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveReader.class);
}
