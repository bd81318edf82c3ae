package works.rpycdec.container;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.rpycdec.exceptions.ContainerFormatException;
import works.rpycdec.exceptions.DecompressionException;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Locates and decompresses the payload of a compiled script file.
 * <p>
 * There are two framings:
 * <dl>
 *     <dt>legacy</dt>
 *     <dd>the whole file is one compressed stream, which counts as slot 1;</dd>
 *     <dt>multi-slot</dt>
 *     <dd>
 *         {@link #RPC2_HEADER} followed by a directory of little-endian
 *         {@code (slot, offset, length)} triples ending with slot 0,
 *         each naming an independently compressed region of the file.
 *     </dd>
 * </dl>
 * Slot 1 holds the statements as written; slot 2, when present, holds them
 * after translation processing.
 */
public final class RpycContainer {
	private RpycContainer() { }

	public static final byte[] RPC2_HEADER = "RENPY RPC2".getBytes(ISO_8859_1);

	/**
	 * The directory must fit in this many bytes at the start of the file.
	 */
	public static final int DIRECTORY_LIMIT = 1024;

	public static final List<Integer> DEFAULT_SLOTS = List.of(1, 2);
	public static final List<Integer> TRANSLATED_FIRST = List.of(2, 1);

	public static boolean isMultiSlot(byte[] file) {
		return file.length >= RPC2_HEADER.length
			&& Arrays.equals(file, 0, RPC2_HEADER.length, RPC2_HEADER, 0, RPC2_HEADER.length);
	}

	/**
	 * @return the directory entries in file order, excluding the terminator
	 * @throws ContainerFormatException if the file is not multi-slot
	 * or its directory is not terminated within {@link #DIRECTORY_LIMIT} bytes
	 */
	public static List<SlotEntry> directory(byte[] file) {
		if (!isMultiSlot(file)) {
			throw new ContainerFormatException("Missing " + new String(RPC2_HEADER, ISO_8859_1) + " header");
		}
		int limit = Math.min(file.length, DIRECTORY_LIMIT);
		List<SlotEntry> result = new ArrayList<>();
		for (int pos = RPC2_HEADER.length; ; pos += 12) {
			if (pos + 12 > limit) {
				throw new ContainerFormatException("Slot directory is not terminated within the first " + limit + " bytes");
			}
			int slot = readInt(file, pos);
			if (slot == 0) {
				return Collections.unmodifiableList(result);
			}
			result.add(new SlotEntry(slot, Integer.toUnsignedLong(readInt(file, pos + 4)), Integer.toUnsignedLong(readInt(file, pos + 8))));
		}
	}

	/**
	 * Returns the decompressed contents of the first slot in {@code preferredSlots}
	 * that the file contains. A slot that is present but fails to decompress is
	 * skipped in favour of the next preference.
	 *
	 * @throws ContainerFormatException if none of the preferred slots is present
	 * @throws DecompressionException if every preferred slot that is present is corrupt
	 */
	public static byte[] readSlot(byte[] file, List<Integer> preferredSlots) {
		DecompressionException lastFailure = null;
		for (int slot : preferredSlots) {
			byte[] compressed = compressedSlot(file, slot);
			if (compressed == null) {
				LOGGER.debug("Slot {} not present", slot);
				continue;
			}
			try {
				return inflate(compressed);
			} catch (DecompressionException e) {
				LOGGER.warn("Failed to read slot {}: {}", slot, e.getMessage());
				lastFailure = e;
			}
		}
		if (lastFailure != null) {
			throw lastFailure;
		} else {
			throw new ContainerFormatException("None of slots " + preferredSlots + " is present");
		}
	}

	public static byte[] readSlot(Path file, List<Integer> preferredSlots) throws IOException {
		return readSlot(Files.readAllBytes(file), preferredSlots);
	}

	/**
	 * @return the still-compressed bytes of the given slot, or null if it isn't present
	 */
	static byte[] compressedSlot(byte[] file, int slot) {
		if (!isMultiSlot(file)) {
			if (!looksCompressed(file)) {
				throw new ContainerFormatException("Not a compiled script: no slot header and no compressed stream");
			}
			return slot == 1 ? file : null;
		}
		for (SlotEntry entry : directory(file)) {
			if (entry.slot() == slot) {
				if (entry.end() > file.length) {
					throw new DecompressionException("Slot " + slot + " extends past the end of the file ("
						+ entry.end() + " > " + file.length + ")");
				}
				return Arrays.copyOfRange(file, (int) entry.offset(), (int) entry.end());
			}
		}
		return null;
	}

	/**
	 * Decompresses a complete zlib stream.
	 *
	 * @throws DecompressionException if the stream is corrupt or ends early
	 */
	public static byte[] inflate(byte[] compressed) {
		Inflater inflater = new Inflater();
		try {
			inflater.setInput(compressed);
			ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4);
			byte[] buffer = new byte[8192];
			while (!inflater.finished()) {
				int n = inflater.inflate(buffer);
				if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
					throw new DecompressionException("Compressed stream is truncated after "
						+ out.size() + " decompressed bytes");
				}
				out.write(buffer, 0, n);
			}
			if (inflater.getRemaining() > 0) {
				LOGGER.debug("Ignoring {} bytes after the end of the compressed stream", inflater.getRemaining());
			}
			return out.toByteArray();
		} catch (DataFormatException e) {
			throw new DecompressionException("Corrupt compressed stream: " + e.getMessage(), e);
		} finally {
			inflater.end();
		}
	}

	/**
	 * A zlib stream starts with a two-byte header whose big-endian value
	 * is a multiple of 31 and whose compression method is deflate.
	 */
	private static boolean looksCompressed(byte[] file) {
		if (file.length < 2) {
			return false;
		}
		int cmf = file[0] & 0xff;
		int flg = file[1] & 0xff;
		return (cmf & 0x0f) == 8 && ((cmf << 8) | flg) % 31 == 0;
	}

	private static int readInt(byte[] b, int pos) {
		return (b[pos] & 0xff)
			| ((b[pos + 1] & 0xff) << 8)
			| ((b[pos + 2] & 0xff) << 16)
			| ((b[pos + 3] & 0xff) << 24);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RpycContainer.class);
}
