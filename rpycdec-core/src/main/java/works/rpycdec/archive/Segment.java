package works.rpycdec.archive;

import static java.util.Objects.requireNonNull;

/**
 * One stretch of an archive member's data.
 *
 * @param offset where the stretch starts in the archive, already decoded
 * @param length how many bytes, already decoded
 * @param prefix the bytes the stretch is expected to start with; they are not part of the member
 */
public record Segment(long offset, long length, byte[] prefix) {
	public Segment {
		requireNonNull(prefix);
		if (offset < 0 || length < 0) {
			throw new IllegalArgumentException("Negative segment bounds: offset " + offset + ", length " + length);
		}
	}

	public long end() {
		return offset + length;
	}
}
