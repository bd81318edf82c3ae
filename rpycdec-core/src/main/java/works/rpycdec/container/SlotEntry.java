package works.rpycdec.container;

/**
 * One entry of a multi-slot container's directory.
 * Offsets and lengths are unsigned 32-bit values in the file.
 */
public record SlotEntry(int slot, long offset, long length) {
	public long end() {
		return offset + length;
	}
}
