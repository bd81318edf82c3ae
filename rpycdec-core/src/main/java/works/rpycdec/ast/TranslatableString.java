package works.rpycdec.ast;

import static java.util.Objects.requireNonNull;

/**
 * Player-visible text found in a script.
 */
public record TranslatableString(String filename, int line, String text, Kind kind) {
	public TranslatableString {
		requireNonNull(filename);
		requireNonNull(text);
		requireNonNull(kind);
	}

	public enum Kind {
		/**
		 * What a character says, or narration.
		 */
		DIALOGUE,

		/**
		 * The text of a menu choice or menu caption line.
		 */
		MENU_ITEM,

		/**
		 * The original text of a {@code translate strings} entry.
		 */
		STRING_OLD,

		/**
		 * The translated text of a {@code translate strings} entry.
		 */
		STRING_NEW,
	}

	static TranslatableString at(Location location, String text, Kind kind) {
		return new TranslatableString(location.filename(), location.linenumber(), text, kind);
	}
}
