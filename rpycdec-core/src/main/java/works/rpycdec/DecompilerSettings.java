package works.rpycdec;

import java.util.List;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.rpycdec.container.RpycContainer;
import works.rpycdec.unparse.RenderHook;

@Value
@Builder(toBuilder = true)
public class DecompilerSettings {
	/**
	 * Compiled scripts can hold the statements as written (slot 1) and, in newer
	 * engines, as rewritten for translation (slot 2). When the preferred slot
	 * is absent or damaged, the other is used.
	 */
	@Default boolean preferTranslatedSlot = false;

	/**
	 * One level of indentation in the output.
	 */
	@Default String indent = "    ";

	/**
	 * Applied to every statement before it is rendered.
	 * Translation tools use this to replace dialogue.
	 */
	@Default RenderHook rewriteHook = RenderHook.IDENTITY;

	/**
	 * How many files {@link works.rpycdec.batch.BatchDecompiler} works on at once.
	 */
	@Default int parallelism = Runtime.getRuntime().availableProcessors();

	/**
	 * Which files, by path relative to the input directory, batch mode decompiles.
	 */
	@Default Pattern inputPattern = Pattern.compile(".*\\.rpym?c$");

	/**
	 * Whether batch mode replaces output files that already exist.
	 * When false, such inputs are skipped.
	 */
	@Default boolean overwrite = true;

	public List<Integer> slotPreference() {
		return preferTranslatedSlot ? RpycContainer.TRANSLATED_FIRST : RpycContainer.DEFAULT_SLOTS;
	}

	public static DecompilerSettings defaults() {
		return builder().build();
	}
}
