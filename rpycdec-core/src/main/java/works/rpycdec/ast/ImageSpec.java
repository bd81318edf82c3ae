package works.rpycdec.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * What to show, and how: the operand of {@code show}, {@code scene} and {@code hide}.
 *
 * @param name the space-separated parts of the image name; ignored when {@code expression} is given
 * @param expression an image computed at runtime
 * @param tag replaces the first part of the name as the image's tag
 * @param atList transforms to apply
 * @param layer the layer to show on, when not the default
 * @param zorder stacking order within the layer
 * @param behind tags this image should be placed behind
 */
public record ImageSpec(
	List<String> name,
	@Nullable PyExpr expression,
	@Nullable String tag,
	List<PyExpr> atList,
	@Nullable String layer,
	@Nullable PyExpr zorder,
	List<String> behind
) {
	public ImageSpec {
		name = List.copyOf(name);
		atList = List.copyOf(atList);
		behind = List.copyOf(behind);
	}

	public static ImageSpec named(String... name) {
		return new ImageSpec(List.of(name), null, null, List.of(), null, null, List.of());
	}
}
