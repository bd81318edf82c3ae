package works.rpycdec.pickle.values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * An immutable sequence, kept distinct from {@link List} because
 * reconstruction protocols treat tuples and lists differently.
 * Elements may be null.
 */
public record PyTuple(List<Object> items) {
	public PyTuple(List<Object> items) {
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
	}

	public static final PyTuple EMPTY = new PyTuple(List.of());

	public static PyTuple of(Object... items) {
		return new PyTuple(Arrays.asList(items));
	}

	public int size() {
		return items.size();
	}

	public @Nullable Object get(int index) {
		return items.get(index);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("(");
		String sep = "";
		for (Object item : items) {
			sb.append(sep).append(item);
			sep = ", ";
		}
		if (items.size() == 1) {
			sb.append(",");
		}
		return sb.append(")").toString();
	}
}
