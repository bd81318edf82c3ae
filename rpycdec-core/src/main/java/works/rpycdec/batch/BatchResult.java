package works.rpycdec.batch;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * What happened to each input of a {@link BatchDecompiler} run.
 *
 * @param skipped inputs left alone because their output exists, or because the run was cancelled first
 */
public record BatchResult(List<Path> succeeded, Map<Path, Exception> failed, List<Path> skipped) {
	public BatchResult {
		succeeded = List.copyOf(succeeded);
		failed = Map.copyOf(failed);
		skipped = List.copyOf(skipped);
	}

	public boolean allSucceeded() {
		return failed.isEmpty();
	}
}
