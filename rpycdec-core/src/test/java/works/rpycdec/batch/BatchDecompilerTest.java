package works.rpycdec.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.rpycdec.DecompilerSettings;
import works.rpycdec.exceptions.ContainerFormatException;
import works.rpycdec.exceptions.MalformedTreeException;
import works.rpycdec.testing.ContainerWriter;
import works.rpycdec.testing.PickleWriter;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.rpycdec.testing.PickleWriter.pickle;
import static works.rpycdec.testing.PyValues.dict;
import static works.rpycdec.testing.PyValues.instance;
import static works.rpycdec.testing.PyValues.list;
import static works.rpycdec.testing.PyValues.tuple;

class BatchDecompilerTest {
	@TempDir Path dir;

	@Test
	void mirrorsTree() throws IOException, InterruptedException {
		Path in = dir.resolve("game");
		write(in.resolve("script.rpyc"), compiled("start"));
		write(in.resolve("chapters/one.rpymc"), compiled("one"));
		write(in.resolve("images/bg.png"), "not a script".getBytes(UTF_8));
		Path out = dir.resolve("src");

		BatchResult result = new BatchDecompiler(DecompilerSettings.builder().parallelism(2).build()).run(in, out);

		assertTrue(result.allSucceeded());
		assertEquals(2, result.succeeded().size());
		assertEquals("label start:\n    pass\n", Files.readString(out.resolve("script.rpy"), UTF_8));
		assertTrue(Files.exists(out.resolve("chapters/one.rpym")));
		assertFalse(Files.exists(out.resolve("images")));
	}

	@Test
	void failuresAreIsolated() throws IOException, InterruptedException {
		Path in = dir.resolve("game");
		write(in.resolve("a.rpyc"), compiled("a"));
		write(in.resolve("broken.rpyc"), "garbage".getBytes(UTF_8));
		write(in.resolve("c.rpyc"), compiled("c"));

		BatchResult result = new BatchDecompiler(DecompilerSettings.defaults()).run(in, dir.resolve("out"));

		assertEquals(List.of(in.resolve("a.rpyc"), in.resolve("c.rpyc")), result.succeeded());
		assertEquals(1, result.failed().size());
		assertInstanceOf(ContainerFormatException.class, result.failed().get(in.resolve("broken.rpyc")));
	}

	@Test
	void deeplyNestedFileFailsAlone() throws IOException, InterruptedException {
		Path in = dir.resolve("game");
		write(in.resolve("a.rpyc"), compiled("a"));
		write(in.resolve("b_deep.rpyc"), nestedLabels(50_000));
		write(in.resolve("c.rpyc"), compiled("c"));

		BatchResult result = new BatchDecompiler(DecompilerSettings.builder().parallelism(1).build()).run(in, dir.resolve("out"));

		assertEquals(List.of(in.resolve("a.rpyc"), in.resolve("c.rpyc")), result.succeeded());
		assertInstanceOf(MalformedTreeException.class, result.failed().get(in.resolve("b_deep.rpyc")));
	}

	@Test
	void existingOutputsAreSkippedWithoutOverwrite() throws IOException, InterruptedException {
		Path in = dir.resolve("game");
		Path out = dir.resolve("out");
		write(in.resolve("a.rpyc"), compiled("a"));
		write(out.resolve("a.rpy"), "# edited by hand\n".getBytes(UTF_8));

		BatchResult result = new BatchDecompiler(DecompilerSettings.builder().overwrite(false).build()).run(in, out);

		assertEquals(List.of(in.resolve("a.rpyc")), result.skipped());
		assertEquals("# edited by hand\n", Files.readString(out.resolve("a.rpy"), UTF_8));
	}

	@Test
	void cancelledBeforeStart() throws IOException, InterruptedException {
		Path in = dir.resolve("game");
		write(in.resolve("a.rpyc"), compiled("a"));
		BatchDecompiler batch = new BatchDecompiler(DecompilerSettings.defaults());
		batch.cancel();

		BatchResult result = batch.run(in, dir.resolve("out"));

		assertTrue(batch.isCancelled());
		assertEquals(List.of(in.resolve("a.rpyc")), result.skipped());
		assertTrue(result.succeeded().isEmpty());
	}

	@Test
	void outputPath() {
		Path in = Path.of("game");
		Path out = Path.of("src");
		assertEquals(Path.of("src", "script.rpy"), BatchDecompiler.outputPath(in, out, in.resolve("script.rpyc")));
		assertEquals(Path.of("src", "a", "b.rpym"), BatchDecompiler.outputPath(in, out, in.resolve("a/b.rpymc")));
	}

	static void write(Path file, byte[] contents) throws IOException {
		Files.createDirectories(file.getParent());
		Files.write(file, contents);
	}

	/**
	 * Labels nested {@code depth} deep, each the only statement in its parent's block.
	 * Written opcode by opcode, since the value-level writer recurses.
	 */
	static byte[] nestedLabels(int depth) {
		PickleWriter w = new PickleWriter().proto();
		w.op(PickleWriter.EMPTY_DICT).op(PickleWriter.EMPTY_LIST);
		for (int i = 0; i < depth; i++) {
			w.global("renpy.ast", "Label").op(PickleWriter.EMPTY_TUPLE).op(PickleWriter.NEWOBJ);
			w.op(PickleWriter.NONE).op(PickleWriter.EMPTY_DICT).mark();
			w.unicode("name").unicode("l" + i);
			w.unicode("block").op(PickleWriter.EMPTY_LIST);
		}
		for (int i = 0; i < depth; i++) {
			if (i > 0) {
				w.op(PickleWriter.APPEND);
			}
			w.op(PickleWriter.SETITEMS).op(PickleWriter.TUPLE2).op(PickleWriter.BUILD);
		}
		w.op(PickleWriter.APPEND).op(PickleWriter.TUPLE2).stop();
		return ContainerWriter.legacy(w.toByteArray());
	}

	/**
	 * A script holding one label whose block is a single {@code pass}.
	 */
	static byte[] compiled(String labelName) {
		Object pass = instance("renpy.ast", "Pass", tuple(null, dict("filename", "x.rpy", "linenumber", 2)));
		Object label = instance("renpy.ast", "Label", tuple(null, dict(
			"filename", "x.rpy", "linenumber", 1, "name", labelName, "block", list(pass))));
		return ContainerWriter.legacy(pickle(tuple(dict(), list(label))));
	}
}
