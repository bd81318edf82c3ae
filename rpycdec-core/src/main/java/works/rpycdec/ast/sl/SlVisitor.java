package works.rpycdec.ast.sl;

public interface SlVisitor<R> {
	R visitBlock(SlBlock node);
	R visitBreak(SlBreak node);
	R visitContinue(SlContinue node);
	R visitDefault(SlDefault node);
	R visitDisplayable(SlDisplayable node);
	R visitFor(SlFor node);
	R visitIf(SlIf node);
	R visitPass(SlPass node);
	R visitPython(SlPython node);
	R visitScreen(SlScreen node);
	R visitShowIf(SlShowIf node);
	R visitTransclude(SlTransclude node);
	R visitUse(SlUse node);
}
