package works.rpycdec.ast.atl;

public interface AtlVisitor<R> {
	R visitBlock(AtlBlock block);
	R visitChild(AtlChild child);
	R visitChoice(AtlChoice choice);
	R visitContainsExpr(AtlContainsExpr contains);
	R visitEvent(AtlEvent event);
	R visitFunction(AtlFunction function);
	R visitInterpolation(AtlInterpolation interpolation);
	R visitOn(AtlOn on);
	R visitParallel(AtlParallel parallel);
	R visitRepeat(AtlRepeat repeat);
	R visitTime(AtlTime time);
}
