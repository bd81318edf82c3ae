package works.rpycdec.ast;

/**
 * One method per kind of {@link Node}, so that adding a kind is a compile error
 * everywhere that needs to handle it.
 */
public interface NodeVisitor<R> {
	R visitCall(Call node);
	R visitCamera(Camera node);
	R visitDefine(Define node);
	R visitDefault(Default node);
	R visitEarlyPython(EarlyPython node);
	R visitEndTranslate(EndTranslate node);
	R visitHide(Hide node);
	R visitIf(If node);
	R visitImage(Image node);
	R visitInit(Init node);
	R visitJump(Jump node);
	R visitLabel(Label node);
	R visitMenu(Menu node);
	R visitPass(Pass node);
	R visitPython(Python node);
	R visitRawNode(RawNode node);
	R visitReturn(Return node);
	R visitSay(Say node);
	R visitScene(Scene node);
	R visitScreen(Screen node);
	R visitShow(Show node);
	R visitShowLayer(ShowLayer node);
	R visitStyle(Style node);
	R visitTestcase(Testcase node);
	R visitTransform(Transform node);
	R visitTranslate(Translate node);
	R visitTranslateBlock(TranslateBlock node);
	R visitTranslateSay(TranslateSay node);
	R visitTranslateString(TranslateString node);
	R visitUserStatement(UserStatement node);
	R visitWhile(While node);
	R visitWith(With node);
}
