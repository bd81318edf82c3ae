package works.rpycdec.unparse;

import works.rpycdec.ast.Node;

/**
 * Called on every statement just before it is rendered, including statements
 * nested in blocks. Returning a different node renders that node instead;
 * translation tools use this to substitute text without walking the tree themselves.
 */
@FunctionalInterface
public interface RenderHook {
	Node rewrite(Node node);

	RenderHook IDENTITY = node -> node;
}
