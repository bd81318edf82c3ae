package works.rpycdec.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-wide operations on statements.
 */
public final class Nodes {
	private Nodes() { }

	/**
	 * @return every statement in {@code nodes} and their nested blocks, depth-first,
	 * each node before its children
	 */
	public static List<Node> flatten(List<? extends Node> nodes) {
		List<Node> result = new ArrayList<>();
		nodes.forEach(n -> flattenInto(n, result));
		return result;
	}

	public static List<Node> flatten(Node node) {
		List<Node> result = new ArrayList<>();
		flattenInto(node, result);
		return result;
	}

	private static void flattenInto(Node node, List<Node> result) {
		result.add(node);
		if (node instanceof TranslateSay ts) {
			result.add(ts.say());
		}
		for (List<Node> block : node.blocks()) {
			block.forEach(n -> flattenInto(n, result));
		}
	}
}
