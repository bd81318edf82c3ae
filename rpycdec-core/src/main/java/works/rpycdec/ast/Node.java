package works.rpycdec.ast;

import java.util.List;

/**
 * A statement of the scripting language, as reconstructed from a compiled script.
 * <p>
 * Nodes are immutable. A rewrite produces a new node; use the {@code with*}
 * methods that the records provide for targeted edits.
 */
public sealed interface Node permits
	Call,
	Camera,
	Define,
	Default,
	EarlyPython,
	EndTranslate,
	Hide,
	If,
	Image,
	Init,
	Jump,
	Label,
	Menu,
	Pass,
	Python,
	RawNode,
	Return,
	Say,
	Scene,
	Screen,
	Show,
	ShowLayer,
	Style,
	Testcase,
	Transform,
	Translate,
	TranslateBlock,
	TranslateSay,
	TranslateString,
	UserStatement,
	While,
	With
{
	Location location();

	/**
	 * @return the nested statement blocks of this node, in source order.
	 * Compound statements with several bodies, like {@link If} and {@link Menu},
	 * return one list per body.
	 */
	default List<List<Node>> blocks() {
		return List.of();
	}

	<R> R accept(NodeVisitor<R> visitor);

	/**
	 * @return the statement's kind, for diagnostics
	 */
	default String kind() {
		return getClass().getSimpleName();
	}
}
