package works.rpycdec.ast.sl;

import java.util.List;
import works.rpycdec.ast.Location;

public record SlBlock(Location location, List<Keyword> keywords, List<SlNode> children) implements SlNode {
	public SlBlock {
		keywords = List.copyOf(keywords);
		children = List.copyOf(children);
	}

	public boolean isEmpty() {
		return keywords.isEmpty() && children.isEmpty();
	}

	@Override
	public <R> R accept(SlVisitor<R> visitor) {
		return visitor.visitBlock(this);
	}
}
