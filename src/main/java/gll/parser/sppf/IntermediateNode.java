package gll.parser.sppf;

import gll.grammar.GrammarSlot;

/**
 * Node for the prefix of an alternative in front of the slot's dot, binarizes the forest.
 */
public class IntermediateNode extends BranchNode {

	public final GrammarSlot slot;

	IntermediateNode(GrammarSlot slot, int leftExtent, int rightExtent) {
		super(leftExtent, rightExtent);
		this.slot = slot;
	}

	@Override
	public Kind kind() {
		return Kind.INTERMEDIATE;
	}

	@Override
	public String label() {
		return String.format("(%s, %d, %d)", slot.formatItem(), leftExtent(), rightExtent());
	}

	@Override
	public <R> R accept(SppfVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
