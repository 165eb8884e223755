package gll.parser.sppf;

import gll.grammar.Epsilon;

/**
 * Leaf for the empty word at a position, there is one per position and forest.
 */
public class EpsilonNode extends TerminalNode {

	EpsilonNode(int position) {
		super(Epsilon.INSTANCE, position, position);
	}

	@Override
	public boolean isEpsilon() {
		return true;
	}

	@Override
	public <R> R accept(SppfVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
