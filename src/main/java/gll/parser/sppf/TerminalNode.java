package gll.parser.sppf;

import java.util.Collections;
import java.util.List;

import gll.grammar.TerminalOrEpsilon;

/**
 * Leaf for a matched terminal, covers exactly one token.
 */
public class TerminalNode extends NonPackedNode {

	public final TerminalOrEpsilon symbol;

	TerminalNode(TerminalOrEpsilon symbol, int leftExtent, int rightExtent) {
		super(leftExtent, rightExtent);
		this.symbol = symbol;
	}

	public boolean isEpsilon(){
		return false;
	}

	@Override
	public Kind kind() {
		return Kind.TERMINAL;
	}

	@Override
	public List<SppfNode> children() {
		return Collections.emptyList();
	}

	@Override
	public String label() {
		return String.format("(%s, %d, %d)", symbol, leftExtent(), rightExtent());
	}

	@Override
	public <R> R accept(SppfVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
