package gll.parser.sppf;

import gll.grammar.NonTerminal;

/**
 * Node for a non terminal that derives the tokens in [leftExtent, rightExtent).
 */
public class SymbolNode extends BranchNode {

	public final NonTerminal nonTerminal;

	SymbolNode(NonTerminal nonTerminal, int leftExtent, int rightExtent) {
		super(leftExtent, rightExtent);
		this.nonTerminal = nonTerminal;
	}

	@Override
	public Kind kind() {
		return Kind.SYMBOL;
	}

	@Override
	public String label() {
		return String.format("(%s, %d, %d)", nonTerminal, leftExtent(), rightExtent());
	}

	@Override
	public <R> R accept(SppfVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
