package gll.parser.sppf;

import java.util.List;

/**
 * Node of a shared packed parse forest.
 *
 * Nodes are created and deduplicated by a {@link SppfBuilder}, nodes with the same key are the same object.
 */
public abstract class SppfNode {

	public enum Kind {
		TERMINAL, SYMBOL, INTERMEDIATE, PACKED
	}

	public abstract Kind kind();

	/**
	 * Input position of the first token covered by this node
	 */
	public abstract int leftExtent();

	/**
	 * Input position after the last token covered by this node
	 */
	public abstract int rightExtent();

	/**
	 * Children in the order of the input, packed nodes for symbol and intermediate nodes
	 */
	public abstract List<? extends SppfNode> children();

	public abstract String label();

	public abstract <R> R accept(SppfVisitor<R> visitor);

	@Override
	public String toString() {
		return label();
	}
}
