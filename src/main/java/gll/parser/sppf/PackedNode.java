package gll.parser.sppf;

import java.util.ArrayList;
import java.util.List;

import gll.grammar.GrammarSlot;

/**
 * One derivation of its parent: the alternative prefix up to the slot, split at the pivot.
 */
public class PackedNode extends SppfNode {

	/**
	 * Slot after the last symbol of the derivation
	 */
	public final GrammarSlot slot;

	/**
	 * Right extent of the left child, left extent of the right child
	 */
	public final int pivot;

	/**
	 * Node for the symbols before the last one, null if the derivation has only one symbol
	 */
	public final NonPackedNode left;

	/**
	 * Node for the last symbol (or epsilon)
	 */
	public final NonPackedNode right;

	PackedNode(GrammarSlot slot, int pivot, NonPackedNode left, NonPackedNode right) {
		this.slot = slot;
		this.pivot = pivot;
		this.left = left;
		this.right = right;
	}

	@Override
	public Kind kind() {
		return Kind.PACKED;
	}

	@Override
	public int leftExtent() {
		return left != null ? left.leftExtent() : right.leftExtent();
	}

	@Override
	public int rightExtent() {
		return right.rightExtent();
	}

	@Override
	public List<NonPackedNode> children() {
		List<NonPackedNode> children = new ArrayList<>(2);
		if (left != null){
			children.add(left);
		}
		children.add(right);
		return children;
	}

	@Override
	public String label() {
		return String.format("(%s, %d)", slot.formatItem(), pivot);
	}

	@Override
	public <R> R accept(SppfVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
