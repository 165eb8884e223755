package gll.tree;

import java.util.Comparator;
import java.util.List;

import gll.parser.sppf.BranchNode;
import gll.parser.sppf.PackedNode;

/**
 * Decides which derivation of an ambiguous forest node ends up in the tree.
 */
public enum AmbiguityPolicy {
	/**
	 * Prefer the alternative added first to the grammar, then the shorter left part
	 */
	FIRST_ALTERNATIVE {
		@Override
		public PackedNode choose(BranchNode node, List<PackedNode> candidates) {
			return candidates.stream().min(Comparator.comparingInt((PackedNode p) -> p.slot.alternative())
					.thenComparingInt(p -> p.pivot)).get();
		}
	},
	/**
	 * Fail on every node with more than one derivation
	 */
	REJECT {
		@Override
		public PackedNode choose(BranchNode node, List<PackedNode> candidates) {
			if (candidates.size() > 1){
				throw new AmbiguityException(node, candidates);
			}
			return candidates.get(0);
		}
	};

	/**
	 * @param candidates non empty list of packed children of the node
	 */
	public abstract PackedNode choose(BranchNode node, List<PackedNode> candidates);
}
