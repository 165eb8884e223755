package gll.tree;

import java.util.*;

import gll.GLLException;
import gll.lexer.TokenInput;
import gll.parser.sppf.*;

/**
 * Extracts one derivation tree from a forest, the policy resolves ambiguities.
 *
 * Cyclic forests represent infinitely many trees. For nodes on a cycle only derivations that
 * lead to nodes with a strictly smaller height are considered, the height of a node being the
 * height of its lowest derivation tree. This yields finite trees.
 */
public class TreeBuilder {

	private final AmbiguityPolicy policy;

	public TreeBuilder(AmbiguityPolicy policy) {
		this.policy = policy;
	}

	public TreeBuilder() {
		this(AmbiguityPolicy.FIRST_ALTERNATIVE);
	}

	/**
	 * @param input tokens the forest has been built from
	 * @throws AmbiguityException if the policy rejects an ambiguity
	 */
	public RuleTree build(SymbolNode root, TokenInput input){
		return new Run(root, input).build(root);
	}

	private class Run {

		private final TokenInput input;

		private final Set<SppfNode> cyclicNodes;

		private final Map<SppfNode, Integer> heights = new HashMap<>();

		Run(SymbolNode root, TokenInput input) {
			this.input = input;
			this.cyclicNodes = Forests.cyclicNodes(root);
			if (!cyclicNodes.isEmpty()){
				calculateHeights(Forests.collectNodes(root));
			}
		}

		private void calculateHeights(Set<SppfNode> nodes){
			for (SppfNode node : nodes){
				if (node instanceof TerminalNode){
					heights.put(node, 0);
				}
			}
			boolean somethingChanged;
			do {
				somethingChanged = false;
				for (SppfNode node : nodes){
					if (!(node instanceof BranchNode)){
						continue;
					}
					for (PackedNode packed : ((BranchNode) node).getPackedNodes()){
						int height = height(packed);
						if (height != Integer.MAX_VALUE && height + 1 < heights.getOrDefault(node, Integer.MAX_VALUE)){
							heights.put(node, height + 1);
							somethingChanged = true;
						}
					}
				}
			} while (somethingChanged);
		}

		private int height(PackedNode packed){
			int height = 0;
			for (SppfNode child : packed.children()){
				height = Math.max(height, heights.getOrDefault(child, Integer.MAX_VALUE));
			}
			return height;
		}

		RuleTree build(SymbolNode node){
			PackedNode packed = choose(node);
			List<ParseTree> children = new ArrayList<>();
			collect(packed, children);
			return new RuleTree(packed.slot.production, children);
		}

		/**
		 * Appends the trees of the symbols of the derivation
		 */
		private void collect(PackedNode packed, List<ParseTree> children){
			if (packed.left != null){
				addTree(packed.left, children);
			}
			addTree(packed.right, children);
		}

		private void addTree(NonPackedNode node, List<ParseTree> children){
			if (node instanceof IntermediateNode){
				collect(choose((IntermediateNode) node), children);
			} else if (node instanceof SymbolNode){
				children.add(build((SymbolNode) node));
			} else if (!((TerminalNode) node).isEpsilon()){
				children.add(new TokenLeaf(input.get(node.leftExtent()), node.leftExtent()));
			}
		}

		private PackedNode choose(BranchNode node){
			List<PackedNode> candidates = new ArrayList<>();
			for (PackedNode packed : node.getPackedNodes()){
				if (!cyclicNodes.contains(node) || height(packed) < heights.getOrDefault(node, Integer.MAX_VALUE)){
					candidates.add(packed);
				}
			}
			if (candidates.isEmpty()){
				throw new GLLException(String.format("%s has no finite derivation", node.label()));
			}
			return policy.choose(node, candidates);
		}
	}
}
