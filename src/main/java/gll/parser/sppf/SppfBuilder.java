package gll.parser.sppf;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import gll.grammar.GrammarSlot;
import gll.grammar.NonTerminal;
import gll.grammar.Terminal;
import gll.parser.ResourceExhaustion;

/**
 * Creates the nodes of a forest, each node exactly once per key.
 *
 * Every node kind has its own lookup map, asking twice for the same key returns the same node and
 * adding a packed node with an existing (slot, pivot) pair to its parent does nothing.
 * Not thread safe, each parse uses its own builder.
 */
public class SppfBuilder {

	private static class Key {
		final Object label;
		final int left;
		final int right;

		Key(Object label, int left, int right) {
			this.label = label;
			this.left = left;
			this.right = right;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Key)){
				return false;
			}
			Key other = (Key)obj;
			return left == other.left && right == other.right && label.equals(other.label);
		}

		@Override
		public int hashCode() {
			return Objects.hash(label, left, right);
		}
	}

	private final Map<Key, TerminalNode> terminalNodes = new HashMap<>();
	private final Map<Integer, EpsilonNode> epsilonNodes = new HashMap<>();
	private final Map<Key, SymbolNode> symbolNodes = new HashMap<>();
	private final Map<Key, IntermediateNode> intermediateNodes = new HashMap<>();
	private int packedNodeCount = 0;

	/**
	 * Maximum number of nodes (packed nodes included), 0 for no limit
	 */
	private final int maxNodes;

	public SppfBuilder(int maxNodes) {
		this.maxNodes = maxNodes;
	}

	public SppfBuilder() {
		this(0);
	}

	/**
	 * Leaf for the passed terminal matched at the passed position
	 */
	public TerminalNode terminalNode(Terminal terminal, int position){
		Key key = new Key(terminal.id, position, position + 1);
		TerminalNode node = terminalNodes.get(key);
		if (node == null){
			checkLimit();
			node = new TerminalNode(terminal, position, position + 1);
			terminalNodes.put(key, node);
		}
		return node;
	}

	public EpsilonNode epsilonNode(int position){
		EpsilonNode node = epsilonNodes.get(position);
		if (node == null){
			checkLimit();
			node = new EpsilonNode(position);
			epsilonNodes.put(position, node);
		}
		return node;
	}

	public SymbolNode symbolNode(NonTerminal nonTerminal, int leftExtent, int rightExtent){
		Key key = new Key(nonTerminal, leftExtent, rightExtent);
		SymbolNode node = symbolNodes.get(key);
		if (node == null){
			checkLimit();
			node = new SymbolNode(nonTerminal, leftExtent, rightExtent);
			symbolNodes.put(key, node);
		}
		return node;
	}

	public IntermediateNode intermediateNode(GrammarSlot slot, int leftExtent, int rightExtent){
		Key key = new Key(slot, leftExtent, rightExtent);
		IntermediateNode node = intermediateNodes.get(key);
		if (node == null){
			checkLimit();
			node = new IntermediateNode(slot, leftExtent, rightExtent);
			intermediateNodes.put(key, node);
		}
		return node;
	}

	/**
	 * Symbol node for the completed alternative of the passed end slot, with a packed node for the
	 * derivation left · right
	 *
	 * @param left node of the symbols before the last one, null if there are none
	 * @param right node of the last symbol or the epsilon node
	 */
	public SymbolNode packedSymbol(GrammarSlot slot, NonPackedNode left, NonPackedNode right){
		SymbolNode node = symbolNode(slot.nonTerminal(), leftExtent(left, right), right.rightExtent());
		addPacked(node, slot, left, right);
		return node;
	}

	/**
	 * Intermediate node for the alternative prefix in front of the passed slot, with a packed node
	 * for the derivation left · right
	 */
	public IntermediateNode packedIntermediate(GrammarSlot slot, NonPackedNode left, NonPackedNode right){
		IntermediateNode node = intermediateNode(slot, leftExtent(left, right), right.rightExtent());
		addPacked(node, slot, left, right);
		return node;
	}

	/**
	 * Node for the alternative prefix in front of the passed slot, after the last symbol (right) matched.
	 *
	 * The node of a prefix that consists of a single terminal or non nullable non terminal is
	 * the node of this symbol, the node of a completed alternative is a symbol node and the node of
	 * every other prefix is an intermediate node.
	 */
	public NonPackedNode getNodeP(GrammarSlot slot, NonPackedNode left, NonPackedNode right){
		if (slot.sharesFirstNode() && !slot.isEnd()){
			return right;
		}
		if (slot.isEnd()){
			return packedSymbol(slot, left, right);
		}
		return packedIntermediate(slot, left, right);
	}

	private void addPacked(BranchNode parent, GrammarSlot slot, NonPackedNode left, NonPackedNode right){
		int pivot = right.leftExtent();
		if (parent.getPackedNode(slot, pivot) == null){
			checkLimit();
			parent.addPackedNode(new PackedNode(slot, pivot, left, right));
			packedNodeCount++;
		}
	}

	private int leftExtent(NonPackedNode left, NonPackedNode right){
		return left != null ? left.leftExtent() : right.leftExtent();
	}

	private void checkLimit(){
		if (maxNodes > 0 && totalNodeCount() >= maxNodes){
			throw new ResourceExhaustion("maxSppfNodes", maxNodes);
		}
	}

	/**
	 * @return the symbol node or null if it does not exist
	 */
	public SymbolNode getSymbolNode(NonTerminal nonTerminal, int leftExtent, int rightExtent){
		return symbolNodes.get(new Key(nonTerminal, leftExtent, rightExtent));
	}

	/**
	 * @return the intermediate node or null if it does not exist
	 */
	public IntermediateNode getIntermediateNode(GrammarSlot slot, int leftExtent, int rightExtent){
		return intermediateNodes.get(new Key(slot, leftExtent, rightExtent));
	}

	/**
	 * @return the terminal node or null if it does not exist
	 */
	public TerminalNode getTerminalNode(Terminal terminal, int position){
		return terminalNodes.get(new Key(terminal.id, position, position + 1));
	}

	public int terminalNodeCount(){
		return terminalNodes.size();
	}

	public int epsilonNodeCount(){
		return epsilonNodes.size();
	}

	public int symbolNodeCount(){
		return symbolNodes.size();
	}

	public int intermediateNodeCount(){
		return intermediateNodes.size();
	}

	public int packedNodeCount(){
		return packedNodeCount;
	}

	public int totalNodeCount(){
		return terminalNodes.size() + epsilonNodes.size() + symbolNodes.size() + intermediateNodes.size() + packedNodeCount;
	}
}
