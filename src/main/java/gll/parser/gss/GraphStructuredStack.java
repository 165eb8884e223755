package gll.parser.gss;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import gll.grammar.GrammarSlot;
import gll.grammar.NonTerminal;
import gll.parser.ResourceExhaustion;
import gll.parser.sppf.NonPackedNode;
import gll.util.Pair;

/**
 * Graph structured stack of a parse, shares the call stacks of all derivations.
 *
 * Nodes are unique per (non terminal, position), edges per (node, return slot, target).
 * Creating an existing node or edge returns the existing one. Not thread safe.
 */
public class GraphStructuredStack {

	private final Map<Pair<NonTerminal, Integer>, GssNode> nodes = new LinkedHashMap<>();

	private int edgeCount = 0;

	/**
	 * Maximum number of nodes, 0 for no limit
	 */
	private final int maxNodes;

	public GraphStructuredStack(int maxNodes) {
		this.maxNodes = maxNodes;
	}

	public GraphStructuredStack() {
		this(0);
	}

	/**
	 * @return the node or null if it does not exist
	 */
	public GssNode getNode(NonTerminal nonTerminal, int position){
		return nodes.get(new Pair<>(nonTerminal, position));
	}

	/**
	 * @return the node for the call and whether it has been created by this call
	 */
	public Pair<GssNode, Boolean> getOrCreateNode(NonTerminal nonTerminal, int position){
		Pair<NonTerminal, Integer> key = new Pair<>(nonTerminal, position);
		GssNode node = nodes.get(key);
		if (node != null){
			return new Pair<>(node, false);
		}
		if (maxNodes > 0 && nodes.size() >= maxNodes){
			throw new ResourceExhaustion("maxGssNodes", maxNodes);
		}
		node = new GssNode(nonTerminal, position);
		nodes.put(key, node);
		return new Pair<>(node, true);
	}

	/**
	 * Adds an edge from the callee node to the caller node.
	 * Edges to nodes whose calls are still in progress (even self loops) are allowed.
	 *
	 * @return the edge and whether it is new
	 */
	public Pair<GssEdge, Boolean> addEdge(GssNode node, GrammarSlot returnSlot, GssNode predecessor, NonPackedNode sppfNode){
		GssEdge edge = new GssEdge(returnSlot, predecessor, sppfNode);
		GssEdge stored = node.addEdge(edge);
		if (stored == edge){
			edgeCount++;
			return new Pair<>(edge, true);
		}
		return new Pair<>(stored, false);
	}

	public Collection<GssEdge> edgesOf(GssNode node){
		return node.getEdges();
	}

	public Collection<GssNode> getNodes(){
		return Collections.unmodifiableCollection(nodes.values());
	}

	public int nodeCount(){
		return nodes.size();
	}

	public int edgeCount(){
		return edgeCount;
	}
}
