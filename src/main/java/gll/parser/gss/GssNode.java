package gll.parser.gss;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import gll.grammar.GrammarSlot;
import gll.grammar.NonTerminal;
import gll.parser.sppf.SymbolNode;
import gll.util.Pair;

/**
 * Node of the graph structured stack: the call of a non terminal at an input position.
 *
 * Its edges lead to the callers, its pop set contains the results already returned to them.
 */
public class GssNode {

	public final NonTerminal nonTerminal;

	/**
	 * Input position of the call
	 */
	public final int position;

	private final Map<Pair<GrammarSlot, GssNode>, GssEdge> edges = new LinkedHashMap<>();

	private final Set<SymbolNode> popped = new LinkedHashSet<>();

	GssNode(NonTerminal nonTerminal, int position) {
		this.nonTerminal = nonTerminal;
		this.position = position;
	}

	/**
	 * Adds the edge if there is no edge with the same return slot and target
	 *
	 * @return the edge stored in this node
	 */
	GssEdge addEdge(GssEdge edge){
		GssEdge existing = edges.putIfAbsent(new Pair<>(edge.returnSlot, edge.target), edge);
		return existing == null ? edge : existing;
	}

	public GssEdge getEdge(GrammarSlot returnSlot, GssNode target){
		return edges.get(new Pair<>(returnSlot, target));
	}

	public Collection<GssEdge> getEdges(){
		return Collections.unmodifiableCollection(edges.values());
	}

	/**
	 * Records a result of the call
	 *
	 * @return true if the result is new
	 */
	public boolean addPopped(SymbolNode result){
		return popped.add(result);
	}

	/**
	 * Results already returned to the callers, in the order they were found
	 */
	public Collection<SymbolNode> getPopped(){
		return Collections.unmodifiableSet(popped);
	}

	public String label(){
		return String.format("(%s, %d)", nonTerminal, position);
	}

	@Override
	public String toString() {
		return label();
	}
}
