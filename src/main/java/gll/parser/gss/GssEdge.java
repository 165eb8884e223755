package gll.parser.gss;

import gll.grammar.GrammarSlot;
import gll.parser.sppf.NonPackedNode;

/**
 * Call edge from a callee node to its caller.
 */
public class GssEdge {

	/**
	 * Slot of the caller after the called non terminal
	 */
	public final GrammarSlot returnSlot;

	/**
	 * Node of the caller
	 */
	public final GssNode target;

	/**
	 * Forest node of the caller's alternative prefix in front of the call, null if the call is the first symbol
	 */
	public final NonPackedNode sppfNode;

	GssEdge(GrammarSlot returnSlot, GssNode target, NonPackedNode sppfNode) {
		this.returnSlot = returnSlot;
		this.target = target;
		this.sppfNode = sppfNode;
	}

	@Override
	public String toString() {
		return String.format("%s -%s-> %s", returnSlot, sppfNode == null ? "$" : sppfNode.label(), target);
	}
}
