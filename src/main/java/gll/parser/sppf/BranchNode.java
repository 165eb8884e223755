package gll.parser.sppf;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import gll.grammar.GrammarSlot;
import gll.util.Pair;

/**
 * Symbol or intermediate node: its derivations are its packed children, one per (slot, pivot).
 * More than one packed child means that the node is ambiguous.
 */
public abstract class BranchNode extends NonPackedNode {

	private final Map<Pair<GrammarSlot, Integer>, PackedNode> packedNodes = new LinkedHashMap<>();

	BranchNode(int leftExtent, int rightExtent) {
		super(leftExtent, rightExtent);
	}

	/**
	 * Adds the packed node if there is no packed node with the same slot and pivot
	 *
	 * @return true if the node has been added
	 */
	boolean addPackedNode(PackedNode node){
		return packedNodes.putIfAbsent(new Pair<>(node.slot, node.pivot), node) == null;
	}

	public PackedNode getPackedNode(GrammarSlot slot, int pivot){
		return packedNodes.get(new Pair<>(slot, pivot));
	}

	public Collection<PackedNode> getPackedNodes(){
		return Collections.unmodifiableCollection(packedNodes.values());
	}

	public boolean isAmbiguous(){
		return packedNodes.size() > 1;
	}

	@Override
	public List<PackedNode> children() {
		return Collections.unmodifiableList(new ArrayList<>(packedNodes.values()));
	}
}
