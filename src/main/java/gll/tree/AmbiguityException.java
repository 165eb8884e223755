package gll.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gll.GLLException;
import gll.parser.sppf.BranchNode;
import gll.parser.sppf.PackedNode;

/**
 * Thrown by {@link AmbiguityPolicy#REJECT} for a node with several derivations.
 */
public class AmbiguityException extends GLLException {

	public final BranchNode node;

	public final List<PackedNode> derivations;

	public AmbiguityException(BranchNode node, List<PackedNode> derivations) {
		super(String.format("%s has %d derivations: %s", node.label(), derivations.size(), derivations));
		this.node = node;
		this.derivations = Collections.unmodifiableList(new ArrayList<>(derivations));
	}
}
