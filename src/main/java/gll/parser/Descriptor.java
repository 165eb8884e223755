package gll.parser;

import java.util.Objects;

import gll.grammar.GrammarSlot;
import gll.parser.gss.GssNode;
import gll.parser.sppf.NonPackedNode;

/**
 * A unit of pending work: continue parsing at the slot, with the stack node and input position,
 * the forest node covering the alternative prefix in front of the slot (null if there is none yet).
 *
 * Slots, stack nodes and forest nodes are unique per key, equality is therefore based on their identity.
 */
final class Descriptor {

	final GrammarSlot slot;
	final GssNode gssNode;
	final int position;
	final NonPackedNode sppfNode;

	Descriptor(GrammarSlot slot, GssNode gssNode, int position, NonPackedNode sppfNode) {
		this.slot = slot;
		this.gssNode = gssNode;
		this.position = position;
		this.sppfNode = sppfNode;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Descriptor)){
			return false;
		}
		Descriptor other = (Descriptor)obj;
		return slot == other.slot && gssNode == other.gssNode && position == other.position && sppfNode == other.sppfNode;
	}

	@Override
	public int hashCode() {
		return Objects.hash(System.identityHashCode(slot), System.identityHashCode(gssNode), position,
				System.identityHashCode(sppfNode));
	}

	@Override
	public String toString() {
		return String.format("(%s, %s, %d, %s)", slot.formatItem(), gssNode, position, sppfNode == null ? "$" : sppfNode.label());
	}
}
