package gll.parser.sppf;

/**
 * A node with a fixed extent, every node but the packed nodes.
 */
public abstract class NonPackedNode extends SppfNode {

	private final int leftExtent;
	private final int rightExtent;

	NonPackedNode(int leftExtent, int rightExtent) {
		this.leftExtent = leftExtent;
		this.rightExtent = rightExtent;
	}

	@Override
	public int leftExtent() {
		return leftExtent;
	}

	@Override
	public int rightExtent() {
		return rightExtent;
	}
}
