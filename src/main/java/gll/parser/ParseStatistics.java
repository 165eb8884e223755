package gll.parser;

import java.util.Objects;

/**
 * Sizes of the data structures of a finished parse.
 */
public class ParseStatistics {

	public final int descriptorsAdded;
	public final int descriptorsProcessed;
	public final int gssNodes;
	public final int gssEdges;
	public final int symbolNodes;
	public final int intermediateNodes;
	public final int packedNodes;
	public final int terminalNodes;
	public final int epsilonNodes;

	public ParseStatistics(int descriptorsAdded, int descriptorsProcessed, int gssNodes, int gssEdges,
	                       int symbolNodes, int intermediateNodes, int packedNodes, int terminalNodes, int epsilonNodes) {
		this.descriptorsAdded = descriptorsAdded;
		this.descriptorsProcessed = descriptorsProcessed;
		this.gssNodes = gssNodes;
		this.gssEdges = gssEdges;
		this.symbolNodes = symbolNodes;
		this.intermediateNodes = intermediateNodes;
		this.packedNodes = packedNodes;
		this.terminalNodes = terminalNodes;
		this.epsilonNodes = epsilonNodes;
	}

	/**
	 * Number of forest nodes, packed nodes included
	 */
	public int totalSppfNodes(){
		return symbolNodes + intermediateNodes + packedNodes + terminalNodes + epsilonNodes;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParseStatistics)){
			return false;
		}
		ParseStatistics other = (ParseStatistics)obj;
		return descriptorsAdded == other.descriptorsAdded && descriptorsProcessed == other.descriptorsProcessed
				&& gssNodes == other.gssNodes && gssEdges == other.gssEdges && symbolNodes == other.symbolNodes
				&& intermediateNodes == other.intermediateNodes && packedNodes == other.packedNodes
				&& terminalNodes == other.terminalNodes && epsilonNodes == other.epsilonNodes;
	}

	@Override
	public int hashCode() {
		return Objects.hash(descriptorsAdded, descriptorsProcessed, gssNodes, gssEdges, symbolNodes,
				intermediateNodes, packedNodes, terminalNodes, epsilonNodes);
	}

	@Override
	public String toString() {
		return String.format("descriptors: %d added, %d processed; gss: %d nodes, %d edges; " +
						"sppf: %d symbol, %d intermediate, %d packed, %d terminal, %d epsilon nodes",
				descriptorsAdded, descriptorsProcessed, gssNodes, gssEdges, symbolNodes, intermediateNodes,
				packedNodes, terminalNodes, epsilonNodes);
	}
}
