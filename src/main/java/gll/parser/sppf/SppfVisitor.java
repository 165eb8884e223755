package gll.parser.sppf;

/**
 * Visitor that delegates each not implemented visit method to the visit method for the parent class.
 */
public interface SppfVisitor<R> {

	R visit(SppfNode node);

	default R visit(TerminalNode terminal){
		return visit((SppfNode)terminal);
	}

	default R visit(EpsilonNode epsilon){
		return visit((TerminalNode)epsilon);
	}

	default R visit(BranchNode branch){
		return visit((SppfNode)branch);
	}

	default R visit(SymbolNode symbol){
		return visit((BranchNode)symbol);
	}

	default R visit(IntermediateNode intermediate){
		return visit((BranchNode)intermediate);
	}

	default R visit(PackedNode packed){
		return visit((SppfNode)packed);
	}
}
