package gll.grammar.filter;

import java.io.Serializable;
import java.util.List;

import gll.grammar.Terminal;
import gll.lexer.TokenInput;

/**
 * A disambiguation filter attached to the grammar slot in front of a symbol.
 *
 * The parser consults the filter right before it takes the transition over the symbol.
 * A rejected transition creates neither a descriptor nor a stack edge nor a forest node.
 * Filters have to be free of side effects, several filters at one slot must all accept.
 */
public interface SymbolFilter extends Serializable {

	/**
	 * When is the filter consulted?
	 */
	enum Phase {
		/**
		 * Before the symbol is matched or called, the right extent equals the left extent
		 */
		BEFORE,
		/**
		 * After the symbol matched, with the extent of the match
		 */
		AFTER
	}

	Phase phase();

	/**
	 * Does the filter allow the symbol to match the span [leftExtent, rightExtent) of the input?
	 */
	boolean accepts(TokenInput input, int leftExtent, int rightExtent);

	/**
	 * Terminal sequences the filter refers to
	 */
	List<List<Terminal>> sequences();
}
