package gll.grammar;

/**
 * Kind of a grammar slot, decided by the symbol after the dot.
 */
public enum SlotKind {
	/**
	 * A terminal follows the dot
	 */
	TERMINAL,
	/**
	 * A non terminal follows the dot
	 */
	NONTERMINAL,
	/**
	 * The dot is at the end of the alternative
	 */
	END
}
