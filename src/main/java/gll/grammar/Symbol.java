package gll.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols and non terminal symbols.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public boolean isEpsOrTerminal(){
		return this instanceof TerminalOrEpsilon;
	}

	/**
	 * Rank used to order symbols of different kinds: epsilon, terminals, non terminals
	 */
	protected abstract int kindRank();

	@Override
	public int compareTo(Symbol o) {
		return Integer.compare(kindRank(), o.kindRank());
	}
}
