package gll.grammar;

import java.io.Serializable;

import gll.lexer.TerminalSet;

/**
 * A terminal symbol, it matches tokens whose type is its id.
 */
public class Terminal extends TerminalOrEpsilon implements Serializable {

	/**
	 * Id of this terminal
	 */
	public final int id;

	/**
	 * Set of terminal symbols this terminal belongs to (like the used alphabet)
	 */
	public final TerminalSet terminalSet;


	public Terminal(int id, TerminalSet terminalSet) {
		this.id = id;
		this.terminalSet = terminalSet;
	}

	public boolean isEOF(){
		return id == TerminalSet.EOF;
	}

	@Override
	public String toString() {
		if (!terminalSet.isValidType(id)){
			return "<invalid terminal " + id + ">";
		}
		return "<" + terminalSet.typeToString(id) + ">";
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Terminal && ((Terminal) obj).id == id;
	}

	@Override
	protected int kindRank() {
		return 1;
	}

	@Override
	public int compareTo(Symbol o) {
		if (!(o instanceof Terminal)){
			return super.compareTo(o);
		}
		return Integer.compare(id, ((Terminal)o).id);
	}
}
