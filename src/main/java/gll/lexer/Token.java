package gll.lexer;

/**
 * An already lexed terminal symbol of the input.
 */
public class Token {

	/**
	 * Type of the token, equal to the id of the matching terminal.
	 */
	public final int type;

	/**
	 * Set of terminals the type of this token belongs too.
	 */
	public final TerminalSet terminalSet;

	/**
	 * Matched text.
	 */
	public final String value;

	public final Location location;

	public Token(int type, TerminalSet terminalSet, String value, Location location){
		this.type = type;
		this.terminalSet = terminalSet;
		this.value = value;
		this.location = location;
	}

	@Override
	public String toString() {
		return terminalSet.typeToString(type) + location.toString() + "(" + value + ")";
	}

	public String toSimpleString(){
		return terminalSet.typeToString(type);
	}

	public boolean isEOF(){
		return type == TerminalSet.EOF;
	}
}
