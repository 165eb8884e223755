package gll.lexer;

import java.io.Serializable;

/**
 * Line and column of a token in its source text.
 */
public class Location implements Serializable {

	public final int line;
	public final int column;

	public Location(int line, int column){
		this.line = line;
		this.column = column;
	}

	@Override
	public String toString() {
		return "[" + line + ":" + column + "]";
	}
}
