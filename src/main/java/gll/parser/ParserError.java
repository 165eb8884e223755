package gll.parser;

import gll.LocatedGLLException;
import gll.lexer.Location;
import gll.lexer.Token;

/**
 * An error thrown after encountering a syntax error
 */
public class ParserError extends LocatedGLLException {

	public ParserError(Token errorToken, Location location, String message) {
		super(errorToken, location, String.format("Error at %s: %s", errorToken != null ? errorToken.location : location, message));
	}
}
