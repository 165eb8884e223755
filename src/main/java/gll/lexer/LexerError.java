package gll.lexer;

import gll.GLLException;

/**
 * Error thrown by lexers and token sources that cannot produce a valid token.
 */
public class LexerError extends GLLException {
	public LexerError(String message) {
		super(message);
	}
}
