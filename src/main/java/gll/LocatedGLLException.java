package gll;

import gll.lexer.Location;
import gll.lexer.Token;

/**
 * An exception that refers to a token of the parsed input.
 */
public class LocatedGLLException extends GLLException {

	/**
	 * Offending token, null if the error occurred at the end of the input
	 */
	public final Token errorToken;
	public final Location errorLocation;

	public LocatedGLLException(Token errorToken, Location errorLocation, String message) {
		super(message);
		this.errorToken = errorToken;
		if (errorToken != null) {
			this.errorLocation = errorToken.location;
		} else if (errorLocation != null) {
			this.errorLocation = errorLocation;
		} else {
			this.errorLocation = new Location(0, 0);
		}
	}
}
