package gll;

/**
 * Base class of all exceptions thrown by this library.
 */
public class GLLException extends RuntimeException {

	public GLLException(String message) {
		super(message);
	}

	public GLLException(String message, Throwable cause) {
		super(message, cause);
	}
}
