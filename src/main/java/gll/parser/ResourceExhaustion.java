package gll.parser;

import gll.GLLException;

/**
 * Thrown if a parse exceeds one of the limits of its {@link ParserOptions}.
 */
public class ResourceExhaustion extends GLLException {

	/**
	 * Name of the exceeded limit, e.g. "maxDescriptors"
	 */
	public final String limitName;

	public final int limit;

	public ResourceExhaustion(String limitName, int limit) {
		super(String.format("Parse exceeded %s = %d", limitName, limit));
		this.limitName = limitName;
		this.limit = limit;
	}
}
