package gll.parser;

import gll.Config;

/**
 * Options of a {@link GLLParser}, the defaults come from the {@link Config}.
 */
public class ParserOptions {

	private boolean lookahead = Config.useLookahead();
	private boolean retainGraphs = Config.retainGraphs();
	private boolean validateGrammar = true;
	private int maxDescriptors = Config.maxDescriptors();
	private int maxGssNodes = Config.maxGssNodes();
	private int maxSppfNodes = Config.maxSppfNodes();

	/**
	 * Only schedule alternatives whose lookahead set contains the current token
	 */
	public ParserOptions lookahead(boolean lookahead){
		this.lookahead = lookahead;
		return this;
	}

	/**
	 * Keep the graph structured stack and the forest builder in the parse result
	 */
	public ParserOptions retainGraphs(boolean retainGraphs){
		this.retainGraphs = retainGraphs;
		return this;
	}

	/**
	 * Validate the grammar before parsing, otherwise contract violations are only detected when
	 * the parser runs into them
	 */
	public ParserOptions validateGrammar(boolean validateGrammar){
		this.validateGrammar = validateGrammar;
		return this;
	}

	/**
	 * @param maxDescriptors maximum number of descriptors added during a parse, 0 for no limit
	 */
	public ParserOptions maxDescriptors(int maxDescriptors){
		this.maxDescriptors = checkLimit(maxDescriptors);
		return this;
	}

	public ParserOptions maxGssNodes(int maxGssNodes){
		this.maxGssNodes = checkLimit(maxGssNodes);
		return this;
	}

	public ParserOptions maxSppfNodes(int maxSppfNodes){
		this.maxSppfNodes = checkLimit(maxSppfNodes);
		return this;
	}

	private static int checkLimit(int limit){
		if (limit < 0){
			throw new IllegalArgumentException("Limits can't be negative: " + limit);
		}
		return limit;
	}

	public boolean useLookahead() {
		return lookahead;
	}

	public boolean retainGraphs() {
		return retainGraphs;
	}

	public boolean validateGrammar() {
		return validateGrammar;
	}

	public int getMaxDescriptors() {
		return maxDescriptors;
	}

	public int getMaxGssNodes() {
		return maxGssNodes;
	}

	public int getMaxSppfNodes() {
		return maxSppfNodes;
	}

	public ParserOptions copy(){
		return new ParserOptions().lookahead(lookahead).retainGraphs(retainGraphs).validateGrammar(validateGrammar)
				.maxDescriptors(maxDescriptors).maxGssNodes(maxGssNodes).maxSppfNodes(maxSppfNodes);
	}

	@Override
	public String toString() {
		return String.format("lookahead=%s, retainGraphs=%s, validateGrammar=%s, maxDescriptors=%d, maxGssNodes=%d, maxSppfNodes=%d",
				lookahead, retainGraphs, validateGrammar, maxDescriptors, maxGssNodes, maxSppfNodes);
	}
}
