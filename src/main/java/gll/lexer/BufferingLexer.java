package gll.lexer;

import java.util.*;

/**
 * Lexer that produces all of its tokens up front. An end of input token is appended
 * if the produced tokens don't end with one.
 */
public abstract class BufferingLexer implements Lexer {

	private List<Token> tokens = null;
	private int index = 0;
	private Token curToken = null;
	protected TerminalSet terminalSet;
	private Set<Integer> ignoredTypes = new HashSet<>();

	public BufferingLexer(TerminalSet terminalSet, int[] ignoredTokenTypes){
		this.terminalSet = terminalSet;
		for (int type : ignoredTokenTypes){
			ignore(type);
		}
	}

	/**
	 * Produce the tokens via {@link #addTokenIfNotIgnored(Token)}
	 */
	protected abstract void initTokens();

	protected void addTokenIfNotIgnored(Token token){
		if (!ignoredTypes.contains(token.type)){
			tokens.add(token);
		}
	}

	private void ensureTokens(){
		if (tokens != null){
			return;
		}
		tokens = new ArrayList<>();
		initTokens();
		if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).isEOF()){
			Location location = tokens.isEmpty() ? new Location(1, 0) : tokens.get(tokens.size() - 1).location;
			tokens.add(new Token(TerminalSet.EOF, terminalSet, "", location));
		}
	}

	@Override
	public Token cur() {
		if (curToken == null){
			return next();
		}
		return curToken;
	}

	@Override
	public Token next() {
		ensureTokens();
		if (index < tokens.size()){
			curToken = tokens.get(index++);
		}
		return curToken;
	}

	@Override
	public void ignore(int tokenType) {
		if (!terminalSet.isValidType(tokenType) || tokenType == TerminalSet.EOF){
			throw new LexerError(String.format("Cannot ignore token type %d", tokenType));
		}
		ignoredTypes.add(tokenType);
	}

	@Override
	public TerminalSet getTerminalSet(){
		return terminalSet;
	}

}
