package gll.lexer;

import java.util.List;

/**
 * Lexer that replays a list of already created tokens.
 */
public class ListLexer extends BufferingLexer {

	private List<Token> tokens;

	public ListLexer(TerminalSet terminalSet, int[] ignoredTokenTypes, List<Token> tokens){
		super(terminalSet, ignoredTokenTypes);
		this.tokens = tokens;
	}

	public ListLexer(TerminalSet terminalSet, List<Token> tokens){
		this(terminalSet, new int[]{}, tokens);
	}

	@Override
	protected void initTokens() {
		for (Token token : tokens){
			addTokenIfNotIgnored(token);
		}
	}
}
