package gll.lexer;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Lexer that reads its tokens one by one from an input stream.
 */
public abstract class BaseLexer implements Lexer {

	private Token curToken = null;
	protected TerminalSet terminalSet;
	private Set<Integer> ignoredTypes = new HashSet<>();
	protected InputStream inputStream;

	public BaseLexer(TerminalSet terminalSet, String input, int[] ignoredTokenTypes){
		this(terminalSet, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), ignoredTokenTypes);
	}

	public BaseLexer(TerminalSet terminalSet, InputStream input, int[] ignoredTokenTypes) {
		this.terminalSet = terminalSet;
		inputStream = input;
		for (int type : ignoredTokenTypes){
			ignore(type);
		}
	}

	@Override
	public Token cur() {
		if (curToken == null){
			return next();
		}
		return curToken;
	}

	protected abstract Token parseNextToken();

	@Override
	public Token next() {
		if (curToken != null && curToken.isEOF()){
			return curToken;
		}
		do {
			curToken = parseNextToken();
		} while (ignoredTypes.contains(curToken.type));
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
