package gll.lexer;

import java.io.*;

/**
 * Simple lexer that produces one token per ASCII character.
 */
public class AlphabetLexer extends BaseLexer {

	private int line = 1;
	private int column = 0;

	public AlphabetLexer(String input, int[] ignoredTokenTypes){
		super(AlphabetTerminals.getInstance(), input, ignoredTokenTypes);
	}

	public AlphabetLexer(String input){
		this(input, new int[]{});
	}

	public AlphabetLexer(InputStream input, int[] ignoredTokenTypes) {
		super(AlphabetTerminals.getInstance(), input, ignoredTokenTypes);
	}

	@Override
	protected Token parseNextToken() {
		int cur;
		try {
			cur = inputStream.read();
		} catch (IOException e) {
			throw new LexerError("Cannot read input: " + e.getMessage());
		}
		if (cur == -1){
			return new Token(TerminalSet.EOF, terminalSet, "", new Location(line, column));
		}
		if (cur >= 0x80){
			throw new LexerError(String.format("Non ASCII input byte 0x%02x at %s", cur, new Location(line, column)));
		}
		if (!terminalSet.isValidType(cur) || cur == TerminalSet.EOF){
			throw new LexerError(String.format("Unsupported character %s at %s",
					Character.toString((char) cur), new Location(line, column)));
		}
		Token newToken = new Token(cur, terminalSet, Character.toString((char) cur), new Location(line, column));
		if (cur == '\n') {
			line++;
			column = 0;
		} else {
			column++;
		}
		return newToken;
	}
}
