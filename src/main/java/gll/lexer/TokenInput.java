package gll.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gll.grammar.Terminal;

/**
 * Immutable, indexed sequence of already lexed tokens, the input of a parse.
 *
 * Positions range from 0 to {@link #size()}, the position {@code size()} is the end of input
 * and has the type {@link TerminalSet#EOF}. The end of input token itself is not part of the sequence.
 */
public class TokenInput {

	private final List<Token> tokens;

	private final TerminalSet terminalSet;

	private TokenInput(TerminalSet terminalSet, List<Token> tokens) {
		this.terminalSet = terminalSet;
		this.tokens = Collections.unmodifiableList(tokens);
	}

	/**
	 * Creates an input from the passed tokens, a trailing end of input token is dropped.
	 *
	 * @throws LexerError if an end of input token occurs before the last token or if the tokens
	 *                    don't share one terminal set
	 */
	public static TokenInput of(TerminalSet terminalSet, List<Token> tokens){
		List<Token> list = new ArrayList<>(tokens.size());
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (token.isEOF()){
				if (i != tokens.size() - 1){
					throw new LexerError(String.format("End of input token at %s isn't the last token", token.location));
				}
				break;
			}
			if (!terminalSet.isValidType(token.type)){
				throw new LexerError(String.format("Token of type %d at %s (%s) has a type unknown to the terminal set",
						token.type, token.location, token.value));
			}
			list.add(token);
		}
		return new TokenInput(terminalSet, list);
	}

	/**
	 * Reads all tokens of the passed lexer till the end of input.
	 */
	public static TokenInput of(Lexer lexer){
		List<Token> tokens = new ArrayList<>();
		Token token = lexer.cur();
		while (!token.isEOF()){
			tokens.add(token);
			token = lexer.next();
		}
		return of(lexer.getTerminalSet(), tokens);
	}

	public int size(){
		return tokens.size();
	}

	public Token get(int position){
		return tokens.get(position);
	}

	public List<Token> getTokens(){
		return tokens;
	}

	public TerminalSet getTerminalSet() {
		return terminalSet;
	}

	/**
	 * Type of the token at the passed position, {@link TerminalSet#EOF} at and after the end of input.
	 */
	public int typeAt(int position){
		if (position >= tokens.size()){
			return TerminalSet.EOF;
		}
		return tokens.get(position).type;
	}

	/**
	 * Token at the passed position or null at the end of input
	 */
	public Token tokenAt(int position){
		return position < tokens.size() ? tokens.get(position) : null;
	}

	public Location locationAt(int position){
		if (position < tokens.size()){
			return tokens.get(position).location;
		}
		return tokens.isEmpty() ? new Location(1, 0) : tokens.get(tokens.size() - 1).location;
	}

	/**
	 * Do the tokens starting at the passed position match the passed sequence?
	 * An EOF terminal in the sequence only matches at the end of input.
	 */
	public boolean startsWith(int position, List<Terminal> sequence){
		for (int i = 0; i < sequence.size(); i++){
			if (typeAt(position + i) != sequence.get(i).id){
				return false;
			}
		}
		return true;
	}

	/**
	 * Do the tokens directly before the passed position match the passed sequence?
	 */
	public boolean endsWith(int position, List<Terminal> sequence){
		int start = position - sequence.size();
		if (start < 0){
			return false;
		}
		for (int i = 0; i < sequence.size(); i++){
			if (tokens.get(start + i).type != sequence.get(i).id){
				return false;
			}
		}
		return true;
	}

	/**
	 * Is the span [from, to) of tokens equal to the passed sequence?
	 */
	public boolean spanEquals(int from, int to, List<Terminal> sequence){
		return to - from == sequence.size() && to <= tokens.size() && startsWith(from, sequence);
	}

	/**
	 * Concatenated values of the tokens in [from, to)
	 */
	public String text(int from, int to){
		StringBuilder builder = new StringBuilder();
		for (int i = from; i < to && i < tokens.size(); i++){
			builder.append(tokens.get(i).value);
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < tokens.size(); i++) {
			if (i != 0){
				builder.append(" ");
			}
			builder.append(tokens.get(i).toSimpleString());
		}
		return builder.toString();
	}
}
