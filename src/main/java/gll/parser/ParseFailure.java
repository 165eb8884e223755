package gll.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import gll.grammar.GrammarSlot;
import gll.lexer.Location;
import gll.lexer.TerminalSet;
import gll.lexer.Token;

/**
 * Description of a failed parse: the furthest position the parser reached and what it expected there.
 */
public class ParseFailure {

	/**
	 * Furthest input position processed
	 */
	public final int position;

	/**
	 * Token at the position, null at the end of the input
	 */
	public final Token token;

	public final Location location;

	/**
	 * Slots that could not continue at the position, in the order they were tried
	 */
	public final List<GrammarSlot> expectedSlots;

	/**
	 * Terminal types that would have allowed one of the slots to continue
	 */
	public final Set<Integer> expectedTerminals;

	private final TerminalSet terminalSet;

	public ParseFailure(int position, Token token, Location location, List<GrammarSlot> expectedSlots,
	                    Set<Integer> expectedTerminals, TerminalSet terminalSet) {
		this.position = position;
		this.token = token;
		this.location = location;
		this.expectedSlots = Collections.unmodifiableList(new ArrayList<>(expectedSlots));
		this.expectedTerminals = Collections.unmodifiableSet(new TreeSet<>(expectedTerminals));
		this.terminalSet = terminalSet;
	}

	public String getMessage(){
		String found = token == null ? "end of input" : token.toSimpleString();
		if (expectedTerminals.isEmpty()){
			return String.format("Unexpected %s at position %d", found, position);
		}
		return String.format("Unexpected %s at position %d, expected one of %s", found, position,
				terminalSet.typesToString(expectedTerminals));
	}

	public ParserError toError(){
		return new ParserError(token, location, getMessage());
	}

	@Override
	public String toString() {
		return getMessage();
	}
}
