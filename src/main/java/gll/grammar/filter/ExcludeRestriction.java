package gll.grammar.filter;

import java.util.Arrays;
import java.util.List;

import gll.grammar.Terminal;
import gll.lexer.TokenInput;

/**
 * Forbids a symbol to match exactly one of the passed terminal sequences, e.g. keywords
 * that are no identifiers.
 */
public class ExcludeRestriction extends SequenceFilter {

	public ExcludeRestriction(List<List<Terminal>> sequences) {
		super(sequences, true);
	}

	@SafeVarargs
	public static ExcludeRestriction excluding(List<Terminal>... sequences){
		return new ExcludeRestriction(Arrays.asList(sequences));
	}

	@Override
	public Phase phase() {
		return Phase.AFTER;
	}

	@Override
	protected boolean matches(TokenInput input, int leftExtent, int rightExtent, List<Terminal> sequence) {
		return input.spanEquals(leftExtent, rightExtent, sequence);
	}

	@Override
	protected String name() {
		return "exclude";
	}

	@Override
	protected String prefix() {
		return "";
	}
}
