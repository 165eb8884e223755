package gll.grammar.filter;

import java.util.Arrays;
import java.util.List;

import gll.grammar.Terminal;
import gll.lexer.TokenInput;

/**
 * Restricts the terminals that may follow the match of a symbol.
 *
 * Checked with the extent of the match: for a terminal before its node is created, for a
 * non terminal when its result is returned to the caller.
 */
public class FollowRestriction extends SequenceFilter {

	public FollowRestriction(List<List<Terminal>> sequences, boolean negated) {
		super(sequences, negated);
	}

	/**
	 * The match must not be followed by one of the passed sequences
	 */
	@SafeVarargs
	public static FollowRestriction notFollowedBy(List<Terminal>... sequences){
		return new FollowRestriction(Arrays.asList(sequences), true);
	}

	/**
	 * The match must be followed by one of the passed sequences
	 */
	@SafeVarargs
	public static FollowRestriction followedBy(List<Terminal>... sequences){
		return new FollowRestriction(Arrays.asList(sequences), false);
	}

	@Override
	public Phase phase() {
		return Phase.AFTER;
	}

	@Override
	protected boolean matches(TokenInput input, int leftExtent, int rightExtent, List<Terminal> sequence) {
		return input.startsWith(rightExtent, sequence);
	}

	@Override
	protected String name() {
		return "follow";
	}
}
