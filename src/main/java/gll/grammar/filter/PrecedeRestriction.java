package gll.grammar.filter;

import java.util.Arrays;
import java.util.List;

import gll.grammar.Terminal;
import gll.lexer.TokenInput;

/**
 * Restricts the terminals that may directly precede a symbol. Checked before the symbol is
 * matched or called.
 */
public class PrecedeRestriction extends SequenceFilter {

	public PrecedeRestriction(List<List<Terminal>> sequences, boolean negated) {
		super(sequences, negated);
	}

	@SafeVarargs
	public static PrecedeRestriction notPrecededBy(List<Terminal>... sequences){
		return new PrecedeRestriction(Arrays.asList(sequences), true);
	}

	@SafeVarargs
	public static PrecedeRestriction precededBy(List<Terminal>... sequences){
		return new PrecedeRestriction(Arrays.asList(sequences), false);
	}

	@Override
	public Phase phase() {
		return Phase.BEFORE;
	}

	@Override
	protected boolean matches(TokenInput input, int leftExtent, int rightExtent, List<Terminal> sequence) {
		return input.endsWith(leftExtent, sequence);
	}

	@Override
	protected String name() {
		return "precede";
	}
}
