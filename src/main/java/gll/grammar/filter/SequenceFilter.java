package gll.grammar.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gll.grammar.Terminal;
import gll.lexer.TokenInput;
import gll.util.Utils;

/**
 * Filter that compares the input around a match with a set of terminal sequences.
 */
public abstract class SequenceFilter implements SymbolFilter {

	private final List<List<Terminal>> sequences;

	/**
	 * Reject on a matching sequence (true) or require one (false)?
	 */
	public final boolean negated;

	protected SequenceFilter(List<List<Terminal>> sequences, boolean negated) {
		List<List<Terminal>> copy = new ArrayList<>();
		for (List<Terminal> sequence : sequences){
			copy.add(Collections.unmodifiableList(new ArrayList<>(sequence)));
		}
		this.sequences = Collections.unmodifiableList(copy);
		this.negated = negated;
	}

	@Override
	public List<List<Terminal>> sequences() {
		return sequences;
	}

	@Override
	public boolean accepts(TokenInput input, int leftExtent, int rightExtent) {
		for (List<Terminal> sequence : sequences){
			if (matches(input, leftExtent, rightExtent, sequence)){
				return !negated;
			}
		}
		return negated;
	}

	/**
	 * Does the passed sequence occur in the input at the position this filter looks at?
	 */
	protected abstract boolean matches(TokenInput input, int leftExtent, int rightExtent, List<Terminal> sequence);

	protected abstract String name();

	/**
	 * Prepended to the name in {@link #toString()}
	 */
	protected String prefix(){
		return negated ? "not_" : "";
	}

	@Override
	public String toString() {
		List<String> strs = new ArrayList<>();
		for (List<Terminal> sequence : sequences){
			strs.add(Utils.join(sequence, " "));
		}
		return prefix() + name() + "[" + Utils.join(strs, ", ") + "]";
	}
}
