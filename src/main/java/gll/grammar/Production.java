package gll.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar production with a left and a right hand side, one alternative of its non terminal.
 */
public class Production implements Serializable {

	/**
	 * Id of the production, unique in its grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Index of this production among the productions of its non terminal
	 */
	public final int alternative;
	/**
	 * Right hand side of the production without epsilons, empty for epsilon productions
	 */
	public final List<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	/**
	 * Creates a production and registers it as the next alternative of its non terminal.
	 */
	public Production(int id, NonTerminal left, List<? extends Symbol> right) {
		this.id = id;
		this.left = left;
		this.alternative = left.getProductions().size();
		List<Symbol> r = new ArrayList<>();
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : right){
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			}
			if (!(symbol instanceof Epsilon)){
				r.add(symbol);
			}
		}
		this.right = Collections.unmodifiableList(r);
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
		left.addProduction(this);
	}

	public String formatRightSide(){
		if (right.isEmpty()){
			return Epsilon.INSTANCE.toString();
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return id + " " + left.toString() + " → " + formatRightSide();
	}

	/**
	 * Does this production only consist of epsilon?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).id == id && ((Production) obj).left.equals(left);
	}

	@Override
	public int hashCode() {
		return id;
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}
}
