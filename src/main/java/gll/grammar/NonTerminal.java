package gll.grammar;

import java.io.Serializable;
import java.util.*;

/**
 * A non terminal symbol with associated productions (its alternatives).
 */
public class NonTerminal extends Symbol implements Serializable {

	/**
	 * Name of the non terminal, typically uppercase
	 */
	public final String name;

	public final int id;
	/**
	 * List of productions that have this non terminal on their left side, in the order of their
	 * alternative indexes.
	 */
	private final List<Production> productions = new ArrayList<>();

	public NonTerminal(int id, String name) {
		this.name = name;
		this.id = id;
	}

	public List<Production> getProductions(){
		return Collections.unmodifiableList(productions);
	}

	public boolean hasProductions(){
		return !productions.isEmpty();
	}

	@Override
	public String toString() {
		return name;
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof NonTerminal && ((NonTerminal) obj).id == id && ((NonTerminal) obj).name.equals(name);
	}

	void addProduction(Production production) {
		productions.add(production);
	}

	@Override
	protected int kindRank() {
		return 2;
	}

	@Override
	public int compareTo(Symbol o) {
		if (!(o instanceof NonTerminal)){
			return super.compareTo(o);
		}
		return name.compareTo(((NonTerminal)o).name);
	}
}
