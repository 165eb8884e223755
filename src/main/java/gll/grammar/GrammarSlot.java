package gll.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import gll.grammar.filter.SymbolFilter;

/**
 * A position inside an alternative, written {@code A → α · β}.
 *
 * Slots are created and interned by their {@link Grammar}, there is exactly one object per
 * (alternative, position) pair. Equality is therefore identity.
 */
public class GrammarSlot implements Serializable {

	/**
	 * Id of the slot, unique in its grammar
	 */
	public final int id;

	public final Production production;

	/**
	 * Number of symbols in front of the dot
	 */
	public final int position;

	public final SlotKind kind;

	GrammarSlot next;

	GrammarSlot previous;

	final List<SymbolFilter> beforeFilters = new ArrayList<>();

	final List<SymbolFilter> afterFilters = new ArrayList<>();

	Set<Integer> lookahead = Collections.emptySet();

	boolean suffixNullable;

	boolean previousSymbolNullable;

	GrammarSlot(int id, Production production, int position) {
		this.id = id;
		this.production = production;
		this.position = position;
		if (position == production.rightSize()){
			kind = SlotKind.END;
		} else if (production.right.get(position) instanceof NonTerminal){
			kind = SlotKind.NONTERMINAL;
		} else {
			kind = SlotKind.TERMINAL;
		}
	}

	public NonTerminal nonTerminal(){
		return production.left;
	}

	public int alternative(){
		return production.alternative;
	}

	/**
	 * Symbol after the dot, null for end slots
	 */
	public Symbol nextSymbol(){
		return isEnd() ? null : production.right.get(position);
	}

	/**
	 * Symbol in front of the dot, null for the first slot of an alternative
	 */
	public Symbol previousSymbol(){
		return position == 0 ? null : production.right.get(position - 1);
	}

	/**
	 * Slot after the next symbol, null for end slots
	 */
	public GrammarSlot next(){
		return next;
	}

	/**
	 * Slot in front of the previous symbol, null for the first slot
	 */
	public GrammarSlot previous(){
		return previous;
	}

	public boolean isEnd(){
		return kind == SlotKind.END;
	}

	/**
	 * Is the forest node for the prefix in front of the dot the node of its single symbol?
	 *
	 * This holds directly after the first symbol if it is a terminal or a non nullable non terminal,
	 * no intermediate node is created for such prefixes.
	 */
	public boolean sharesFirstNode(){
		return position == 1 && !previousSymbolNullable;
	}

	/**
	 * Filters of the symbol after the dot that are checked in the passed phase
	 */
	public List<SymbolFilter> filters(SymbolFilter.Phase phase){
		return Collections.unmodifiableList(phase == SymbolFilter.Phase.BEFORE ? beforeFilters : afterFilters);
	}

	void addFilter(SymbolFilter filter){
		if (filter.phase() == SymbolFilter.Phase.BEFORE){
			beforeFilters.add(filter);
		} else {
			afterFilters.add(filter);
		}
	}

	public boolean hasFilters(){
		return !beforeFilters.isEmpty() || !afterFilters.isEmpty();
	}

	/**
	 * Terminal types that can start the rest of the alternative, including the types that can
	 * follow the non terminal if the rest is nullable
	 */
	public Set<Integer> lookahead(){
		return lookahead;
	}

	public boolean lookaheadAccepts(int type){
		return lookahead.contains(type);
	}

	/**
	 * Can the symbols after the dot derive the empty word?
	 */
	public boolean isSuffixNullable(){
		return suffixNullable;
	}

	/**
	 * Formats the slot as an item, like {@code E → E · <+> <num>}
	 */
	public String formatItem(){
		StringBuilder builder = new StringBuilder();
		builder.append(production.left).append(" →");
		for (int i = 0; i <= production.rightSize(); i++){
			if (i == position){
				builder.append(" ·");
			}
			if (i < production.rightSize()){
				builder.append(" ").append(production.right.get(i));
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return production.left + "." + production.alternative + "@" + position;
	}
}
