package gll.grammar;

import java.util.*;

import gll.GLLException;
import gll.grammar.filter.ExcludeRestriction;
import gll.grammar.filter.FollowRestriction;
import gll.grammar.filter.PrecedeRestriction;
import gll.grammar.filter.SymbolFilter;
import gll.lexer.TerminalSet;

/**
 * Allows the simple creation of grammars.
 *
 * In this class integers and characters are treated as terminals (their ids) and strings as names.
 * A name is a non terminal if a production defines it, otherwise it is a terminal if the terminal
 * set knows it and else an undefined non terminal (reported by {@link Grammar#validate()}).
 * Names are resolved in {@link #toGrammar(String)}, so productions can be added in any order.
 *
 * Filters are attached to the symbol at a position of an alternative, alternatives are counted
 * per non terminal in the order they are added, starting at zero:
 * <pre>
 *     new GrammarBuilder(alphabet)
 *          .add("S", 'a', "S")
 *          .add("S", 'b')
 *          .notFollow("S", 0, 0, 'b')   // the 'a' of the first alternative must not be followed by 'b'
 *          .toGrammar("S");
 * </pre>
 */
public class GrammarBuilder {

	private enum FilterKind {
		NOT_FOLLOW, FOLLOW, NOT_PRECEDE, PRECEDE, EXCLUDE
	}

	private static class FilterDefinition {
		final FilterKind kind;
		final String nonTerminal;
		final int alternative;
		final int position;
		final Object[] sequences;

		FilterDefinition(FilterKind kind, String nonTerminal, int alternative, int position, Object[] sequences) {
			this.kind = kind;
			this.nonTerminal = nonTerminal;
			this.alternative = alternative;
			this.position = position;
			this.sequences = sequences;
		}
	}

	private final List<Object[]> productions = new ArrayList<>();
	private final List<FilterDefinition> filters = new ArrayList<>();
	public final TerminalSet alphabet;

	public GrammarBuilder(TerminalSet alphabet) {
		this.alphabet = alphabet;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are
	 *  - strings: names of non terminals or terminals
	 *  - integers and characters: ids of terminals
	 *  - "": equivalent to ε
	 *  - arrays of the above: inserted flat
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 */
	public GrammarBuilder add(String left, Object... right){
		if (left == null || left.isEmpty()){
			throw new GLLException("A non terminal needs a non empty name");
		}
		Object[] flat = flatten(right);
		Object[] prod = new Object[flat.length + 1];
		prod[0] = left;
		System.arraycopy(flat, 0, prod, 1, flat.length);
		productions.add(prod);
		return this;
	}

	/**
	 * Characters of the passed string, to be used as terminals of an alphabet
	 */
	public Object[] string(String str){
		Object[] arr = new Object[str.length()];
		char[] chars = str.toCharArray();
		for (int i = 0; i < chars.length; i++){
			arr[i] = chars[i];
		}
		return arr;
	}

	/**
	 * The symbol must not be followed by one of the sequences.
	 *
	 * @param sequences each one a terminal or an array of terminals
	 */
	public GrammarBuilder notFollow(String nonTerminal, int alternative, int position, Object... sequences){
		return filter(FilterKind.NOT_FOLLOW, nonTerminal, alternative, position, sequences);
	}

	/**
	 * The symbol must be followed by one of the sequences.
	 */
	public GrammarBuilder follow(String nonTerminal, int alternative, int position, Object... sequences){
		return filter(FilterKind.FOLLOW, nonTerminal, alternative, position, sequences);
	}

	/**
	 * The symbol must not be preceded by one of the sequences.
	 */
	public GrammarBuilder notPrecede(String nonTerminal, int alternative, int position, Object... sequences){
		return filter(FilterKind.NOT_PRECEDE, nonTerminal, alternative, position, sequences);
	}

	/**
	 * The symbol must be preceded by one of the sequences.
	 */
	public GrammarBuilder precede(String nonTerminal, int alternative, int position, Object... sequences){
		return filter(FilterKind.PRECEDE, nonTerminal, alternative, position, sequences);
	}

	/**
	 * The symbol must not match exactly one of the sequences.
	 */
	public GrammarBuilder exclude(String nonTerminal, int alternative, int position, Object... sequences){
		return filter(FilterKind.EXCLUDE, nonTerminal, alternative, position, sequences);
	}

	private GrammarBuilder filter(FilterKind kind, String nonTerminal, int alternative, int position, Object[] sequences){
		filters.add(new FilterDefinition(kind, nonTerminal, alternative, position, sequences));
		return this;
	}

	private Object[] flatten(Object[] arr){
		return flattenToList(arr).toArray();
	}

	private ArrayList<Object> flattenToList(Object[] arr){
		ArrayList<Object> ret = new ArrayList<>();
		for (Object sub : arr){
			if (sub instanceof Integer || sub instanceof String || sub instanceof Character){
				ret.add(sub);
			} else if (sub instanceof Object[]) {
				ret.addAll(flattenToList((Object[])sub));
			} else {
				throw new GLLException(String.format("Right part of production object list has unsupported type: %s", sub));
			}
		}
		return ret;
	}

	/**
	 * Creates the grammar.
	 *
	 * @param startNonTerminal name of the default start non terminal
	 * @throws GrammarContractViolation if a filter refers to an unknown alternative or terminal
	 */
	public Grammar toGrammar(String startNonTerminal) {
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		Map<Integer, Terminal> terminals = new HashMap<>();
		for (Object[] prod : this.productions) {
			String name = (String)prod[0];
			if (!nonTerminals.containsKey(name)){
				nonTerminals.put(name, new NonTerminal(nonTerminals.size(), name));
			}
		}
		List<Production> productions = new ArrayList<>();
		for (Object[] prod : this.productions) {
			NonTerminal left = nonTerminals.get(prod[0]);
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++) {
				Object obj = prod[i];
				if ("".equals(obj)) {
					right.add(Epsilon.INSTANCE);
				} else if (obj instanceof String && !nonTerminals.containsKey(obj) && alphabet.isValidTypeName((String)obj)){
					right.add(terminal(terminals, alphabet.stringToType((String)obj)));
				} else if (obj instanceof String){
					String name = (String)obj;
					if (!nonTerminals.containsKey(name)){
						nonTerminals.put(name, new NonTerminal(nonTerminals.size(), name));
					}
					right.add(nonTerminals.get(name));
				} else {
					right.add(terminal(terminals, toId(obj)));
				}
			}
			productions.add(new Production(productions.size(), left, right));
		}
		NonTerminal start = nonTerminals.get(startNonTerminal);
		if (start == null){
			start = new NonTerminal(-1, startNonTerminal);
		}
		List<String> problems = new ArrayList<>();
		List<Grammar.Placement> placements = new ArrayList<>();
		for (FilterDefinition definition : filters){
			NonTerminal nonTerminal = nonTerminals.get(definition.nonTerminal);
			if (nonTerminal == null || definition.alternative < 0
					|| definition.alternative >= nonTerminal.getProductions().size()){
				problems.add(String.format("No alternative %d of non terminal %s to attach a filter to",
						definition.alternative, definition.nonTerminal));
				continue;
			}
			List<List<Terminal>> sequences = new ArrayList<>();
			for (Object sequence : definition.sequences){
				List<Terminal> terms = new ArrayList<>();
				for (Object obj : sequence instanceof Object[] ? flatten((Object[])sequence) : new Object[]{sequence}){
					if (obj instanceof String){
						if (!alphabet.isValidTypeName((String)obj)){
							problems.add(String.format("Unknown terminal %s in the filter of %s", obj, definition.nonTerminal));
							continue;
						}
						terms.add(terminal(terminals, alphabet.stringToType((String)obj)));
					} else {
						terms.add(terminal(terminals, toId(obj)));
					}
				}
				sequences.add(terms);
			}
			Production production = nonTerminal.getProductions().get(definition.alternative);
			placements.add(new Grammar.Placement(production, definition.position, createFilter(definition.kind, sequences)));
		}
		if (!problems.isEmpty()){
			throw new GrammarContractViolation(problems);
		}
		return new Grammar(alphabet, new ArrayList<>(nonTerminals.values()), start, productions, placements);
	}

	private SymbolFilter createFilter(FilterKind kind, List<List<Terminal>> sequences){
		switch (kind){
			case NOT_FOLLOW:
				return new FollowRestriction(sequences, true);
			case FOLLOW:
				return new FollowRestriction(sequences, false);
			case NOT_PRECEDE:
				return new PrecedeRestriction(sequences, true);
			case PRECEDE:
				return new PrecedeRestriction(sequences, false);
			default:
				return new ExcludeRestriction(sequences);
		}
	}

	private Terminal terminal(Map<Integer, Terminal> terminals, int id){
		return terminals.computeIfAbsent(id, i -> new Terminal(i, alphabet));
	}

	private int toId(Object obj){
		if (obj instanceof Character){
			return (int)((char)obj);
		}
		return (int)obj;
	}
}
