package gll.grammar;

import java.io.Serializable;
import java.util.*;

import gll.grammar.filter.SymbolFilter;
import gll.lexer.TerminalSet;

import static gll.util.Utils.join;

/**
 * A context free grammar together with its grammar slots and the filters attached to them.
 *
 * The grammar is immutable after construction and can be shared between parsers and threads.
 * The constructor interns the slots and computes the nullable non terminals, the FIRST(1) and
 * FOLLOW(1) sets and the lookahead set of every slot. Malformed grammars can be constructed,
 * {@link #validate(NonTerminal)} lists their problems.
 */
public class Grammar implements Serializable {

	/**
	 * A filter attached to the slot in front of the symbol at a position of an alternative
	 */
	public static class Placement implements Serializable {
		public final Production production;
		public final int position;
		public final SymbolFilter filter;

		public Placement(Production production, int position, SymbolFilter filter) {
			this.production = production;
			this.position = position;
			this.filter = filter;
		}

		@Override
		public String toString() {
			return String.format("%s at position %d of %s", filter, position, production);
		}
	}

	private final TerminalSet alphabet;

	private final List<NonTerminal> nonTerminals;

	private final List<Production> productions;

	private final NonTerminal start;

	/**
	 * The end of input terminal
	 */
	public final Terminal eof;

	private final Map<Production, List<GrammarSlot>> slots = new HashMap<>();

	private final List<GrammarSlot> slotList = new ArrayList<>();

	private final List<Placement> placements;

	private final List<String> placementProblems = new ArrayList<>();

	private final Set<NonTerminal> epsilonableNonTerminals;

	private final Map<NonTerminal, Set<TerminalOrEpsilon>> first1Sets;

	private final Map<NonTerminal, Set<Terminal>> follow1Sets;

	/**
	 * Create a new Grammar object
	 *
	 * @param alphabet base alphabet
	 * @param nonTerminals all non terminals, including the ones referenced but not defined
	 * @param start default start non terminal
	 * @param productions all productions, each one is registered with its non terminal
	 * @param filters filters attached to positions of productions
	 */
	public Grammar(TerminalSet alphabet, List<NonTerminal> nonTerminals, NonTerminal start,
	               List<Production> productions, List<Placement> filters) {
		this.alphabet = alphabet;
		this.nonTerminals = Collections.unmodifiableList(new ArrayList<>(nonTerminals));
		this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
		this.start = start;
		this.eof = new Terminal(TerminalSet.EOF, alphabet);
		this.placements = Collections.unmodifiableList(new ArrayList<>(filters));
		this.epsilonableNonTerminals = Collections.unmodifiableSet(calculateEpsilonable());
		this.first1Sets = calculateFirst1Set();
		this.follow1Sets = calculateFollow1Set();
		createSlots();
		attachFilters();
	}

	public Grammar(TerminalSet alphabet, List<NonTerminal> nonTerminals, NonTerminal start,
	               List<Production> productions) {
		this(alphabet, nonTerminals, start, productions, Collections.emptyList());
	}

	private void createSlots(){
		for (Production production : productions){
			List<GrammarSlot> prodSlots = new ArrayList<>();
			for (int i = 0; i <= production.rightSize(); i++){
				GrammarSlot slot = new GrammarSlot(slotList.size(), production, i);
				if (i > 0){
					GrammarSlot previous = prodSlots.get(i - 1);
					previous.next = slot;
					slot.previous = previous;
				}
				List<Symbol> suffix = production.right.subList(i, production.rightSize());
				Set<Integer> lookahead = new HashSet<>();
				for (TerminalOrEpsilon toe : calculateFirst1SetForTerm(suffix)){
					if (toe instanceof Terminal){
						lookahead.add(((Terminal) toe).id);
					}
				}
				slot.suffixNullable = isTermEpsilonable(suffix);
				if (slot.suffixNullable){
					for (Terminal terminal : follow1Sets.get(production.left)){
						lookahead.add(terminal.id);
					}
				}
				slot.lookahead = Collections.unmodifiableSet(lookahead);
				slot.previousSymbolNullable = i > 0 && isTermEpsilonable(production.right.subList(i - 1, i));
				prodSlots.add(slot);
				slotList.add(slot);
			}
			slots.put(production, Collections.unmodifiableList(prodSlots));
		}
	}

	private void attachFilters(){
		for (Placement placement : placements){
			List<GrammarSlot> prodSlots = slots.get(placement.production);
			if (prodSlots == null){
				placementProblems.add(String.format("Filter %s is attached to a production not in the grammar", placement));
				continue;
			}
			if (placement.position < 0 || placement.position >= prodSlots.size()){
				placementProblems.add(String.format("Filter %s is attached to a position out of range", placement));
				continue;
			}
			GrammarSlot slot = prodSlots.get(placement.position);
			if (slot.isEnd()){
				placementProblems.add(String.format("Filter %s is attached to the end slot %s", placement, slot));
				continue;
			}
			List<String> sequenceProblems = checkSequences(placement);
			if (!sequenceProblems.isEmpty()){
				placementProblems.addAll(sequenceProblems);
				continue;
			}
			slot.addFilter(placement.filter);
		}
	}

	private List<String> checkSequences(Placement placement){
		List<String> problems = new ArrayList<>();
		if (placement.filter.sequences().isEmpty()){
			problems.add(String.format("Filter %s has no terminal sequences", placement));
		}
		for (List<Terminal> sequence : placement.filter.sequences()){
			if (sequence.isEmpty()){
				problems.add(String.format("Filter %s contains an empty terminal sequence", placement));
			}
			for (Terminal terminal : sequence){
				if (!alphabet.isValidType(terminal.id)){
					problems.add(String.format("Filter %s references the unknown terminal %d", placement, terminal.id));
				}
			}
		}
		return problems;
	}

	/**
	 * Problems that prevent parsing from the default start non terminal, empty if there are none
	 */
	public List<String> validate(){
		return validate(start);
	}

	/**
	 * Problems that prevent parsing from the passed start non terminal, empty if there are none
	 */
	public List<String> validate(NonTerminal start){
		List<String> problems = new ArrayList<>();
		if (start == null){
			problems.add("No start non terminal");
		} else if (!contains(start)){
			problems.add(String.format("Unknown start non terminal %s", start));
		}
		for (NonTerminal nonTerminal : nonTerminals){
			if (!nonTerminal.hasProductions()){
				problems.add(String.format("Non terminal %s has no alternatives", nonTerminal));
			}
		}
		for (Production production : productions){
			for (Terminal terminal : production.terminals){
				if (terminal.isEOF()){
					problems.add(String.format("Production %s contains the end of input terminal", production));
				} else if (!alphabet.isValidType(terminal.id)){
					problems.add(String.format("Production %s contains the unknown terminal %d", production, terminal.id));
				}
			}
			for (NonTerminal nonTerminal : production.nonTerminals){
				if (!contains(nonTerminal)){
					problems.add(String.format("Production %s references the non terminal %s that isn't part of the grammar",
							production, nonTerminal));
				}
			}
		}
		problems.addAll(placementProblems);
		return problems;
	}

	/**
	 * @throws GrammarContractViolation if the grammar has problems
	 */
	public void checkContract(NonTerminal start){
		List<String> problems = validate(start);
		if (!problems.isEmpty()){
			throw new GrammarContractViolation(problems);
		}
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 */
	private Set<NonTerminal> calculateEpsilonable(){
		Set<NonTerminal> epsSet = new HashSet<>();
		Set<Production> currentProds = new HashSet<>(productions);
		for (Production prod : productions) {
			if (prod.isEpsilonProduction()){
				epsSet.add(prod.left);
				currentProds.remove(prod);
			}
		}
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : currentProds) {
				if (prod.terminals.isEmpty()){
					int i = 0;
					for (; i < prod.right.size(); i++) {
						Symbol sym = prod.right.get(i);
						if (sym instanceof NonTerminal && !epsSet.contains(sym)) {
							break;
						}
					}
					if (i == prod.right.size()){
						somethingChanged = epsSet.add(prod.left) || somethingChanged;
					}
				}
			}
		} while (somethingChanged);
		return epsSet;
	}

	/**
	 * Leading symbols of each non terminal, closed over the leading non terminals
	 * (similar to the algorithm presented in the Dragon Book). Non terminals are removed at the end.
	 */
	private Map<NonTerminal, Set<TerminalOrEpsilon>> calculateFirst1Set(){
		Map<NonTerminal, Set<Symbol>> first = new HashMap<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			Set<Symbol> leadingSymbols = new HashSet<>();
			for (Production production : nonTerminal.getProductions()){
				for (int i = 0; i < production.right.size(); i++){
					Symbol sym = production.right.get(i);
					leadingSymbols.add(sym);
					if (!epsilonableNonTerminals.contains(sym)){
						break;
					}
				}
			}
			first.put(nonTerminal, leadingSymbols);
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (NonTerminal nonTerminal : nonTerminals){
				Set<Symbol> oldSet = first.get(nonTerminal);
				Set<Symbol> newSet = new HashSet<>(oldSet);
				for (Symbol symbol : oldSet){
					if (symbol instanceof NonTerminal && first.containsKey(symbol)) {
						newSet.addAll(first.get(symbol));
					}
				}
				if (oldSet.size() != newSet.size()){
					firstChanged = true;
				}
				oldSet.addAll(newSet);
			}
		} while (firstChanged);
		Map<NonTerminal, Set<TerminalOrEpsilon>> firstSets = new HashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			Set<TerminalOrEpsilon> firstSet = new HashSet<>();
			for (Symbol symbol : first.get(nonTerminal)){
				if (symbol.isEpsOrTerminal()) {
					firstSet.add((TerminalOrEpsilon) symbol);
				}
			}
			if (epsilonableNonTerminals.contains(nonTerminal)){
				firstSet.add(Epsilon.INSTANCE);
			}
			firstSets.put(nonTerminal, Collections.unmodifiableSet(firstSet));
		}
		return firstSets;
	}

	/**
	 * FIRST(1) set of a sequence of symbols, contains epsilon if the sequence is nullable
	 */
	public Set<TerminalOrEpsilon> calculateFirst1SetForTerm(List<Symbol> term){
		Set<TerminalOrEpsilon> set = new HashSet<>();
		for (Symbol symbol : term){
			if (symbol instanceof NonTerminal){
				for (TerminalOrEpsilon toe : first1Sets.getOrDefault(symbol, Collections.emptySet())){
					if (toe instanceof Terminal){
						set.add(toe);
					}
				}
				if (!epsilonableNonTerminals.contains(symbol)){
					return set;
				}
			} else if (symbol instanceof Terminal) {
				set.add((Terminal)symbol);
				return set;
			}
		}
		set.add(Epsilon.INSTANCE);
		return set;
	}

	private boolean isTermEpsilonable(List<Symbol> term){
		for (Symbol symbol : term){
			if (symbol instanceof NonTerminal){
				if (!epsilonableNonTerminals.contains(symbol)){
					return false;
				}
			} else if (symbol instanceof Terminal){
				return false;
			}
		}
		return true;
	}

	/**
	 * Calculate the follow 1 set for all non terminals
	 *
	 * Every non terminal can be used as the start of a parse, therefore the end of input marker is
	 * placed in the follow set of every non terminal.
	 * If there is a production A → aBb then everything in FIRST(b) except for ε is placed in FOLLOW(B).
	 * If there is a production A → aB or A → aBb with a nullable b, then everything in FOLLOW(A) is in FOLLOW(B)
	 */
	private Map<NonTerminal, Set<Terminal>> calculateFollow1Set(){
		Map<NonTerminal, Set<Terminal>> follow = new HashMap<>();
		for (NonTerminal nonTerminal : nonTerminals){
			Set<Terminal> set = new HashSet<>();
			set.add(eof);
			follow.put(nonTerminal, set);
		}
		boolean followChanged;
		do {
			followChanged = false;
			for (Production production : productions){
				Set<Terminal> lastFollow = new HashSet<>(follow.getOrDefault(production.left, Collections.emptySet()));
				for (int i = production.right.size() - 1; i >= 0; i--){
					Symbol symbol = production.right.get(i);
					if (symbol instanceof NonTerminal){
						NonTerminal rightPart = (NonTerminal)symbol;
						if (follow.containsKey(rightPart) && follow.get(rightPart).addAll(lastFollow)){
							followChanged = true;
						}
						if (!epsilonableNonTerminals.contains(rightPart)){
							lastFollow.clear();
						}
						for (TerminalOrEpsilon toe : first1Sets.getOrDefault(rightPart, Collections.emptySet())){
							if (toe instanceof Terminal){
								lastFollow.add((Terminal) toe);
							}
						}
					} else {  // terminal
						lastFollow.clear();
						lastFollow.add((Terminal) symbol);
					}
				}
			}
		} while (followChanged);
		Map<NonTerminal, Set<Terminal>> followSets = new HashMap<>();
		for (Map.Entry<NonTerminal, Set<Terminal>> entry : follow.entrySet()){
			followSets.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
		}
		return followSets;
	}

	public Set<NonTerminal> getEpsilonable(){
		return epsilonableNonTerminals;
	}

	public boolean isNullable(NonTerminal nonTerminal){
		return epsilonableNonTerminals.contains(nonTerminal);
	}

	public Set<TerminalOrEpsilon> first1(NonTerminal nonTerminal){
		return first1Sets.get(nonTerminal);
	}

	public Set<Terminal> follow1(NonTerminal nonTerminal){
		return follow1Sets.get(nonTerminal);
	}

	/**
	 * Interned slot of the passed production
	 *
	 * @param position number of symbols in front of the dot
	 */
	public GrammarSlot slot(Production production, int position){
		List<GrammarSlot> prodSlots = slots.get(production);
		if (prodSlots == null){
			throw new NoSuchElementException(String.format("No production %s in this grammar", production));
		}
		if (position < 0 || position >= prodSlots.size()){
			throw new NoSuchElementException(String.format("No slot at position %d of %s", position, production));
		}
		return prodSlots.get(position);
	}

	public GrammarSlot firstSlot(Production production){
		return slot(production, 0);
	}

	public GrammarSlot endSlot(Production production){
		return slot(production, production.rightSize());
	}

	/**
	 * All slots ordered by id
	 */
	public List<GrammarSlot> getSlots(){
		return Collections.unmodifiableList(slotList);
	}

	public NonTerminal getStart(){
		return start;
	}

	/**
	 * @return the non terminal with the passed name or null if there is none
	 */
	public NonTerminal getNonTerminal(String name){
		for (NonTerminal nonTerminal : nonTerminals){
			if (Objects.equals(nonTerminal.name, name)){
				return nonTerminal;
			}
		}
		return null;
	}

	public boolean contains(NonTerminal nonTerminal){
		return nonTerminals.contains(nonTerminal);
	}

	public List<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public List<Placement> getPlacements(){
		return placements;
	}

	public TerminalSet getTerminalSet(){
		return alphabet;
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Productions: \n" + join(productions, "\n") + "\n" +
				"Filters: \n" + join(placements, "\n");
	}

	@Override
	public String toString() {
		return join(productions, "\n");
	}
}
