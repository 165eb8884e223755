package gll.grammar;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import gll.GLLException;
import gll.grammar.filter.FollowRestriction;
import gll.grammar.filter.SymbolFilter;
import gll.lexer.AlphabetTerminals;
import gll.lexer.StringTerminals;
import gll.lexer.TerminalSet;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	private final StringTerminals terminals = StringTerminals.of("+", "num");

	private Terminal terminal(String name){
		return new Terminal(terminals.stringToType(name), terminals);
	}

	/**
	 * E → T R; R → + T R | ε; T → num
	 */
	private Grammar expressions(){
		return new GrammarBuilder(terminals)
				.add("E", "T", "R")
				.add("R", "+", "T", "R")
				.add("R", "")
				.add("T", "num").toGrammar("E");
	}

	@Nested
	public class Sets {

		@Test
		public void testNullable(){
			Grammar grammar = expressions();
			assertTrue(grammar.isNullable(grammar.getNonTerminal("R")));
			assertFalse(grammar.isNullable(grammar.getNonTerminal("E")));
			assertFalse(grammar.isNullable(grammar.getNonTerminal("T")));
		}

		@Test
		public void testIndirectlyNullable(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", "A", "B")
					.add("A", "")
					.add("B", "A").toGrammar("S");
			assertEquals(new HashSet<>(grammar.getNonTerminals()), grammar.getEpsilonable());
		}

		@Test
		public void testFirst(){
			Grammar grammar = expressions();
			assertEquals(new HashSet<>(Arrays.asList(terminal("num"))), grammar.first1(grammar.getNonTerminal("E")));
			assertEquals(new HashSet<>(Arrays.asList(terminal("+"), Epsilon.INSTANCE)), grammar.first1(grammar.getNonTerminal("R")));
		}

		@Test
		public void testFollow(){
			Grammar grammar = expressions();
			assertEquals(new HashSet<>(Arrays.asList(terminal("+"), grammar.eof)), grammar.follow1(grammar.getNonTerminal("T")));
			assertEquals(new HashSet<>(Arrays.asList(grammar.eof)), grammar.follow1(grammar.getNonTerminal("R")));
		}

		@Test
		public void testFirstOfTerm(){
			Grammar grammar = expressions();
			NonTerminal r = grammar.getNonTerminal("R");
			NonTerminal t = grammar.getNonTerminal("T");
			assertEquals(new HashSet<>(Arrays.asList(terminal("+"), terminal("num"))),
					grammar.calculateFirst1SetForTerm(Arrays.asList(r, t)));
			assertTrue(grammar.calculateFirst1SetForTerm(Arrays.asList(r, r)).contains(Epsilon.INSTANCE));
		}
	}

	@Nested
	public class Slots {

		@Test
		public void testSlotsOfProduction(){
			Grammar grammar = new GrammarBuilder(terminals).add("E", "E", "+", "num").add("E", "num").toGrammar("E");
			Production production = grammar.getProductions().get(0);
			List<SlotKind> kinds = Arrays.asList(SlotKind.NONTERMINAL, SlotKind.TERMINAL, SlotKind.TERMINAL, SlotKind.END);
			for (int i = 0; i < kinds.size(); i++){
				assertEquals(kinds.get(i), grammar.slot(production, i).kind);
			}
			assertSame(grammar.slot(production, 0), grammar.firstSlot(production));
			assertSame(grammar.slot(production, 3), grammar.endSlot(production));
			assertSame(grammar.slot(production, 2), grammar.slot(production, 1).next());
			assertSame(grammar.slot(production, 1), grammar.slot(production, 2).previous());
			assertNull(grammar.firstSlot(production).previous());
			assertNull(grammar.endSlot(production).next());
			assertEquals(6, grammar.getSlots().size());
			assertThrows(java.util.NoSuchElementException.class, () -> grammar.slot(production, 4));
		}

		@Test
		public void testFormat(){
			Grammar grammar = new GrammarBuilder(terminals).add("E", "E", "+", "num").toGrammar("E");
			GrammarSlot slot = grammar.slot(grammar.getProductions().get(0), 1);
			assertEquals("E → E · <+> <num>", slot.formatItem());
			assertEquals("E.0@1", slot.toString());
		}

		@Test
		public void testSharesFirstNode(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", "A", 'b')
					.add("S", 'a', 'b')
					.add("A", "")
					.add("A", 'a').toGrammar("S");
			List<Production> productions = grammar.getProductions();
			assertFalse(grammar.slot(productions.get(0), 1).sharesFirstNode());
			assertTrue(grammar.slot(productions.get(1), 1).sharesFirstNode());
			assertFalse(grammar.slot(productions.get(1), 2).sharesFirstNode());
		}

		@Test
		public void testLookahead(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", "A", 'b')
					.add("A", "")
					.add("A", 'a').toGrammar("S");
			List<Production> productions = grammar.getProductions();
			assertEquals(new HashSet<>(Arrays.asList((int)'a', (int)'b')), grammar.firstSlot(productions.get(0)).lookahead());
			GrammarSlot epsilon = grammar.firstSlot(productions.get(1));
			assertTrue(epsilon.isEnd());
			assertTrue(epsilon.isSuffixNullable());
			assertEquals(new HashSet<>(Arrays.asList((int)'b', TerminalSet.EOF)), epsilon.lookahead());
			assertTrue(grammar.firstSlot(productions.get(2)).lookaheadAccepts('a'));
			assertFalse(grammar.firstSlot(productions.get(2)).lookaheadAccepts('b'));
		}

		@Test
		public void testFiltersAreAttached(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", 'a', "S")
					.add("S", 'b')
					.notFollow("S", 0, 0, 'b')
					.notPrecede("S", 0, 1, 'c').toGrammar("S");
			Production production = grammar.getProductions().get(0);
			GrammarSlot first = grammar.firstSlot(production);
			assertEquals(1, first.filters(SymbolFilter.Phase.AFTER).size());
			assertTrue(first.filters(SymbolFilter.Phase.BEFORE).isEmpty());
			assertEquals(1, first.next().filters(SymbolFilter.Phase.BEFORE).size());
			assertFalse(grammar.endSlot(production).hasFilters());
			assertThrows(UnsupportedOperationException.class, () -> first.filters(SymbolFilter.Phase.AFTER).clear());
			assertTrue(grammar.validate().isEmpty());
			assertEquals(2, grammar.getPlacements().size());
			assertTrue(grammar.longDescription().contains("not_follow[<\"b\">]"));
		}
	}

	@Nested
	public class Validation {

		@Test
		public void testValidGrammar(){
			assertTrue(expressions().validate().isEmpty());
		}

		@Test
		public void testUnknownStart(){
			Grammar grammar = new GrammarBuilder(terminals).add("E", "num").toGrammar("X");
			assertEquals(Arrays.asList("Unknown start non terminal X"), grammar.validate());
			assertThrows(GrammarContractViolation.class, () -> grammar.checkContract(grammar.getStart()));
		}

		@Test
		public void testUndefinedNonTerminal(){
			Grammar grammar = new GrammarBuilder(terminals).add("E", "num", "Rest").toGrammar("E");
			List<String> problems = grammar.validate();
			assertEquals(1, problems.size());
			assertEquals("Non terminal Rest has no alternatives", problems.get(0));
		}

		@Test
		public void testEndOfInputInProduction(){
			Grammar grammar = new GrammarBuilder(terminals).add("E", "num", "EOF").toGrammar("E");
			assertEquals(1, grammar.validate().size());
		}

		@Test
		public void testFilterOnEndSlot(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", 'a')
					.notFollow("S", 0, 1, 'a').toGrammar("S");
			assertEquals(1, grammar.validate().size());
			assertTrue(grammar.validate().get(0).contains("end slot"));
		}

		@Test
		public void testFilterOutOfRange(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", 'a')
					.notFollow("S", 0, 5, 'a').toGrammar("S");
			assertTrue(grammar.validate().get(0).contains("out of range"));
		}

		@Test
		public void testEmptySequence(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", 'a')
					.notFollow("S", 0, 0, (Object) new Object[]{}).toGrammar("S");
			assertTrue(grammar.validate().get(0).contains("empty terminal sequence"));
		}

		@Test
		public void testFilterWithoutSequences(){
			Grammar base = new GrammarBuilder(AlphabetTerminals.getInstance()).add("S", 'a').toGrammar("S");
			Grammar.Placement placement = new Grammar.Placement(base.getProductions().get(0), 0,
					new FollowRestriction(java.util.Collections.emptyList(), true));
			Grammar grammar = new Grammar(base.getTerminalSet(), base.getNonTerminals(), base.getStart(),
					base.getProductions(), Arrays.asList(placement));
			assertTrue(grammar.validate().get(0).contains("no terminal sequences"));
		}
	}

	@Nested
	public class Builder {

		@Test
		public void testNameResolution(){
			Grammar grammar = new GrammarBuilder(terminals)
					.add("E", "num", "Tail")
					.add("Tail", "+", "E")
					.add("Tail", "").toGrammar("E");
			Production production = grammar.getProductions().get(0);
			assertTrue(production.right.get(0) instanceof Terminal);
			assertTrue(production.right.get(1) instanceof NonTerminal);
			assertEquals(Arrays.asList("E", "Tail"), Arrays.asList(grammar.getNonTerminals().get(0).name,
					grammar.getNonTerminals().get(1).name));
			assertTrue(grammar.getProductions().get(2).isEpsilonProduction());
		}

		@Test
		public void testNonTerminalShadowsTerminal(){
			Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", 'x', "A")
					.add("A", 'a').toGrammar("S");
			assertTrue(grammar.getProductions().get(0).right.get(1) instanceof NonTerminal);
			Grammar withoutDefinition = new GrammarBuilder(AlphabetTerminals.getInstance())
					.add("S", 'x', "A").toGrammar("S");
			assertTrue(withoutDefinition.getProductions().get(0).right.get(1) instanceof Terminal);
		}

		@Test
		public void testNestedArrays(){
			GrammarBuilder builder = new GrammarBuilder(AlphabetTerminals.getInstance());
			Grammar grammar = builder.add("S", builder.string("ab"), new Object[]{'c', new Object[]{'d'}}).toGrammar("S");
			assertEquals(4, grammar.getProductions().get(0).rightSize());
		}

		@Test
		public void testUnsupportedSymbol(){
			assertThrows(GLLException.class, () -> new GrammarBuilder(terminals).add("E", 1.0));
			assertThrows(GLLException.class, () -> new GrammarBuilder(terminals).add("", "num"));
		}

		@Test
		public void testFilterOfUnknownAlternative(){
			GrammarBuilder builder = new GrammarBuilder(terminals).add("E", "num").notFollow("E", 1, 0, "num");
			GrammarContractViolation violation = assertThrows(GrammarContractViolation.class, () -> builder.toGrammar("E"));
			assertEquals(1, violation.problems.size());
		}

		@Test
		public void testFilterWithUnknownTerminal(){
			GrammarBuilder builder = new GrammarBuilder(terminals).add("E", "num").notFollow("E", 0, 0, "minus");
			assertThrows(GrammarContractViolation.class, () -> builder.toGrammar("E"));
		}
	}
}
