package gll.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import gll.grammar.Grammar;
import gll.grammar.GrammarBuilder;
import gll.grammar.GrammarContractViolation;
import gll.grammar.Terminal;
import gll.lexer.AlphabetLexer;
import gll.lexer.AlphabetTerminals;
import gll.lexer.StringTerminals;
import gll.lexer.Token;
import gll.lexer.TokenInput;
import gll.parser.sppf.*;
import gll.tree.TreeBuilder;

import static org.junit.jupiter.api.Assertions.*;

public class GLLParserTest {

	private final StringTerminals terminals = StringTerminals.of("+", "num");

	/**
	 * E → E + num | num
	 */
	private Grammar leftRecursive(){
		return new GrammarBuilder(terminals).add("E", "E", "+", "num").add("E", "num").toGrammar("E");
	}

	/**
	 * S → S S | a
	 */
	private Grammar highlyAmbiguous(){
		return new GrammarBuilder(AlphabetTerminals.getInstance()).add("S", "S", "S").add("S", 'a').toGrammar("S");
	}

	private static String repeat(char c, int times){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < times; i++){
			builder.append(c);
		}
		return builder.toString();
	}

	@Test
	public void testLeftRecursion(){
		List<Token> tokens = terminals.tokens("num", "+", "num", "+", "num");
		ParseResult result = new GLLParser(leftRecursive()).parse(tokens);
		assertTrue(result.isSuccess());
		SymbolNode root = result.getRoot();
		assertEquals(0, root.leftExtent());
		assertEquals(5, root.rightExtent());
		assertFalse(Forests.isAmbiguous(root));
		assertEquals(BigInteger.ONE, Forests.countDerivations(root));
		assertEquals("(E (E (E num) + num) + num)",
				new TreeBuilder().build(root, TokenInput.of(terminals, tokens)).toString());
	}

	@Test
	public void testSingleToken(){
		ParseResult result = new GLLParser(leftRecursive()).parse(terminals.tokens("num"));
		assertEquals(BigInteger.ONE, Forests.countDerivations(result.getRootOrThrow()));
	}

	@Test
	public void testTrailingEndOfInputToken(){
		List<Token> tokens = terminals.tokens("num", "+", "num", "EOF");
		assertTrue(new GLLParser(leftRecursive()).parse(tokens).isSuccess());
	}

	@ParameterizedTest
	@CsvSource({"1, 1", "2, 1", "3, 2", "4, 5", "5, 14", "6, 42", "8, 429", "10, 4862"})
	public void testCatalanNumberOfDerivations(int length, long derivations){
		ParseResult result = new GLLParser(highlyAmbiguous()).parse(new AlphabetLexer(repeat('a', length)));
		assertEquals(BigInteger.valueOf(derivations), Forests.countDerivations(result.getRootOrThrow()));
	}

	@ParameterizedTest
	@ValueSource(ints = {1, 5, 10, 20})
	public void testPolynomialBounds(int length){
		ParseResult result = new GLLParser(highlyAmbiguous()).parse(new AlphabetLexer(repeat('a', length)));
		ParseStatistics statistics = result.getStatistics();
		assertTrue(result.isSuccess());
		assertTrue(statistics.gssNodes <= length + 1, statistics::toString);
		assertTrue(statistics.totalSppfNodes() <= Math.pow(length + 1, 3), statistics::toString);
	}

	@Test
	public void testNoDuplicateNodes(){
		ParseResult result = new GLLParser(highlyAmbiguous()).parse(new AlphabetLexer("aaaaaa"));
		Set<String> labels = new HashSet<>();
		for (SppfNode node : Forests.collectNodes(result.getRoot())){
			if (node instanceof NonPackedNode){
				assertTrue(labels.add(node.label()), () -> "Duplicate node " + node.label());
			}
		}
		for (BranchNode node : Forests.ambiguousNodes(result.getRoot())){
			Set<String> keys = new HashSet<>();
			for (PackedNode packed : node.getPackedNodes()){
				assertTrue(keys.add(packed.slot.id + ":" + packed.pivot));
			}
		}
	}

	@Test
	public void testEpsilonCycleTerminates(){
		Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance()).add("S", "S", "S").add("S", "").toGrammar("S");
		ParseResult result = new GLLParser(grammar).parse(new AlphabetLexer(""));
		SymbolNode root = result.getRootOrThrow();
		assertTrue(Forests.isCyclic(root));
		assertThrows(IllegalArgumentException.class, () -> Forests.countDerivations(root));
		assertEquals("(S)", new TreeBuilder().build(root, TokenInput.of(new AlphabetLexer(""))).toString());
	}

	@Test
	public void testCyclicForestWithTokens(){
		Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
				.add("S", "S", "S").add("S", 'a').add("S", "").toGrammar("S");
		ParseResult result = new GLLParser(grammar).parse(new AlphabetLexer("aa"));
		SymbolNode root = result.getRootOrThrow();
		assertTrue(Forests.isCyclic(root));
		assertEquals(2, root.rightExtent());
		assertEquals("(S (S a) (S a))", new TreeBuilder().build(root, TokenInput.of(new AlphabetLexer("aa"))).toString());
	}

	/**
	 * Every packed node spans exactly its parent and its children meet at the pivot
	 */
	private static void assertExtentsFit(SppfNode root){
		for (SppfNode node : Forests.collectNodes(root)){
			if (!(node instanceof BranchNode)){
				continue;
			}
			for (PackedNode packed : ((BranchNode) node).getPackedNodes()){
				String label = node.label() + " / " + packed.label();
				assertEquals(node.leftExtent(), packed.leftExtent(), label);
				assertEquals(node.rightExtent(), packed.rightExtent(), label);
				assertEquals(packed.pivot, packed.right.leftExtent(), label);
				assertEquals(node.rightExtent(), packed.right.rightExtent(), label);
				if (packed.left != null){
					assertEquals(node.leftExtent(), packed.left.leftExtent(), label);
					assertEquals(packed.left.rightExtent(), packed.right.leftExtent(), label);
				} else {
					assertEquals(node.leftExtent(), packed.right.leftExtent(), label);
				}
			}
		}
	}

	@Test
	public void testForestExtentsFit(){
		assertExtentsFit(new GLLParser(leftRecursive()).parse(terminals.tokens("num", "+", "num", "+", "num")).getRootOrThrow());
		assertExtentsFit(new GLLParser(highlyAmbiguous()).parse(new AlphabetLexer("aaaaaaa")).getRootOrThrow());
		Grammar cyclic = new GrammarBuilder(AlphabetTerminals.getInstance())
				.add("S", "S", "S").add("S", 'a').add("S", "").toGrammar("S");
		assertExtentsFit(new GLLParser(cyclic).parse(new AlphabetLexer("aaa")).getRootOrThrow());
	}

	@Test
	public void testFilteredTransitionLeavesNoTrace(){
		Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
				.add("S", "X", "T")
				.add("X", 'x')
				.add("T", 'a')
				.add("T", 'b')
				.notFollow("S", 0, 0, 'a').toGrammar("S");
		GLLParser parser = new GLLParser(grammar, new ParserOptions().retainGraphs(true));
		ParseResult result = parser.parse(new AlphabetLexer("xa"));
		assertFalse(result.isSuccess());
		assertNull(result.getGss().getNode(grammar.getNonTerminal("T"), 1));
		assertNull(result.getSppfBuilder().getTerminalNode(new Terminal('a', AlphabetTerminals.getInstance()), 1));
		assertEquals(0, result.getSppfBuilder().intermediateNodeCount());
		assertTrue(parser.parse(new AlphabetLexer("xb")).isSuccess());
	}

	@Test
	public void testGraphsAreOnlyRetainedOnRequest(){
		ParseResult result = new GLLParser(highlyAmbiguous()).parse(new AlphabetLexer("aa"));
		assertNull(result.getGss());
		assertNull(result.getSppfBuilder());
	}

	@Test
	public void testDeterminism(){
		GLLParser parser = new GLLParser(highlyAmbiguous());
		ParseResult first = parser.parse(new AlphabetLexer("aaaaaaa"));
		ParseResult second = parser.parse(new AlphabetLexer("aaaaaaa"));
		assertEquals(first.getStatistics(), second.getStatistics());
		assertEquals(SppfDotExporter.toDot("forest", first.getRoot()), SppfDotExporter.toDot("forest", second.getRoot()));
	}

	@Test
	public void testConcurrentParses() throws Exception {
		GLLParser parser = new GLLParser(highlyAmbiguous());
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<BigInteger>> futures = new ArrayList<>();
			for (int i = 0; i < 16; i++){
				int length = 4 + i % 4;
				futures.add(executor.submit(() ->
						Forests.countDerivations(parser.parse(new AlphabetLexer(repeat('a', length))).getRootOrThrow())));
			}
			long[] catalan = {5, 14, 42, 132};
			for (int i = 0; i < futures.size(); i++){
				assertEquals(BigInteger.valueOf(catalan[i % 4]), futures.get(i).get());
			}
		} finally {
			executor.shutdown();
			assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
		}
	}

	@Test
	public void testFailureDiagnostics(){
		ParseResult result = new GLLParser(leftRecursive()).parse(terminals.tokens("num", "+", "+"));
		assertFalse(result.isSuccess());
		ParseFailure failure = result.getFailure();
		assertEquals(2, failure.position);
		assertEquals("+", failure.token.value);
		assertEquals(1, failure.expectedTerminals.size());
		assertTrue(failure.expectedTerminals.contains(terminals.stringToType("num")));
		assertEquals("E → E <+> · <num>", failure.expectedSlots.get(0).formatItem());
		ParserError error = assertThrows(ParserError.class, result::getRootOrThrow);
		assertEquals(failure.token, error.errorToken);
	}

	@Test
	public void testFailureAtEndOfInput(){
		ParseResult result = new GLLParser(leftRecursive()).parse(terminals.tokens("num", "+"));
		ParseFailure failure = result.getFailure();
		assertEquals(2, failure.position);
		assertNull(failure.token);
		assertTrue(failure.getMessage().contains("end of input"));
	}

	@Test
	public void testTrailingTokensExpectEndOfInput(){
		ParseResult result = new GLLParser(leftRecursive()).parse(terminals.tokens("num", "num"));
		ParseFailure failure = result.getFailure();
		assertEquals(1, failure.position);
		assertTrue(failure.expectedTerminals.contains(0));
		assertTrue(failure.expectedTerminals.contains(terminals.stringToType("+")));
	}

	@Test
	public void testEmptyInput(){
		ParseResult result = new GLLParser(leftRecursive()).parse(new ArrayList<>());
		assertEquals(0, result.getFailure().position);
		assertTrue(result.getFailure().expectedTerminals.contains(terminals.stringToType("num")));
	}

	@Test
	public void testLookaheadDoesNotChangeTheForest(){
		for (int length = 1; length < 7; length++){
			String input = repeat('a', length);
			ParseResult with = new GLLParser(highlyAmbiguous()).parse(new AlphabetLexer(input));
			ParseResult without = new GLLParser(highlyAmbiguous(), new ParserOptions().lookahead(false)).parse(new AlphabetLexer(input));
			assertEquals(Forests.countDerivations(with.getRoot()), Forests.countDerivations(without.getRoot()));
			assertEquals(Forests.collectNodes(with.getRoot()).size(), Forests.collectNodes(without.getRoot()).size());
		}
	}

	@Test
	public void testLookaheadPrunesDescriptors(){
		List<Token> tokens = terminals.tokens("num", "+", "num");
		ParseStatistics with = new GLLParser(leftRecursive()).parse(tokens).getStatistics();
		ParseStatistics without = new GLLParser(leftRecursive(), new ParserOptions().lookahead(false)).parse(tokens).getStatistics();
		assertTrue(with.descriptorsAdded <= without.descriptorsAdded);
	}

	@Test
	public void testParseOtherStartNonTerminal(){
		Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
				.add("S", "A", 'b')
				.add("A", 'a', "A")
				.add("A", 'a').toGrammar("S");
		GLLParser parser = new GLLParser(grammar);
		assertTrue(parser.parse(new AlphabetLexer("aab")).isSuccess());
		assertFalse(parser.parse(new AlphabetLexer("aa")).isSuccess());
		assertTrue(parser.parse("A", new AlphabetLexer("aa")).isSuccess());
		assertEquals("A", parser.parse("A", new AlphabetLexer("aaa")).getRoot().nonTerminal.name);
	}

	@Test
	public void testResourceExhaustion(){
		Grammar grammar = highlyAmbiguous();
		ParseResult descriptors = new GLLParser(grammar, new ParserOptions().maxDescriptors(5)).parse(new AlphabetLexer("aaaaa"));
		assertTrue(descriptors instanceof ParseResult.Exhausted);
		assertEquals("maxDescriptors", ((ParseResult.Exhausted) descriptors).exception.limitName);
		assertEquals(5, descriptors.getStatistics().descriptorsAdded);
		assertThrows(ResourceExhaustion.class, descriptors::getRootOrThrow);

		ParseResult gss = new GLLParser(grammar, new ParserOptions().maxGssNodes(1)).parse(new AlphabetLexer("aaa"));
		assertEquals("maxGssNodes", ((ParseResult.Exhausted) gss).exception.limitName);

		ParseResult sppf = new GLLParser(grammar, new ParserOptions().maxSppfNodes(3)).parse(new AlphabetLexer("aaa"));
		assertEquals("maxSppfNodes", ((ParseResult.Exhausted) sppf).exception.limitName);

		assertTrue(new GLLParser(grammar, new ParserOptions().maxDescriptors(1000)).parse(new AlphabetLexer("aaa")).isSuccess());
	}

	@Test
	public void testUnknownStartNonTerminal(){
		ParseResult result = new GLLParser(leftRecursive()).parse("X", terminals.tokens("num"));
		assertTrue(result instanceof ParseResult.ContractViolation);
		assertThrows(GrammarContractViolation.class, result::getRootOrThrow);
	}

	@Test
	public void testNonTerminalWithoutAlternatives(){
		Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
				.add("S", 'a')
				.add("S", 'b', "Rest").toGrammar("S");
		ParseResult validated = new GLLParser(grammar).parse(new AlphabetLexer("a"));
		assertTrue(validated instanceof ParseResult.ContractViolation);
		assertNull(validated.getStatistics());

		GLLParser unvalidated = new GLLParser(grammar, new ParserOptions().validateGrammar(false));
		assertTrue(unvalidated.parse(new AlphabetLexer("a")).isSuccess());
		ParseResult midParse = unvalidated.parse(new AlphabetLexer("bc"));
		assertTrue(midParse instanceof ParseResult.ContractViolation);
		assertNotNull(midParse.getStatistics());
		assertTrue(((ParseResult.ContractViolation) midParse).exception.getMessage().contains("Rest"));
	}

	@Test
	public void testFilterOnEndSlotIsAContractViolation(){
		Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
				.add("S", 'a')
				.notFollow("S", 0, 1, 'a').toGrammar("S");
		assertTrue(new GLLParser(grammar).parse(new AlphabetLexer("a")) instanceof ParseResult.ContractViolation);
	}
}
