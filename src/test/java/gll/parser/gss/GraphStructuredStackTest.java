package gll.parser.gss;

import org.junit.jupiter.api.Test;

import gll.grammar.Grammar;
import gll.grammar.GrammarBuilder;
import gll.grammar.GrammarSlot;
import gll.grammar.NonTerminal;
import gll.lexer.AlphabetLexer;
import gll.lexer.AlphabetTerminals;
import gll.parser.GLLParser;
import gll.parser.ParseResult;
import gll.parser.ParserOptions;
import gll.parser.ResourceExhaustion;
import gll.parser.sppf.SppfBuilder;
import gll.parser.sppf.SymbolNode;
import gll.util.Pair;

import static org.junit.jupiter.api.Assertions.*;

public class GraphStructuredStackTest {

	/**
	 * S → a S b | c
	 */
	private final Grammar grammar = new GrammarBuilder(AlphabetTerminals.getInstance())
			.add("S", 'a', "S", 'b')
			.add("S", 'c').toGrammar("S");

	private final NonTerminal s = grammar.getStart();

	private final GrammarSlot returnSlot = grammar.slot(grammar.getProductions().get(0), 2);

	@Test
	public void testNodesAreUnique(){
		GraphStructuredStack stack = new GraphStructuredStack();
		Pair<GssNode, Boolean> first = stack.getOrCreateNode(s, 0);
		assertTrue(first.second);
		Pair<GssNode, Boolean> second = stack.getOrCreateNode(s, 0);
		assertFalse(second.second);
		assertSame(first.first, second.first);
		assertSame(first.first, stack.getNode(s, 0));
		assertNull(stack.getNode(s, 1));
		assertEquals(1, stack.nodeCount());
		assertEquals("(S, 0)", first.first.label());
	}

	@Test
	public void testEdgesAreUnique(){
		GraphStructuredStack stack = new GraphStructuredStack();
		GssNode caller = stack.getOrCreateNode(s, 0).first;
		GssNode callee = stack.getOrCreateNode(s, 1).first;
		SymbolNode sppfNode = new SppfBuilder().symbolNode(s, 0, 1);
		Pair<GssEdge, Boolean> edge = stack.addEdge(callee, returnSlot, caller, null);
		assertTrue(edge.second);
		Pair<GssEdge, Boolean> again = stack.addEdge(callee, returnSlot, caller, sppfNode);
		assertFalse(again.second);
		assertSame(edge.first, again.first);
		assertNull(again.first.sppfNode);
		assertTrue(stack.addEdge(callee, returnSlot, callee, null).second);
		assertEquals(2, stack.edgeCount());
		assertEquals(2, stack.edgesOf(callee).size());
		assertTrue(stack.edgesOf(caller).isEmpty());
		assertSame(edge.first, callee.getEdge(returnSlot, caller));
	}

	@Test
	public void testPoppedResults(){
		GssNode node = new GraphStructuredStack().getOrCreateNode(s, 0).first;
		SymbolNode result = new SppfBuilder().symbolNode(s, 0, 1);
		assertTrue(node.addPopped(result));
		assertFalse(node.addPopped(result));
		assertEquals(1, node.getPopped().size());
	}

	@Test
	public void testLimit(){
		GraphStructuredStack stack = new GraphStructuredStack(1);
		stack.getOrCreateNode(s, 0);
		stack.getOrCreateNode(s, 0);
		assertThrows(ResourceExhaustion.class, () -> stack.getOrCreateNode(s, 1));
	}

	@Test
	public void testStackOfParse(){
		ParseResult result = new GLLParser(grammar, new ParserOptions().retainGraphs(true)).parse(new AlphabetLexer("aacbb"));
		GraphStructuredStack stack = result.getGss();
		assertEquals(3, stack.nodeCount());
		GssNode inner = stack.getNode(s, 2);
		assertEquals(1, inner.getPopped().size());
		assertEquals(3, inner.getPopped().iterator().next().rightExtent());
		String dot = GssDotExporter.toDot("stack", stack);
		assertTrue(dot.contains("(S, 1)"));
		assertTrue(dot.contains("S · "));
	}
}
