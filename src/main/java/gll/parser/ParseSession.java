package gll.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;

import gll.grammar.*;
import gll.grammar.filter.SymbolFilter;
import gll.lexer.TerminalSet;
import gll.lexer.TokenInput;
import gll.parser.gss.GraphStructuredStack;
import gll.parser.gss.GssEdge;
import gll.parser.gss.GssNode;
import gll.parser.sppf.NonPackedNode;
import gll.parser.sppf.SppfBuilder;
import gll.parser.sppf.SymbolNode;
import gll.parser.sppf.TerminalNode;
import gll.util.Pair;

import static gll.parser.GLLParser.LOG;

/**
 * State of a single parse: worklist, graph structured stack and forest builder.
 *
 * Every processed descriptor takes exactly one transition of its slot: it matches a terminal,
 * calls a non terminal or returns from a completed alternative. All follow up work is scheduled
 * as new descriptors.
 */
class ParseSession {

	private final Grammar grammar;

	private final TokenInput input;

	private final ParserOptions options;

	private final DescriptorWorklist worklist;

	private final GraphStructuredStack gss;

	private final SppfBuilder sppf;

	private GssNode root;

	/**
	 * Position of the recorded expectations
	 */
	private int expectedPosition = -1;

	private final Set<GrammarSlot> expectedSlots = new LinkedHashSet<>();

	private final Set<Integer> expectedTerminals = new HashSet<>();

	private int lastProcessedPosition = 0;

	ParseSession(Grammar grammar, TokenInput input, ParserOptions options) {
		this.grammar = grammar;
		this.input = input;
		this.options = options;
		this.worklist = new DescriptorWorklist(input.size(), options.getMaxDescriptors());
		this.gss = new GraphStructuredStack(options.getMaxGssNodes());
		this.sppf = new SppfBuilder(options.getMaxSppfNodes());
	}

	/**
	 * Parses the whole input as the passed non terminal
	 *
	 * @throws GrammarContractViolation if the parser reaches a non terminal without alternatives
	 * @throws ResourceExhaustion if a limit of the options is exceeded
	 */
	ParseResult run(NonTerminal start){
		checkAlternatives(start);
		root = gss.getOrCreateNode(start, 0).first;
		scheduleAlternatives(start, root, 0);
		while (worklist.hasNext()){
			Descriptor descriptor = worklist.next();
			lastProcessedPosition = descriptor.position;
			if (LOG.isLoggable(Level.FINEST)){
				LOG.finest("process " + descriptor);
			}
			process(descriptor);
		}
		SymbolNode rootNode = sppf.getSymbolNode(start, 0, input.size());
		if (rootNode != null){
			return new ParseResult.Success(rootNode, statistics(), retainedSppf(), retainedGss());
		}
		return new ParseResult.Failure(failure(), statistics(), retainedSppf(), retainedGss());
	}

	private void process(Descriptor descriptor){
		switch (descriptor.slot.kind){
			case TERMINAL:
				matchTerminal(descriptor);
				break;
			case NONTERMINAL:
				call(descriptor);
				break;
			case END:
				complete(descriptor);
				break;
		}
	}

	private void matchTerminal(Descriptor descriptor){
		GrammarSlot slot = descriptor.slot;
		int position = descriptor.position;
		if (!accepts(slot, SymbolFilter.Phase.BEFORE, position, position)){
			return;
		}
		Terminal terminal = (Terminal) slot.nextSymbol();
		if (position >= input.size() || input.typeAt(position) != terminal.id){
			expect(slot, position);
			return;
		}
		if (!accepts(slot, SymbolFilter.Phase.AFTER, position, position + 1)){
			return;
		}
		TerminalNode terminalNode = sppf.terminalNode(terminal, position);
		GrammarSlot next = slot.next();
		add(next, descriptor.gssNode, position + 1, sppf.getNodeP(next, descriptor.sppfNode, terminalNode));
	}

	private void call(Descriptor descriptor){
		GrammarSlot slot = descriptor.slot;
		int position = descriptor.position;
		if (!accepts(slot, SymbolFilter.Phase.BEFORE, position, position)){
			return;
		}
		NonTerminal nonTerminal = (NonTerminal) slot.nextSymbol();
		checkAlternatives(nonTerminal);
		Pair<GssNode, Boolean> node = gss.getOrCreateNode(nonTerminal, position);
		Pair<GssEdge, Boolean> edge = gss.addEdge(node.first, slot.next(), descriptor.gssNode, descriptor.sppfNode);
		if (edge.second){
			for (SymbolNode result : new ArrayList<>(node.first.getPopped())){
				returnTo(edge.first, result);
			}
		}
		if (node.second){
			scheduleAlternatives(nonTerminal, node.first, position);
		}
	}

	private void complete(Descriptor descriptor){
		GrammarSlot slot = descriptor.slot;
		int position = descriptor.position;
		NonPackedNode result = descriptor.sppfNode;
		if (slot.production.isEpsilonProduction()){
			result = sppf.packedSymbol(slot, null, sppf.epsilonNode(position));
		}
		if (descriptor.gssNode == root && position < input.size()){
			expect(slot, position);
		}
		pop(descriptor.gssNode, (SymbolNode) result);
	}

	/**
	 * Returns the result to all callers of the node, unless it has been returned before
	 */
	private void pop(GssNode node, SymbolNode result){
		if (!node.addPopped(result)){
			return;
		}
		for (GssEdge edge : gss.edgesOf(node)){
			returnTo(edge, result);
		}
	}

	/**
	 * Continues the caller of the edge after the called non terminal matched the result
	 */
	private void returnTo(GssEdge edge, SymbolNode result){
		GrammarSlot callSlot = edge.returnSlot.previous();
		if (!accepts(callSlot, SymbolFilter.Phase.AFTER, result.leftExtent(), result.rightExtent())){
			return;
		}
		add(edge.returnSlot, edge.target, result.rightExtent(), sppf.getNodeP(edge.returnSlot, edge.sppfNode, result));
	}

	private void scheduleAlternatives(NonTerminal nonTerminal, GssNode node, int position){
		int type = input.typeAt(position);
		for (Production production : nonTerminal.getProductions()){
			GrammarSlot slot = grammar.firstSlot(production);
			if (options.useLookahead() && !slot.lookaheadAccepts(type)){
				expect(slot, position);
				continue;
			}
			add(slot, node, position, null);
		}
	}

	private void add(GrammarSlot slot, GssNode node, int position, NonPackedNode sppfNode){
		Descriptor descriptor = new Descriptor(slot, node, position, sppfNode);
		if (worklist.add(descriptor) && LOG.isLoggable(Level.FINEST)){
			LOG.finest("add " + descriptor);
		}
	}

	private boolean accepts(GrammarSlot slot, SymbolFilter.Phase phase, int leftExtent, int rightExtent){
		for (SymbolFilter filter : slot.filters(phase)){
			if (!filter.accepts(input, leftExtent, rightExtent)){
				if (LOG.isLoggable(Level.FINEST)){
					LOG.finest(String.format("%s rejects %s at [%d, %d)", filter, slot.formatItem(), leftExtent, rightExtent));
				}
				return false;
			}
		}
		return true;
	}

	private void checkAlternatives(NonTerminal nonTerminal){
		if (!nonTerminal.hasProductions()){
			throw new GrammarContractViolation(String.format("Non terminal %s has no alternatives", nonTerminal));
		}
	}

	/**
	 * Records that the slot could not continue at the position. Only the expectations of the
	 * furthest position are kept.
	 */
	private void expect(GrammarSlot slot, int position){
		if (position != expectedPosition){
			expectedSlots.clear();
			expectedTerminals.clear();
			expectedPosition = position;
		}
		if (!expectedSlots.add(slot)){
			return;
		}
		switch (slot.kind){
			case TERMINAL:
				expectedTerminals.add(((Terminal) slot.nextSymbol()).id);
				break;
			case END:
				expectedTerminals.add(TerminalSet.EOF);
				break;
			default:
				expectedTerminals.addAll(slot.lookahead());
		}
	}

	ParseFailure failure(){
		int position = lastProcessedPosition;
		List<GrammarSlot> slots = new ArrayList<>();
		Set<Integer> terminals = new HashSet<>();
		if (expectedPosition == position){
			slots.addAll(expectedSlots);
			terminals.addAll(expectedTerminals);
		}
		return new ParseFailure(position, input.tokenAt(position), input.locationAt(position), slots, terminals,
				input.getTerminalSet());
	}

	ParseStatistics statistics(){
		return new ParseStatistics(worklist.addedCount(), worklist.processedCount(), gss.nodeCount(), gss.edgeCount(),
				sppf.symbolNodeCount(), sppf.intermediateNodeCount(), sppf.packedNodeCount(), sppf.terminalNodeCount(),
				sppf.epsilonNodeCount());
	}

	SppfBuilder retainedSppf(){
		return options.retainGraphs() ? sppf : null;
	}

	GraphStructuredStack retainedGss(){
		return options.retainGraphs() ? gss : null;
	}
}
