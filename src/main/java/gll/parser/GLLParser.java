package gll.parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import gll.grammar.Grammar;
import gll.grammar.GrammarContractViolation;
import gll.grammar.NonTerminal;
import gll.lexer.Lexer;
import gll.lexer.Token;
import gll.lexer.TokenInput;

/**
 * Generalized LL parser: parses the input with every derivation of the (possibly ambiguous or
 * left recursive) grammar and returns them as a shared packed parse forest.
 *
 * The parser itself is immutable, each call of a parse method works on its own state.
 * Therefore a parser can be used by several threads at once.
 *
 * <pre>
 *     Grammar grammar = new GrammarBuilder(terminals).add("E", "E", "+", "num").add("E", "num").toGrammar("E");
 *     ParseResult result = new GLLParser(grammar).parse(terminals.tokens("num", "+", "num"));
 *     SymbolNode root = result.getRootOrThrow();
 * </pre>
 */
public class GLLParser {

	public static final Logger LOG = Logger.getLogger("GLL");

	private final Grammar grammar;

	private final ParserOptions options;

	public GLLParser(Grammar grammar, ParserOptions options) {
		this.grammar = grammar;
		this.options = options.copy();
	}

	public GLLParser(Grammar grammar) {
		this(grammar, new ParserOptions());
	}

	/**
	 * Parses the tokens as the start non terminal of the grammar. A trailing end of input token is allowed.
	 */
	public ParseResult parse(List<Token> tokens){
		return parse(grammar.getStart(), tokens);
	}

	public ParseResult parse(String start, List<Token> tokens){
		NonTerminal nonTerminal = grammar.getNonTerminal(start);
		if (nonTerminal == null){
			return unknownStart(start);
		}
		return parse(nonTerminal, tokens);
	}

	public ParseResult parse(NonTerminal start, List<Token> tokens){
		return parse(start, TokenInput.of(grammar.getTerminalSet(), tokens));
	}

	/**
	 * Parses the tokens of the lexer till its end of input token
	 */
	public ParseResult parse(Lexer lexer){
		return parse(grammar.getStart(), TokenInput.of(lexer));
	}

	public ParseResult parse(String start, Lexer lexer){
		NonTerminal nonTerminal = grammar.getNonTerminal(start);
		if (nonTerminal == null){
			return unknownStart(start);
		}
		return parse(nonTerminal, TokenInput.of(lexer));
	}

	/**
	 * Parses the whole input as the passed non terminal.
	 *
	 * @return a success with the root of the forest, a failure with diagnostics or the reason why the
	 * parse has been aborted
	 */
	public ParseResult parse(NonTerminal start, TokenInput input){
		if (options.validateGrammar()){
			List<String> problems = grammar.validate(start);
			if (!problems.isEmpty()){
				GrammarContractViolation violation = new GrammarContractViolation(problems);
				LOG.warning(violation.getMessage());
				return new ParseResult.ContractViolation(violation, null);
			}
		}
		ParseSession session = new ParseSession(grammar, input, options);
		ParseResult result;
		try {
			result = session.run(start);
		} catch (ResourceExhaustion ex){
			LOG.log(Level.FINE, "Parse aborted", ex);
			result = new ParseResult.Exhausted(ex, session.statistics(), session.retainedSppf(), session.retainedGss());
		} catch (GrammarContractViolation ex){
			LOG.log(Level.WARNING, "Parse aborted", ex);
			result = new ParseResult.ContractViolation(ex, session.statistics());
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Parsed %d tokens as %s: %s (%s)", input.size(), start, result, result.getStatistics()));
		}
		return result;
	}

	private ParseResult unknownStart(String start){
		GrammarContractViolation violation = new GrammarContractViolation(String.format("Unknown start non terminal %s", start));
		LOG.warning(violation.getMessage());
		return new ParseResult.ContractViolation(violation, null);
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public ParserOptions getOptions() {
		return options.copy();
	}
}
