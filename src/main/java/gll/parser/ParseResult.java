package gll.parser;

import gll.GLLException;
import gll.grammar.GrammarContractViolation;
import gll.parser.gss.GraphStructuredStack;
import gll.parser.sppf.SppfBuilder;
import gll.parser.sppf.SymbolNode;

/**
 * Outcome of a parse: a {@link Success} with the root of the forest or one of the failure kinds.
 */
public abstract class ParseResult {

	private final ParseStatistics statistics;

	private final SppfBuilder sppfBuilder;

	private final GraphStructuredStack gss;

	ParseResult(ParseStatistics statistics, SppfBuilder sppfBuilder, GraphStructuredStack gss) {
		this.statistics = statistics;
		this.sppfBuilder = sppfBuilder;
		this.gss = gss;
	}

	public boolean isSuccess(){
		return false;
	}

	/**
	 * Root symbol node of the forest, null if the parse failed
	 */
	public SymbolNode getRoot(){
		return null;
	}

	/**
	 * Root symbol node of the forest
	 *
	 * @throws ParserError if the input is not in the language
	 * @throws GrammarContractViolation if the grammar is malformed
	 * @throws ResourceExhaustion if the parse exceeded a limit
	 */
	public abstract SymbolNode getRootOrThrow();

	/**
	 * Failure description, null if the result is no {@link Failure}
	 */
	public ParseFailure getFailure(){
		return null;
	}

	/**
	 * Statistics of the parse, null if the parse did not start
	 */
	public ParseStatistics getStatistics(){
		return statistics;
	}

	/**
	 * Forest builder of the parse, only retained if the parser options ask for it
	 */
	public SppfBuilder getSppfBuilder(){
		return sppfBuilder;
	}

	/**
	 * Stack of the parse, only retained if the parser options ask for it
	 */
	public GraphStructuredStack getGss(){
		return gss;
	}

	public static class Success extends ParseResult {

		private final SymbolNode root;

		Success(SymbolNode root, ParseStatistics statistics, SppfBuilder sppfBuilder, GraphStructuredStack gss) {
			super(statistics, sppfBuilder, gss);
			this.root = root;
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public SymbolNode getRoot() {
			return root;
		}

		@Override
		public SymbolNode getRootOrThrow() {
			return root;
		}

		@Override
		public String toString() {
			return "Success " + root.label();
		}
	}

	/**
	 * The input is not in the language of the grammar
	 */
	public static class Failure extends ParseResult {

		private final ParseFailure failure;

		Failure(ParseFailure failure, ParseStatistics statistics, SppfBuilder sppfBuilder, GraphStructuredStack gss) {
			super(statistics, sppfBuilder, gss);
			this.failure = failure;
		}

		@Override
		public ParseFailure getFailure() {
			return failure;
		}

		@Override
		public SymbolNode getRootOrThrow() {
			throw failure.toError();
		}

		@Override
		public String toString() {
			return "Failure: " + failure.getMessage();
		}
	}

	/**
	 * Base class of the results that carry the exception that aborted the parse
	 */
	public static abstract class Aborted<E extends GLLException> extends ParseResult {

		public final E exception;

		Aborted(E exception, ParseStatistics statistics, SppfBuilder sppfBuilder, GraphStructuredStack gss) {
			super(statistics, sppfBuilder, gss);
			this.exception = exception;
		}

		@Override
		public SymbolNode getRootOrThrow() {
			throw exception;
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + ": " + exception.getMessage();
		}
	}

	/**
	 * The grammar is malformed
	 */
	public static class ContractViolation extends Aborted<GrammarContractViolation> {

		ContractViolation(GrammarContractViolation exception, ParseStatistics statistics) {
			super(exception, statistics, null, null);
		}
	}

	/**
	 * The parse exceeded a limit of the parser options
	 */
	public static class Exhausted extends Aborted<ResourceExhaustion> {

		Exhausted(ResourceExhaustion exception, ParseStatistics statistics, SppfBuilder sppfBuilder, GraphStructuredStack gss) {
			super(exception, statistics, sppfBuilder, gss);
		}
	}
}
