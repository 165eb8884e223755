package gll.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gll.GLLException;
import gll.util.Utils;

/**
 * The grammar handed to the parser is malformed, an error of the stage that elaborated the grammar.
 */
public class GrammarContractViolation extends GLLException {

	public final List<String> problems;

	public GrammarContractViolation(List<String> problems) {
		super("Malformed grammar: " + Utils.join(problems, "; "));
		this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
	}

	public GrammarContractViolation(String problem) {
		this(Collections.singletonList(problem));
	}
}
