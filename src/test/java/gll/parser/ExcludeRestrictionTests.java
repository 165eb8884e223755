package gll.parser;

import org.junit.jupiter.api.Test;

import gll.grammar.GrammarBuilder;
import gll.lexer.AlphabetTerminals;

public class ExcludeRestrictionTests {

	private final GrammarBuilder builder = new GrammarBuilder(AlphabetTerminals.getInstance());

	@Test
	public void testExcludeTerminals(){
		ParseMatcher.of(builder
				.add("S", 'x', "T", 'y')
				.add("T", 'a')
				.add("T", 'b')
				.add("T", 'c')
				.exclude("S", 0, 1, 'a', 'b'), "S")
				.succeeds("xcy")
				.fails("xay", "xby");
	}

	@Test
	public void testExcludeSequences(){
		ParseMatcher.of(builder
				.add("S", 'x', "T", 'y')
				.add("T", builder.string("aaa"))
				.add("T", builder.string("bbb"))
				.add("T", builder.string("ccc"))
				.exclude("S", 0, 1, builder.string("aaa"), builder.string("bbb")), "S")
				.succeeds("xcccy")
				.fails("xaaay", "xbbby");
	}

	@Test
	public void testExcludeOnlyMatchesWholeSpan(){
		ParseMatcher.of(builder
				.add("S", 'x', "T", 'y')
				.add("T", 'a', "T")
				.add("T", 'a')
				.exclude("S", 0, 1, (Object) builder.string("aa")), "S")
				.succeeds("xay", "xaaay")
				.fails("xaay");
	}
}
