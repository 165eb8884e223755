package gll.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gll.grammar.Production;
import gll.lexer.Token;

/**
 * Inner node: the alternative of a non terminal with the trees of its symbols.
 * Epsilon alternatives have no children.
 */
public class RuleTree extends ParseTree {

	public final Production production;

	private final List<ParseTree> children;

	public RuleTree(Production production, List<ParseTree> children){
		this.production = production;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	@Override
	public List<ParseTree> children() {
		return children;
	}

	@Override
	public List<Token> getMatchedTokens() {
		List<Token> tokens = new ArrayList<>();
		for (ParseTree child : children){
			tokens.addAll(child.getMatchedTokens());
		}
		return tokens;
	}

	public ParseTree get(int index){
		return children.get(index);
	}

	public int size(){
		return children.size();
	}

	@Override
	public String type() {
		return production.left.name;
	}
}
