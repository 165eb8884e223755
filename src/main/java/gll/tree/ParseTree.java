package gll.tree;

import java.util.ArrayList;
import java.util.List;

import gll.lexer.Token;

/**
 * A single derivation tree extracted from a forest.
 */
public abstract class ParseTree {

	public abstract List<Token> getMatchedTokens();

	public List<ParseTree> children(){
		return new ArrayList<>();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("(").append(type());
		for (ParseTree child : children()){
			builder.append(" ");
			builder.append(child);
		}
		builder.append(")");
		return builder.toString();
	}

	public String toPrettyString(){
		return toPrettyString("", "\t");
	}

	public String toPrettyString(String indent, String incr){
		StringBuilder builder = new StringBuilder();
		builder.append(indent);
		builder.append("(").append(type());
		List<ParseTree> children = children();
		for (ParseTree child : children){
			builder.append("\n").append(child.toPrettyString(indent + incr, incr));
		}
		builder.append(")");
		return builder.toString();
	}

	public String getMatchedString(){
		StringBuilder builder = new StringBuilder();
		for (Token token : getMatchedTokens()){
			builder.append(token.value);
		}
		return builder.toString();
	}

	public abstract String type();

	@SuppressWarnings("unchecked")
	public <T extends ParseTree> T as(){
		return (T)this;
	}
}
