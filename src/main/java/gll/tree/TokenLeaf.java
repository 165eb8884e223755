package gll.tree;

import java.util.List;

import gll.lexer.Token;
import gll.util.Utils;

/**
 * Leaf of a matched token
 */
public class TokenLeaf extends ParseTree {

	public final Token token;

	/**
	 * Position of the token in the input
	 */
	public final int position;

	public TokenLeaf(Token token, int position){
		this.token = token;
		this.position = position;
	}

	@Override
	public List<Token> getMatchedTokens() {
		return Utils.makeArrayList(token);
	}

	@Override
	public String toPrettyString(String indent, String incr) {
		return indent + toString();
	}

	/**
	 * The matched text
	 */
	@Override
	public String toString() {
		return token.value;
	}

	@Override
	public String type() {
		return "leaf";
	}
}
