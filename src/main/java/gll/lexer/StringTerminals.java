package gll.lexer;

import java.io.Serializable;
import java.util.*;

/**
 * Terminal set of named terminals. The first name belongs to the end of input terminal.
 */
public class StringTerminals extends TerminalSet implements Serializable {

	private List<String> tokenNames;
	private Map<String, Integer> tokenNamesToType = new HashMap<>();

	public StringTerminals(List<String> tokenNames){
		this.tokenNames = new ArrayList<>(tokenNames);
		for (int i = 0; i < tokenNames.size(); i++){
			tokenNamesToType.put(tokenNames.get(i), i);
		}
	}

	/**
	 * Creates a terminal set with an "EOF" terminal followed by the passed terminals.
	 */
	public static StringTerminals of(String... names){
		List<String> list = new ArrayList<>();
		list.add("EOF");
		list.addAll(Arrays.asList(names));
		return new StringTerminals(list);
	}

	public int addTerminal(String name){
		tokenNames.add(name);
		tokenNamesToType.put(name, tokenNames.size() - 1);
		return tokenNames.size() - 1;
	}

	/**
	 * Creates tokens for the passed terminal names, one per line.
	 */
	public List<Token> tokens(String... names){
		List<Token> tokens = new ArrayList<>();
		for (int i = 0; i < names.length; i++){
			tokens.add(new Token(stringToType(names[i]), this, names[i], new Location(i + 1, 0)));
		}
		return tokens;
	}

	@Override
	public String typeToString(int type) {
		if (!isValidType(type)){
			throw new NoSuchElementException("terminal " + type);
		}
		return tokenNames.get(type);
	}

	@Override
	public int stringToType(String typeName) {
		Integer type = tokenNamesToType.get(typeName);
		if (type == null){
			throw new LexerError(String.format("No such token %s", typeName));
		}
		return type;
	}

	@Override
	public boolean isValidType(int type) {
		return type >= 0 && type < tokenNames.size();
	}

	@Override
	public boolean isValidTypeName(String typeName) {
		return tokenNamesToType.containsKey(typeName);
	}

	@Override
	public List<Integer> getValidTypes() {
		List<Integer> ret = new ArrayList<>(tokenNames.size());
		for (int i = 0; i < tokenNames.size(); i++){
			ret.add(i);
		}
		return ret;
	}
}
