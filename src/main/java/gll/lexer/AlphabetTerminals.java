package gll.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gll.util.Utils;

/**
 * Set of ASCII characters, the type of a terminal is its character code.
 */
public class AlphabetTerminals extends TerminalSet {

	private static final AlphabetTerminals instance = new AlphabetTerminals();
	private final List<Integer> validTypes;

	public AlphabetTerminals(){
		List<Integer> types = new ArrayList<>(Utils.MAX_CHAR - Utils.MIN_CHAR + 2);
		types.add(EOF);
		for (int i = Utils.MIN_CHAR; i <= Utils.MAX_CHAR; i++) {
			types.add(i);
		}
		validTypes = Collections.unmodifiableList(types);
	}

	@Override
	public String typeToString(int type) {
		if (type == EOF){
			return "EOF";
		}
		return Utils.toPrintableRepresentation(Character.toString((char)type));
	}

	@Override
	public int stringToType(String typeName) {
		if (typeName.equals("EOF")){
			return EOF;
		}
		if (typeName.length() != 1){
			throw new LexerError(String.format("No such character %s", typeName));
		}
		return typeName.charAt(0);
	}

	@Override
	public boolean isValidType(int type) {
		return (type >= Utils.MIN_CHAR && type <= Utils.MAX_CHAR) || type == EOF;
	}

	@Override
	public boolean isValidTypeName(String typeName) {
		return typeName.equals("EOF") || (typeName.length() == 1 && isValidType(typeName.charAt(0)));
	}

	@Override
	public List<Integer> getValidTypes() {
		return validTypes;
	}

	public static AlphabetTerminals getInstance(){
		return instance;
	}
}
