package gll.lexer;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import gll.util.Pair;
import gll.util.Utils;

/**
 * Set terminal symbol types.
 *
 * By convention type '0' signals the end of input.
 */
public abstract class TerminalSet implements Serializable {

	/**
	 * Type of the end of input terminal
	 */
	public static final int EOF = 0;

	public abstract String typeToString(int type);

	public abstract int stringToType(String typeName);

	public abstract boolean isValidType(int type);

	public abstract boolean isValidTypeName(String typeName);

	public abstract List<Integer> getValidTypes();

	public String typesToString(Collection<Integer> types){
		return typesToString(types, true);
	}

	public String typesToString(Collection<Integer> types, boolean withRanges){
		List<String> ret = new ArrayList<>();
		if (withRanges) {
			for (Pair<Integer, Integer> pair : Utils.groupIntegers(new ArrayList<>(types))) {
				if (!Objects.equals(pair.first, pair.second)) {
					ret.add(typeToString(pair.first) + "-" + typeToString(pair.second));
				} else {
					ret.add(typeToString(pair.first));
				}
			}
		} else {
			for (int type : types){
				ret.add(typeToString(type));
			}
		}
		return "{" + String.join(" ", ret) + "}";
	}
}
