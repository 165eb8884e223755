package gll.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Minimum ASCII char used by the AlphabetLexer and others.
	 * Zero is the end of input.
	 */
	public static final int MIN_CHAR = 1;
	/**
	 * Maximum ASCII char used by the AlphabetLexer and others
	 */
	public static final int MAX_CHAR = 126;

	private static final char CONTROL_LIMIT = ' ';
	private static final char PRINTABLE_LIMIT = '~';
	private static final char[] HEX_DIGITS = new char[] { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b',
			'c', 'd', 'e', 'f' };

	/**
	 * Return an escaped and quoted version of the passed string.
	 *
	 * @param source passed string
	 * @return escaped version
	 */
	public static String toPrintableRepresentation(String source) {
		if (source == null){
			return null;
		}
		StringBuilder sb = new StringBuilder();
		sb.append('"');
		for (int pointer = 0; pointer < source.length(); pointer++) {
			int ch = source.charAt(pointer);
			switch (ch) {
				case '\0': sb.append("\\0"); break;
				case '\t': sb.append("\\t"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				default:
					if (CONTROL_LIMIT <= ch && ch <= PRINTABLE_LIMIT) {
						sb.append((char) ch);
					} else {
						char[] hexbuf = new char[4];
						for (int offs = 4; offs > 0; ) {
							hexbuf[--offs] = HEX_DIGITS[ch & 0xf];
							ch >>>= 4;
						}
						sb.append("\\u").append(hexbuf);
					}
			}
		}
		return sb.append('"').toString();
	}

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param objs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(List<T> objs, String separator){
		return objs.stream().map(String::valueOf).collect(Collectors.joining(separator));
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		ArrayList<T> list = new ArrayList<>(elements.length);
		Collections.addAll(list, elements);
		return list;
	}

	/**
	 * Groups the passed integers into ranges of consecutive integers.
	 * The passed list is sorted!
	 *
	 * @param integers passed list of integers
	 * @return list of range pairs
	 */
	public static List<Pair<Integer, Integer>> groupIntegers(List<Integer> integers){
		Collections.sort(integers);
		List<Pair<Integer, Integer>> ret = new ArrayList<>();
		for (int i : integers){
			if (ret.isEmpty()){
				ret.add(new Pair<>(i, i));
			} else {
				Pair<Integer, Integer> lastPair = ret.get(ret.size() - 1);
				if (lastPair.second + 1 == i){
					ret.set(ret.size() - 1, new Pair<>(lastPair.first, i));
				} else if (lastPair.second != i) {
					ret.add(new Pair<>(i, i));
				}
			}
		}
		return ret;
	}
}
