package gll.grammar;

/**
 * The empty word.
 */
public class Epsilon extends TerminalOrEpsilon {

	public static final Epsilon INSTANCE = new Epsilon();

	private Epsilon(){
	}

	@Override
	protected int kindRank() {
		return 0;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Epsilon;
	}

	@Override
	public int hashCode() {
		return 0;
	}

	@Override
	public String toString() {
		return "ε";
	}

	private Object readResolve(){
		return INSTANCE;
	}
}
