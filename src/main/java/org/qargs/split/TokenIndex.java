package org.qargs.split;

/**
 * Identifies an element of a {@link SplitArguments} stream: the position of the raw input string, plus the position of a character
 * within a short-option cluster, or {@link #COMPLETE} for the whole input string.
 */
public final class TokenIndex implements Comparable<TokenIndex> {
	/** The sub-index of an element representing a complete input string */
	public static final int COMPLETE = -1;

	private final int theInputIndex;
	private final int theSubIndex;

	private TokenIndex(int inputIndex, int subIndex) {
		if (inputIndex < 0)
			throw new IndexOutOfBoundsException("" + inputIndex);
		theInputIndex = inputIndex;
		theSubIndex = subIndex;
	}

	/**
	 * @param inputIndex The index of the input string
	 * @return The index of the complete input string
	 */
	public static TokenIndex complete(int inputIndex) {
		return new TokenIndex(inputIndex, COMPLETE);
	}

	/**
	 * @param inputIndex The index of the input string
	 * @param subIndex The index of the character within the cluster (0 for the first character after the dash)
	 * @return The index of the sub-element
	 */
	public static TokenIndex sub(int inputIndex, int subIndex) {
		if (subIndex < 0)
			throw new IndexOutOfBoundsException("" + subIndex);
		return new TokenIndex(inputIndex, subIndex);
	}

	/** @return The index of the input string this element came from */
	public int getInputIndex() {
		return theInputIndex;
	}

	/** @return The index within a short-option cluster, or {@link #COMPLETE} */
	public int getSubIndex() {
		return theSubIndex;
	}

	/** @return Whether this index addresses a complete input string */
	public boolean isComplete() {
		return theSubIndex == COMPLETE;
	}

	/** @return The index of the complete input string this index belongs to */
	public TokenIndex toComplete() {
		return isComplete() ? this : complete(theInputIndex);
	}

	@Override
	public int compareTo(TokenIndex o) {
		int comp = Integer.compare(theInputIndex, o.theInputIndex);
		if (comp == 0)
			comp = Integer.compare(theSubIndex, o.theSubIndex);
		return comp;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof TokenIndex))
			return false;
		return theInputIndex == ((TokenIndex) obj).theInputIndex && theSubIndex == ((TokenIndex) obj).theSubIndex;
	}

	@Override
	public int hashCode() {
		return theInputIndex * 31 + theSubIndex;
	}

	@Override
	public String toString() {
		return isComplete() ? String.valueOf(theInputIndex) : theInputIndex + "." + theSubIndex;
	}
}
