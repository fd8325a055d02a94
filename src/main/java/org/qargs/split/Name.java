package org.qargs.split;

import java.util.Objects;

/**
 * A concrete spelling by which an option or flag can be referred to on the command line
 */
public final class Name implements Comparable<Name> {
	/** The ways a name may be spelled */
	public enum Type {
		/** A multi-character name introduced by two dashes, e.g. <code>--verbose</code> */
		LONG("--"),
		/** A single-character name introduced by one dash, e.g. <code>-v</code> */
		SHORT("-"),
		/** A multi-character name introduced by one dash, e.g. <code>-verbose</code> */
		LONG_WITH_SINGLE_DASH("-");

		/** The prefix printed before the name */
		public final String prefix;

		private Type(String prefix) {
			this.prefix = prefix;
		}
	}

	private final Type theType;
	private final String theValue;
	private final boolean isJoinedValueAllowed;

	private Name(Type type, String value, boolean allowingJoined) {
		if (value == null || value.isEmpty())
			throw new IllegalArgumentException("Names may not be empty");
		theType = type;
		theValue = value;
		isJoinedValueAllowed = allowingJoined;
	}

	/**
	 * @param name The name, without dashes
	 * @return A long name (<code>--name</code>)
	 */
	public static Name ofLong(String name) {
		return new Name(Type.LONG, name, false);
	}

	/**
	 * @param name The name, without the dash
	 * @return A long name introduced with a single dash (<code>-name</code>)
	 */
	public static Name ofLongWithSingleDash(String name) {
		return new Name(Type.LONG_WITH_SINGLE_DASH, name, false);
	}

	/**
	 * @param c The character
	 * @return A short name (<code>-c</code>)
	 */
	public static Name ofShort(char c) {
		return new Name(Type.SHORT, String.valueOf(c), false);
	}

	/**
	 * @param c The character
	 * @param allowingJoined Whether a value may be joined directly to the name, as in <code>-Ddebug</code>
	 * @return A short name (<code>-c</code>)
	 */
	public static Name ofShort(char c, boolean allowingJoined) {
		return new Name(Type.SHORT, String.valueOf(c), allowingJoined);
	}

	/** @return The way this name is spelled */
	public Type getType() {
		return theType;
	}

	/** @return The name without its dash prefix */
	public String getValue() {
		return theValue;
	}

	/** @return Whether this is a single-character name */
	public boolean isShort() {
		return theType == Type.SHORT;
	}

	/** @return Whether a value may be joined directly to this short name */
	public boolean allowsJoinedValue() {
		return isJoinedValueAllowed;
	}

	/** @return The name as the user would type it, e.g. <code>--verbose</code> */
	public String getSynopsis() {
		return theType.prefix + theValue;
	}

	/** Orders by synopsis, then by type, consistent with {@link #equals(Object)} */
	@Override
	public int compareTo(Name o) {
		int comp = getSynopsis().compareTo(o.getSynopsis());
		if (comp == 0)
			comp = theType.compareTo(o.theType);
		return comp;
	}

	/** Joined-value permission is a declaration detail and does not take part in equality */
	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof Name))
			return false;
		Name other = (Name) obj;
		return theType == other.theType && theValue.equals(other.theValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theType, theValue);
	}

	@Override
	public String toString() {
		return getSynopsis();
	}
}
