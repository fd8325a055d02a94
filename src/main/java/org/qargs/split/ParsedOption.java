package org.qargs.split;

import java.util.Objects;

/** An option name as it was typed, optionally with a value attached via <code>=</code> */
public final class ParsedOption {
	private final Name theName;
	private final String theValue;

	private ParsedOption(Name name, String value) {
		theName = name;
		theValue = value;
	}

	/**
	 * @param name The option name
	 * @return An option without an attached value
	 */
	public static ParsedOption of(Name name) {
		return new ParsedOption(name, null);
	}

	/**
	 * @param name The option name
	 * @param value The value attached to the option (may be empty)
	 * @return An option with an attached value
	 */
	public static ParsedOption of(Name name, String value) {
		return new ParsedOption(name, value);
	}

	/** @return The option's name */
	public Name getName() {
		return theName;
	}

	/** @return The value attached with <code>=</code>, or null if there was none */
	public String getValue() {
		return theValue;
	}

	/** @return Whether a value was attached with <code>=</code> */
	public boolean hasValue() {
		return theValue != null;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParsedOption))
			return false;
		return theName.equals(((ParsedOption) obj).theName) && Objects.equals(theValue, ((ParsedOption) obj).theValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theName, theValue);
	}

	@Override
	public String toString() {
		return theValue == null ? theName.getSynopsis() : theName.getSynopsis() + "=" + theValue;
	}
}
