package org.qargs;

import java.util.Collections;
import java.util.List;

import org.qargs.split.InputOrigin;
import org.qargs.split.Name;
import org.qargs.split.SplitArguments.IndexedValue;
import org.qargs.split.TokenIndex;

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a command line does not match its command's declared arguments. {@link ErrorMessageGenerator} renders the message shown to
 * the user.
 */
public class ArgumentParseException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	/** The kinds of parse failure */
	public enum Kind {
		/** An option name that no argument declares */
		UNKNOWN_OPTION,
		/** An option that needs a value was not given one */
		MISSING_VALUE,
		/** A required argument was not given */
		MISSING_ARGUMENT,
		/** Values were left that no argument consumed */
		UNEXPECTED_VALUES,
		/** A flag was given a value with <code>=</code> */
		UNEXPECTED_VALUE_FOR_OPTION,
		/** Two exclusive flags, or the same option, set a key twice */
		DUPLICATE_EXCLUSIVE_VALUES,
		/** A value could not be parsed or is not allowed */
		INVALID_VALUE,
		/** A command requiring a subcommand was given none */
		MISSING_SUBCOMMAND,
		/** An internal inconsistency */
		INVALID_STATE;
	}

	private final Kind theKind;
	private final InputOrigin theOrigin;
	private final InputOrigin thePreviousOrigin;
	private final Name theName;
	private final String theValue;
	private final String theKey;
	private final List<ArgumentDefinition> theArguments;
	private final List<IndexedValue> theExtraValues;

	private ArgumentParseException(String message, Throwable cause, Kind kind, InputOrigin origin, InputOrigin previousOrigin, Name name,
		String value, String key, List<ArgumentDefinition> arguments, List<IndexedValue> extraValues) {
		super(message, cause);
		theKind = kind;
		theOrigin = origin;
		thePreviousOrigin = previousOrigin;
		theName = name;
		theValue = value;
		theKey = key;
		theArguments = arguments == null ? Collections.emptyList() : ImmutableList.copyOf(arguments);
		theExtraValues = extraValues == null ? Collections.emptyList() : ImmutableList.copyOf(extraValues);
	}

	/**
	 * @param index Where the option was given
	 * @param name The unrecognized name
	 * @return The exception
	 */
	public static ArgumentParseException unknownOption(TokenIndex index, Name name) {
		return new ArgumentParseException("Unknown option " + name, null, Kind.UNKNOWN_OPTION, InputOrigin.of(index), null, name, null,
			null, null, null);
	}

	/**
	 * @param origin Where the option was given
	 * @param argument The option missing its value
	 * @param name The name the option was given with
	 * @return The exception
	 */
	public static ArgumentParseException missingValue(InputOrigin origin, ArgumentDefinition argument, Name name) {
		return new ArgumentParseException("Missing value for " + argument.getSynopsis(name), null, Kind.MISSING_VALUE, origin, null,
			name, null, argument.getKey(), Collections.singletonList(argument), null);
	}

	/**
	 * @param origin Where the flag was given
	 * @param name The name of the flag
	 * @param value The value given
	 * @return The exception
	 */
	public static ArgumentParseException unexpectedValueForOption(InputOrigin origin, Name name, String value) {
		return new ArgumentParseException(name + " takes no value", null, Kind.UNEXPECTED_VALUE_FOR_OPTION, origin, null, name, value,
			null, null, null);
	}

	/**
	 * @param values The values left over
	 * @return The exception
	 */
	public static ArgumentParseException unexpectedValues(List<IndexedValue> values) {
		return new ArgumentParseException(values.size() + " unexpected argument(s)", null, Kind.UNEXPECTED_VALUES, null, null, null, null,
			null, null, values);
	}

	/**
	 * @param previous Where the key was first set
	 * @param duplicate Where the key was set again
	 * @param argument The argument setting the key the second time
	 * @return The exception
	 */
	public static ArgumentParseException duplicateExclusiveValues(InputOrigin previous, InputOrigin duplicate,
		ArgumentDefinition argument) {
		return new ArgumentParseException(argument.getKey() + " was set twice", null, Kind.DUPLICATE_EXCLUSIVE_VALUES, duplicate, previous,
			null, null, argument.getKey(), Collections.singletonList(argument), null);
	}

	/**
	 * @param key The key with no value
	 * @param arguments The arguments that could have set it
	 * @return The exception
	 */
	public static ArgumentParseException missingArgument(String key, List<ArgumentDefinition> arguments) {
		return new ArgumentParseException("Missing argument " + key, null, Kind.MISSING_ARGUMENT, null, null, null, null, key, arguments,
			null);
	}

	/**
	 * @param origin Where the value was given
	 * @param argument The argument the value was given for
	 * @param name The name the argument was given with, or null for positionals
	 * @param value The value
	 * @param cause The exception thrown by the argument's parser
	 * @return The exception
	 */
	public static ArgumentParseException invalidValue(InputOrigin origin, ArgumentDefinition argument, Name name, String value,
		Throwable cause) {
		return new ArgumentParseException("Invalid value '" + value + "' for " + argument.getSynopsis(name), cause, Kind.INVALID_VALUE,
			origin, null, name, value, argument.getKey(), Collections.singletonList(argument), null);
	}

	/** @return The exception */
	public static ArgumentParseException missingSubcommand() {
		return new ArgumentParseException("Missing required subcommand", null, Kind.MISSING_SUBCOMMAND, null, null, null, null, null, null,
			null);
	}

	/**
	 * @param message Describes the inconsistency
	 * @return The exception
	 */
	public static ArgumentParseException invalidState(String message) {
		return new ArgumentParseException(message, null, Kind.INVALID_STATE, null, null, null, null, null, null, null);
	}

	/** @return The kind of failure */
	public Kind getKind() {
		return theKind;
	}

	/** @return Where the failure happened in the input, or null if it is not tied to the input */
	public InputOrigin getOrigin() {
		return theOrigin;
	}

	/** @return For {@link Kind#DUPLICATE_EXCLUSIVE_VALUES}, where the key was first set */
	public InputOrigin getPreviousOrigin() {
		return thePreviousOrigin;
	}

	/** @return The option name involved, if any */
	public Name getName() {
		return theName;
	}

	/** @return The value involved, if any */
	public String getValue() {
		return theValue;
	}

	/** @return The key of the argument involved, if any */
	public String getKey() {
		return theKey;
	}

	/** @return The arguments involved */
	public List<ArgumentDefinition> getArguments() {
		return theArguments;
	}

	/** @return For {@link Kind#UNEXPECTED_VALUES}, the values left over */
	public List<IndexedValue> getExtraValues() {
		return theExtraValues;
	}
}
