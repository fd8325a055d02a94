package org.qargs;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.qargs.split.Name;

import com.google.common.collect.ImmutableList;

/**
 * The immutable declaration of a single command-line argument: a positional, a valued option or a flag. Definitions are created by an
 * {@link ArgumentSet.Builder}.
 */
public final class ArgumentDefinition {
	/** The kinds of argument */
	public enum Kind {
		/** Bound from values by position */
		POSITIONAL,
		/** A named argument that takes a value */
		OPTION,
		/** A named argument that takes no value */
		FLAG;
	}

	/** Whether an argument binds one value or many */
	public enum Arity {
		/** A single value */
		SCALAR,
		/** A list of values, accumulated in input order */
		ARRAY;
	}

	/** How an argument finds its value(s) in the input */
	public enum ParsingStrategy {
		/** The attached value, else the next element if it is a value */
		NEXT_AS_VALUE,
		/** The attached value, else the first value anywhere after the option */
		SCANNING_FOR_VALUE,
		/** The attached value, else the next element, whatever it looks like */
		UNCONDITIONAL,
		/** The attached value, then every directly following value until the next option */
		UP_TO_NEXT_OPTION,
		/** The attached value, then everything remaining in the input */
		ALL_REMAINING_INPUT;
	}

	/** Where an argument is shown in help */
	public enum Visibility {
		/** Shown in normal help */
		DEFAULT,
		/** Shown only in the hidden help */
		HIDDEN,
		/** Never shown */
		PRIVATE;
	}

	/** What a flag does to its bound value */
	public enum FlagAction {
		/** Sets the flag value */
		SET,
		/** Increments a count */
		COUNT;
	}

	/** How a repeated setting of a key shared by several flags is resolved */
	public enum FlagExclusivity {
		/** Setting a different value a second time is an error */
		EXCLUSIVE,
		/** The first value given wins */
		CHOOSE_FIRST,
		/** The last value given wins */
		CHOOSE_LAST;
	}

	private final String theKey;
	private final Kind theKind;
	private final Arity theArity;
	private final ImmutableList<Name> theNames;
	private final ParsingStrategy theStrategy;
	private final boolean isOptional;
	private final boolean hasDefault;
	private final Object theDefaultValue;
	private final String theValueName;
	private final ArgumentValueParser<?> theParser;
	private final ImmutableList<String> theAllowedValues;
	private final Visibility theVisibility;
	private final FlagAction theFlagAction;
	private final Object theFlagValue;
	private final FlagExclusivity theExclusivity;
	private final boolean isGrouped;
	private final String theDescription;

	ArgumentDefinition(Builder builder) {
		theKey = builder.theKey;
		theKind = builder.theKind;
		theArity = builder.theArity;
		theNames = ImmutableList.copyOf(builder.theNames);
		theStrategy = builder.theStrategy;
		isOptional = builder.isOptional;
		hasDefault = builder.hasDefault;
		theDefaultValue = builder.theDefaultValue;
		theValueName = builder.theValueName;
		theParser = builder.theParser;
		theAllowedValues = ImmutableList.copyOf(builder.theAllowedValues);
		theVisibility = builder.theVisibility;
		theFlagAction = builder.theFlagAction;
		theFlagValue = builder.theFlagValue;
		theExclusivity = builder.theExclusivity;
		isGrouped = builder.isGrouped;
		theDescription = builder.theDescription;
	}

	/** @return The key under which this argument's value is bound. Several flags may share a key. */
	public String getKey() {
		return theKey;
	}

	/** @return This argument's kind */
	public Kind getKind() {
		return theKind;
	}

	/** @return Whether this is a positional argument */
	public boolean isPositional() {
		return theKind == Kind.POSITIONAL;
	}

	/** @return Whether this argument binds a single value or a list */
	public Arity getArity() {
		return theArity;
	}

	/** @return Whether this argument may consume more than one input element */
	public boolean isRepeating() {
		return theArity == Arity.ARRAY || theFlagAction == FlagAction.COUNT;
	}

	/** @return The names this argument may be specified by (empty for positionals) */
	public List<Name> getNames() {
		return theNames;
	}

	/** @return The first non-short name, or the first name if all are short, or null for positionals */
	public Name getPreferredName() {
		for (Name name : theNames) {
			if (!name.isShort())
				return name;
		}
		return theNames.isEmpty() ? null : theNames.get(0);
	}

	/** @return How this argument finds its values */
	public ParsingStrategy getStrategy() {
		return theStrategy;
	}

	/** @return Whether the argument may be omitted from the input */
	public boolean isOptional() {
		return isOptional;
	}

	/** @return Whether a default value was declared */
	public boolean hasDefault() {
		return hasDefault;
	}

	/** @return The declared default value */
	public Object getDefaultValue() {
		return theDefaultValue;
	}

	/** @return The name printed for this argument's value, e.g. <code>file</code> in <code>--input &lt;file&gt;</code> */
	public String getValueName() {
		if (theValueName != null)
			return theValueName;
		Name preferred = getPreferredName();
		return preferred != null ? preferred.getValue() : StringUtils.toKebabCase(theKey);
	}

	/** @return The values the user may give, or an empty list if any value is accepted */
	public List<String> getAllowedValues() {
		return theAllowedValues;
	}

	/** @return Visibility */
	public Visibility getVisibility() {
		return theVisibility;
	}

	/** @return The action of a flag, or null for other arguments */
	public FlagAction getFlagAction() {
		return theFlagAction;
	}

	/** @return The value a {@link FlagAction#SET} flag binds */
	public Object getFlagValue() {
		return theFlagValue;
	}

	/** @return How repeated settings of this flag's key are resolved */
	public FlagExclusivity getExclusivity() {
		return theExclusivity;
	}

	/** @return Whether this flag shares its key with other flags (an inversion pair or an enumerable group) */
	public boolean isGrouped() {
		return isGrouped;
	}

	/** @return The description of this argument */
	public String getDescription() {
		return theDescription;
	}

	/**
	 * @param text The text given for this argument
	 * @return The parsed value
	 * @throws ParseException If the parser rejected the text
	 * @throws IllegalArgumentException If the parser rejected the text or it is not one of the {@link #getAllowedValues() allowed values}
	 */
	public Object parse(String text) throws ParseException, IllegalArgumentException {
		if (!theAllowedValues.isEmpty() && !theAllowedValues.contains(text))
			throw new IllegalArgumentException("Not an allowed value: " + text);
		return theParser == null ? text : theParser.parse(text);
	}

	/** @return How this argument is shown in usage and diagnostics, e.g. <code>--input &lt;file&gt;</code> */
	public String getSynopsis() {
		switch (theKind) {
		case POSITIONAL:
			return "<" + getValueName() + ">";
		case FLAG:
			return getPreferredName().getSynopsis();
		default:
			return getSynopsis(getPreferredName());
		}
	}

	/**
	 * @param name The name the argument was specified with
	 * @return The synopsis of the argument as specified with the given name
	 */
	public String getSynopsis(Name name) {
		if (name == null)
			return getSynopsis();
		else if (theKind == Kind.FLAG)
			return name.getSynopsis();
		return name.getSynopsis() + " <" + getValueName() + ">";
	}

	@Override
	public String toString() {
		return theKey + "(" + getSynopsis() + ")";
	}

	/** Configures an argument */
	public static class Builder {
		final String theKey;
		final Kind theKind;
		Arity theArity = Arity.SCALAR;
		final List<Name> theNames;
		ParsingStrategy theStrategy = ParsingStrategy.NEXT_AS_VALUE;
		boolean isOptional;
		boolean hasDefault;
		Object theDefaultValue;
		String theValueName;
		ArgumentValueParser<?> theParser;
		List<String> theAllowedValues = Collections.emptyList();
		Visibility theVisibility = Visibility.DEFAULT;
		FlagAction theFlagAction;
		Object theFlagValue;
		FlagExclusivity theExclusivity = FlagExclusivity.EXCLUSIVE;
		boolean isGrouped;
		String theDescription;

		Builder(String key, Kind kind) {
			if (key == null || key.isEmpty())
				throw new IllegalArgumentException("Arguments must have a key");
			theKey = key;
			theKind = kind;
			theNames = new ArrayList<>();
			if (kind != Kind.POSITIONAL)
				theNames.add(Name.ofLong(StringUtils.toKebabCase(key)));
			isOptional = kind != Kind.POSITIONAL;
		}

		/** @return The key of the argument being configured */
		public String getKey() {
			return theKey;
		}

		/**
		 * Replaces the argument's names, which default to the kebab-cased key as a long name
		 *
		 * @param names The names for the argument
		 * @return This builder
		 */
		public Builder named(Name... names) {
			if (theKind == Kind.POSITIONAL)
				throw new IllegalStateException("Positional arguments cannot be named");
			else if (names.length == 0)
				throw new IllegalArgumentException("At least one name is required");
			theNames.clear();
			theNames.addAll(Arrays.asList(names));
			return this;
		}

		/**
		 * Adds the first letter of the argument's first name (or of its key, if it has no names) as a short name
		 *
		 * @return This builder
		 */
		public Builder withShortName() {
			String source = theNames.isEmpty() ? theKey : theNames.get(0).getValue();
			return withName(Name.ofShort(source.charAt(0)));
		}

		/**
		 * @param name An additional name for the argument
		 * @return This builder
		 */
		public Builder withName(Name name) {
			if (theKind == Kind.POSITIONAL)
				throw new IllegalStateException("Positional arguments cannot be named");
			theNames.add(name);
			return this;
		}

		/**
		 * Makes the argument required: if it is not given and has no default, parsing fails
		 *
		 * @return This builder
		 */
		public Builder required() {
			isOptional = false;
			return this;
		}

		/** @return This builder */
		public Builder optional() {
			isOptional = true;
			return this;
		}

		/**
		 * @param value The value bound if the argument is not specified
		 * @return This builder
		 */
		public Builder defaultValue(Object value) {
			hasDefault = true;
			theDefaultValue = value;
			return this;
		}

		/**
		 * @param valueName The name to print for the argument's value
		 * @return This builder
		 */
		public Builder valueName(String valueName) {
			theValueName = valueName;
			return this;
		}

		/**
		 * @param strategy How the argument finds its values
		 * @return This builder
		 */
		public Builder parsing(ParsingStrategy strategy) {
			if (theKind == Kind.FLAG)
				throw new IllegalStateException("Flags take no values");
			switch (strategy) {
			case UP_TO_NEXT_OPTION:
				if (theKind == Kind.POSITIONAL)
					throw new IllegalArgumentException(strategy + " cannot be used for positional arguments");
				//$FALL-THROUGH$
			case ALL_REMAINING_INPUT:
				if (theArity != Arity.ARRAY)
					throw new IllegalArgumentException(strategy + " can only be used for array arguments");
				break;
			case SCANNING_FOR_VALUE:
			case UNCONDITIONAL:
				if (theKind == Kind.POSITIONAL)
					throw new IllegalArgumentException(strategy + " cannot be used for positional arguments");
				break;
			default:
				break;
			}
			theStrategy = strategy;
			return this;
		}

		/**
		 * @param parser The parser for the argument's values
		 * @return This builder
		 */
		public Builder parsedBy(ArgumentValueParser<?> parser) {
			if (theKind == Kind.FLAG)
				throw new IllegalStateException("Flags take no values");
			theParser = parser;
			return this;
		}

		/**
		 * @param values The only values the user may give for the argument
		 * @return This builder
		 */
		public Builder allowedValues(String... values) {
			theAllowedValues = Arrays.asList(values);
			return this;
		}

		/**
		 * Parses the argument's values as constants of an enum, allowing only their lower-cased names
		 *
		 * @param <E> The enum type
		 * @param type The enum type
		 * @return This builder
		 */
		public <E extends Enum<E>> Builder withEnumValues(Class<E> type) {
			List<String> values = new ArrayList<>();
			for (E value : type.getEnumConstants())
				values.add(ArgumentValueParser.enumText(value));
			theAllowedValues = values;
			return parsedBy(ArgumentValueParser.forEnum(type));
		}

		/**
		 * Shows the argument only in hidden help
		 *
		 * @return This builder
		 */
		public Builder hidden() {
			theVisibility = Visibility.HIDDEN;
			return this;
		}

		/**
		 * @param visibility Where the argument is shown in help
		 * @return This builder
		 */
		public Builder visibility(Visibility visibility) {
			theVisibility = visibility;
			return this;
		}

		/**
		 * @param exclusivity How repeated settings of the flag's key are resolved
		 * @return This builder
		 */
		public Builder exclusivity(FlagExclusivity exclusivity) {
			if (theKind != Kind.FLAG)
				throw new IllegalStateException("Exclusivity applies only to flags");
			theExclusivity = exclusivity;
			return this;
		}

		/**
		 * @param descrip The description of the purpose of this argument
		 * @return This builder
		 */
		public Builder withDescription(String descrip) {
			theDescription = descrip;
			return this;
		}

		Builder array() {
			theArity = Arity.ARRAY;
			isOptional = true;
			return this;
		}

		Builder flag(FlagAction action, Object flagValue) {
			theFlagAction = action;
			theFlagValue = flagValue;
			return this;
		}

		Builder grouped() {
			isGrouped = true;
			return this;
		}

		ArgumentDefinition build() {
			if (theKind != Kind.POSITIONAL && theNames.isEmpty())
				throw new IllegalStateException("Argument " + theKey + " must have at least one name");
			return new ArgumentDefinition(this);
		}
	}
}
