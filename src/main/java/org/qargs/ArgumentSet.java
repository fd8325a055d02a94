package org.qargs;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.qargs.ArgumentDefinition.FlagAction;
import org.qargs.ArgumentDefinition.FlagExclusivity;
import org.qargs.ArgumentDefinition.Kind;
import org.qargs.split.Name;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** An ordered, immutable collection of argument definitions, such as the arguments of one command */
public final class ArgumentSet implements Iterable<ArgumentDefinition> {
	/** An argument set with no arguments */
	public static final ArgumentSet EMPTY = new ArgumentSet(ImmutableList.of(), ImmutableList.of());

	/** How the disabling names of an invertible flag are made */
	public enum FlagInversion {
		/** <code>--x</code> and <code>--no-x</code> */
		PREFIXED_NO,
		/** <code>--enable-x</code> and <code>--disable-x</code> */
		PREFIXED_ENABLE_DISABLE;
	}

	private final ImmutableList<ArgumentDefinition> theArguments;
	private final ImmutableList<ArgumentSet> theGroups;
	private final ImmutableMap<Name, ArgumentDefinition> theNamedArguments;

	private ArgumentSet(ImmutableList<ArgumentDefinition> arguments, ImmutableList<ArgumentSet> groups) {
		theArguments = arguments;
		theGroups = groups;
		Map<Name, ArgumentDefinition> named = new LinkedHashMap<>();
		for (ArgumentDefinition arg : arguments) {
			for (Name name : arg.getNames())
				named.putIfAbsent(name, arg);
		}
		theNamedArguments = ImmutableMap.copyOf(named);
	}

	/** @return A builder for a new argument set */
	public static Builder build() {
		return new Builder();
	}

	/** @return All the arguments in this set, including those of included groups, in declaration order */
	public List<ArgumentDefinition> getArguments() {
		return theArguments;
	}

	/** @return The argument sets that were included into this one */
	public List<ArgumentSet> getIncludedGroups() {
		return theGroups;
	}

	/** @return The positional arguments in declaration order */
	public List<ArgumentDefinition> getPositionals() {
		List<ArgumentDefinition> positionals = new ArrayList<>();
		for (ArgumentDefinition arg : theArguments) {
			if (arg.isPositional())
				positionals.add(arg);
		}
		return positionals;
	}

	/**
	 * @param name The name to look up
	 * @return The first declared argument with the given name, or null if there is none
	 */
	public ArgumentDefinition first(Name name) {
		return theNamedArguments.get(name);
	}

	/**
	 * @param key The key to look up
	 * @return All arguments bound under the given key
	 */
	public List<ArgumentDefinition> withKey(String key) {
		List<ArgumentDefinition> found = new ArrayList<>();
		for (ArgumentDefinition arg : theArguments) {
			if (arg.getKey().equals(key))
				found.add(arg);
		}
		return found;
	}

	/** @return The number of arguments in this set */
	public int size() {
		return theArguments.size();
	}

	/** @return Whether this set has no arguments */
	public boolean isEmpty() {
		return theArguments.isEmpty();
	}

	@Override
	public Iterator<ArgumentDefinition> iterator() {
		return theArguments.iterator();
	}

	@Override
	public String toString() {
		return theArguments.toString();
	}

	/** Builds an {@link ArgumentSet} */
	public static class Builder {
		private final List<ArgumentDefinition> theArguments;
		private final List<ArgumentSet> theGroups;

		Builder() {
			theArguments = new ArrayList<>();
			theGroups = new ArrayList<>();
		}

		/**
		 * Adds a single-valued option
		 *
		 * @param key The key for the option's value
		 * @param parser The parser for the option's value
		 * @param configure Configures the option (optional)
		 * @return This builder
		 */
		public Builder addOption(String key, ArgumentValueParser<?> parser, Consumer<ArgumentDefinition.Builder> configure) {
			return add(new ArgumentDefinition.Builder(key, Kind.OPTION).parsedBy(parser), configure);
		}

		/**
		 * @param key The key for the option's value
		 * @param configure Configures the option (optional)
		 * @return This builder
		 */
		public Builder addStringOption(String key, Consumer<ArgumentDefinition.Builder> configure) {
			return addOption(key, ArgumentValueParser.STRING, configure);
		}

		/**
		 * @param key The key for the option's value
		 * @param configure Configures the option (optional)
		 * @return This builder
		 */
		public Builder addIntOption(String key, Consumer<ArgumentDefinition.Builder> configure) {
			return addOption(key, ArgumentValueParser.INTEGER, configure);
		}

		/**
		 * Adds an option which may be given many times, binding a {@link List} of values
		 *
		 * @param key The key for the option's values
		 * @param parser The parser for each of the option's values
		 * @param configure Configures the option (optional)
		 * @return This builder
		 */
		public Builder addArrayOption(String key, ArgumentValueParser<?> parser, Consumer<ArgumentDefinition.Builder> configure) {
			return add(new ArgumentDefinition.Builder(key, Kind.OPTION).array().parsedBy(parser), configure);
		}

		/**
		 * Adds a single-valued positional argument, required unless configured otherwise
		 *
		 * @param key The key for the argument's value
		 * @param parser The parser for the argument's value
		 * @param configure Configures the argument (optional)
		 * @return This builder
		 */
		public Builder addPositional(String key, ArgumentValueParser<?> parser, Consumer<ArgumentDefinition.Builder> configure) {
			return add(new ArgumentDefinition.Builder(key, Kind.POSITIONAL).parsedBy(parser), configure);
		}

		/**
		 * @param key The key for the argument's value
		 * @param configure Configures the argument (optional)
		 * @return This builder
		 */
		public Builder addStringPositional(String key, Consumer<ArgumentDefinition.Builder> configure) {
			return addPositional(key, ArgumentValueParser.STRING, configure);
		}

		/**
		 * @param key The key for the argument's value
		 * @param configure Configures the argument (optional)
		 * @return This builder
		 */
		public Builder addIntPositional(String key, Consumer<ArgumentDefinition.Builder> configure) {
			return addPositional(key, ArgumentValueParser.INTEGER, configure);
		}

		/**
		 * Adds a positional argument that absorbs all remaining values into a {@link List}. It must be the last positional.
		 *
		 * @param key The key for the argument's values
		 * @param parser The parser for each of the argument's values
		 * @param configure Configures the argument (optional)
		 * @return This builder
		 */
		public Builder addArrayPositional(String key, ArgumentValueParser<?> parser, Consumer<ArgumentDefinition.Builder> configure) {
			return add(new ArgumentDefinition.Builder(key, Kind.POSITIONAL).array().parsedBy(parser), configure);
		}

		/**
		 * Adds a boolean flag, false unless specified
		 *
		 * @param key The key for the flag's value
		 * @param configure Configures the flag (optional)
		 * @return This builder
		 */
		public Builder addFlag(String key, Consumer<ArgumentDefinition.Builder> configure) {
			return add(new ArgumentDefinition.Builder(key, Kind.FLAG).flag(FlagAction.SET, Boolean.TRUE).defaultValue(Boolean.FALSE),
				configure);
		}

		/**
		 * Adds a flag that binds the number of times it was specified as an {@link Integer}
		 *
		 * @param key The key for the flag's count
		 * @param configure Configures the flag (optional)
		 * @return This builder
		 */
		public Builder addCounter(String key, Consumer<ArgumentDefinition.Builder> configure) {
			return add(new ArgumentDefinition.Builder(key, Kind.FLAG).flag(FlagAction.COUNT, null).defaultValue(0), configure);
		}

		/**
		 * Adds a boolean flag with enabling and disabling names. The flag is false by default unless configured with a default or as
		 * required.
		 *
		 * @param key The key for the flag's value
		 * @param inversion How the disabling names are made
		 * @param configure Configures the enabling flag (optional). Short names are only used for enabling.
		 * @return This builder
		 */
		public Builder addInvertibleFlag(String key, FlagInversion inversion, Consumer<ArgumentDefinition.Builder> configure) {
			ArgumentDefinition.Builder enable = new ArgumentDefinition.Builder(key, Kind.FLAG).flag(FlagAction.SET, Boolean.TRUE)
				.grouped();
			if (configure != null)
				configure.accept(enable);
			if (!enable.hasDefault && enable.isOptional)
				enable.defaultValue(Boolean.FALSE);
			List<Name> enableNames = new ArrayList<>();
			List<Name> disableNames = new ArrayList<>();
			for (Name name : enable.theNames) {
				if (name.isShort()) {
					enableNames.add(name);
					continue;
				}
				switch (inversion) {
				case PREFIXED_NO:
					enableNames.add(name);
					disableNames.add(prefixed(name, "no-"));
					break;
				case PREFIXED_ENABLE_DISABLE:
					enableNames.add(prefixed(name, "enable-"));
					disableNames.add(prefixed(name, "disable-"));
					break;
				}
			}
			if (disableNames.isEmpty())
				throw new IllegalArgumentException("Invertible flag " + key + " needs at least one long name");
			enable.theNames.clear();
			enable.theNames.addAll(enableNames);
			ArgumentDefinition.Builder disable = new ArgumentDefinition.Builder(key, Kind.FLAG).flag(FlagAction.SET, Boolean.FALSE)
				.grouped().exclusivity(enable.theExclusivity).visibility(enable.theVisibility).withDescription(enable.theDescription);
			disable.isOptional = enable.isOptional;
			disable.named(disableNames.toArray(new Name[disableNames.size()]));
			theArguments.add(enable.build());
			theArguments.add(disable.build());
			return this;
		}

		/**
		 * Adds a group of flags sharing one key, each binding its own value
		 *
		 * @param key The key for the group's value
		 * @param configure Declares the flags of the group
		 * @return This builder
		 */
		public Builder addEnumerableFlag(String key, Consumer<EnumerableFlagBuilder> configure) {
			EnumerableFlagBuilder group = new EnumerableFlagBuilder(key);
			configure.accept(group);
			if (group.theValues.isEmpty())
				throw new IllegalArgumentException("Enumerable flag " + key + " needs at least one value");
			boolean first = true;
			for (ArgumentDefinition.Builder flag : group.theValues) {
				flag.exclusivity(group.theExclusivity);
				flag.isOptional = group.isOptional || group.hasDefault;
				if (first && group.hasDefault)
					flag.defaultValue(group.theDefaultValue);
				first = false;
				theArguments.add(flag.build());
			}
			return this;
		}

		/**
		 * Adds a flag for each constant of an enum, named by the constant's lower-cased name
		 *
		 * @param <E> The enum type
		 * @param key The key for the group's value
		 * @param type The enum type
		 * @param configure Further configures the group (optional)
		 * @return This builder
		 */
		public <E extends Enum<E>> Builder addEnumFlag(String key, Class<E> type, Consumer<EnumerableFlagBuilder> configure) {
			return addEnumerableFlag(key, group -> {
				for (E value : type.getEnumConstants())
					group.value(value, null);
				if (configure != null)
					configure.accept(group);
			});
		}

		/**
		 * Adds all the arguments of another set to this one
		 *
		 * @param group The set to include
		 * @return This builder
		 */
		public Builder include(ArgumentSet group) {
			theArguments.addAll(group.getArguments());
			theGroups.add(group);
			return this;
		}

		/** @return The new argument set */
		public ArgumentSet build() {
			return new ArgumentSet(ImmutableList.copyOf(theArguments), ImmutableList.copyOf(theGroups));
		}

		private Builder add(ArgumentDefinition.Builder arg, Consumer<ArgumentDefinition.Builder> configure) {
			if (configure != null)
				configure.accept(arg);
			theArguments.add(arg.build());
			return this;
		}

		private static Name prefixed(Name name, String prefix) {
			if (name.getType() == Name.Type.LONG_WITH_SINGLE_DASH)
				return Name.ofLongWithSingleDash(prefix + name.getValue());
			return Name.ofLong(prefix + name.getValue());
		}
	}

	/** Declares the flags of an enumerable flag group */
	public static class EnumerableFlagBuilder {
		private final String theKey;
		final List<ArgumentDefinition.Builder> theValues;
		FlagExclusivity theExclusivity = FlagExclusivity.EXCLUSIVE;
		boolean isOptional;
		boolean hasDefault;
		Object theDefaultValue;

		EnumerableFlagBuilder(String key) {
			theKey = key;
			theValues = new ArrayList<>();
		}

		/**
		 * Adds a flag to the group, named by the kebab-cased value (or the lower-cased name of an enum constant)
		 *
		 * @param value The value the flag binds
		 * @param configure Configures the flag (optional)
		 * @return This builder
		 */
		public EnumerableFlagBuilder value(Object value, Consumer<ArgumentDefinition.Builder> configure) {
			ArgumentDefinition.Builder flag = new ArgumentDefinition.Builder(theKey, Kind.FLAG).flag(FlagAction.SET, value).grouped();
			String name = value instanceof Enum ? ArgumentValueParser.enumText((Enum<?>) value) : StringUtils.toKebabCase(String.valueOf(value));
			flag.named(Name.ofLong(name));
			if (configure != null)
				configure.accept(flag);
			theValues.add(flag);
			return this;
		}

		/**
		 * Adds a short name to each flag in the group, from the first letter of its first name
		 *
		 * @return This builder
		 */
		public EnumerableFlagBuilder withShortNames() {
			for (ArgumentDefinition.Builder flag : theValues)
				flag.withShortName();
			return this;
		}

		/**
		 * @param exclusivity How several flags of the group given together are resolved
		 * @return This builder
		 */
		public EnumerableFlagBuilder exclusivity(FlagExclusivity exclusivity) {
			theExclusivity = exclusivity;
			return this;
		}

		/**
		 * Allows none of the group's flags to be given, leaving the key unbound
		 *
		 * @return This builder
		 */
		public EnumerableFlagBuilder optional() {
			isOptional = true;
			return this;
		}

		/**
		 * @param value The value bound when none of the group's flags are given
		 * @return This builder
		 */
		public EnumerableFlagBuilder defaultValue(Object value) {
			hasDefault = true;
			theDefaultValue = value;
			return this;
		}
	}
}
