package org.qargs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The declaration of a command: its name, its arguments and its subcommands. Subcommands may be given lazily with
 * {@link Builder#withSubcommand(Supplier)} so that commands can refer to each other; they are resolved (and checked for cycles) when a
 * {@link CommandTree} is built.
 */
public final class CommandDefinition {
	private final String theName;
	private final ImmutableList<String> theAliases;
	private final ArgumentSet theArguments;
	private final ImmutableList<Supplier<? extends CommandDefinition>> theSubcommands;
	private final String theDefaultSubcommand;
	private final boolean isSubcommandRequired;
	private final String theVersion;
	private final ImmutableSet<String> theBackingKeys;
	private final String theDescription;

	private CommandDefinition(Builder builder) {
		theName = builder.theName;
		theAliases = ImmutableList.copyOf(builder.theAliases);
		theArguments = builder.theArguments;
		theSubcommands = ImmutableList.copyOf(builder.theSubcommands);
		theDefaultSubcommand = builder.theDefaultSubcommand;
		isSubcommandRequired = builder.isSubcommandRequired;
		theVersion = builder.theVersion;
		theBackingKeys = builder.theBackingKeys == null ? null : ImmutableSet.copyOf(builder.theBackingKeys);
		theDescription = builder.theDescription;
	}

	/**
	 * @param name The name of the command
	 * @return A builder for the command
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/** @return The command's name */
	public String getName() {
		return theName;
	}

	/** @return Other names the command may be invoked by as a subcommand */
	public List<String> getAliases() {
		return theAliases;
	}

	/** @return The command's own arguments */
	public ArgumentSet getArguments() {
		return theArguments;
	}

	/** @return Suppliers of the command's subcommands, in declaration order */
	public List<Supplier<? extends CommandDefinition>> getSubcommands() {
		return theSubcommands;
	}

	/** @return The name of the subcommand used when none is given, or null */
	public String getDefaultSubcommand() {
		return theDefaultSubcommand;
	}

	/** @return Whether the command cannot run without a subcommand */
	public boolean isSubcommandRequired() {
		return isSubcommandRequired;
	}

	/** @return The command's version text, or null */
	public String getVersion() {
		return theVersion;
	}

	/** @return The keys the command decodes its values from, or null if it binds every key of its arguments */
	public Collection<String> getBackingKeys() {
		return theBackingKeys;
	}

	/** @return The command's description */
	public String getDescription() {
		return theDescription;
	}

	/**
	 * @param name The name given on the command line
	 * @return Whether the name or one of the aliases of this command is the given name
	 */
	public boolean isNamed(String name) {
		return theName.equals(name) || theAliases.contains(name);
	}

	@Override
	public String toString() {
		return theName;
	}

	/** Builds a {@link CommandDefinition} */
	public static class Builder {
		private final String theName;
		private final List<String> theAliases;
		private ArgumentSet theArguments;
		private final List<Supplier<? extends CommandDefinition>> theSubcommands;
		private String theDefaultSubcommand;
		private boolean isSubcommandRequired;
		private String theVersion;
		private Collection<String> theBackingKeys;
		private String theDescription;

		Builder(String name) {
			if (name == null || name.isEmpty())
				throw new IllegalArgumentException("Commands must have a name");
			theName = name;
			theAliases = new ArrayList<>();
			theArguments = ArgumentSet.EMPTY;
			theSubcommands = new ArrayList<>();
		}

		/**
		 * @param aliases Other names the command may be invoked by as a subcommand
		 * @return This builder
		 */
		public Builder withAliases(String... aliases) {
			theAliases.addAll(Arrays.asList(aliases));
			return this;
		}

		/**
		 * @param arguments The command's arguments
		 * @return This builder
		 */
		public Builder withArguments(ArgumentSet arguments) {
			theArguments = arguments;
			return this;
		}

		/**
		 * @param configure Configures the command's arguments
		 * @return This builder
		 */
		public Builder withArguments(Consumer<ArgumentSet.Builder> configure) {
			ArgumentSet.Builder args = ArgumentSet.build();
			configure.accept(args);
			theArguments = args.build();
			return this;
		}

		/**
		 * @param subcommands Subcommands of the command
		 * @return This builder
		 */
		public Builder withSubcommands(CommandDefinition... subcommands) {
			for (CommandDefinition sub : subcommands)
				theSubcommands.add(() -> sub);
			return this;
		}

		/**
		 * @param subcommand Supplies a subcommand of the command when the command tree is built
		 * @return This builder
		 */
		public Builder withSubcommand(Supplier<? extends CommandDefinition> subcommand) {
			theSubcommands.add(subcommand);
			return this;
		}

		/**
		 * @param name The name of the subcommand to use when none is given
		 * @return This builder
		 */
		public Builder withDefaultSubcommand(String name) {
			theDefaultSubcommand = name;
			return this;
		}

		/**
		 * Makes parsing fail with {@link ArgumentParseException.Kind#MISSING_SUBCOMMAND} when no subcommand is given
		 *
		 * @return This builder
		 */
		public Builder requiringSubcommand() {
			isSubcommandRequired = true;
			return this;
		}

		/**
		 * @param version The version text printed for a version request
		 * @return This builder
		 */
		public Builder withVersion(String version) {
			theVersion = version;
			return this;
		}

		/**
		 * @param keys The keys the command decodes its values from. Every argument's key must be among them.
		 * @return This builder
		 */
		public Builder withBackingKeys(String... keys) {
			theBackingKeys = Arrays.asList(keys);
			return this;
		}

		/**
		 * @param descrip The description of the command
		 * @return This builder
		 */
		public Builder withDescription(String descrip) {
			theDescription = descrip;
			return this;
		}

		/** @return The command */
		public CommandDefinition build() {
			return new CommandDefinition(this);
		}
	}
}
