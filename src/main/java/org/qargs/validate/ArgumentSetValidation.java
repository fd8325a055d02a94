package org.qargs.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;
import org.qargs.ArgumentSet;

import com.google.common.collect.ImmutableList;

/** Runs the standard {@link ArgumentSetValidator}s over an argument set and the groups included in it */
public class ArgumentSetValidation {
	private static final Logger log = Logger.getLogger(ArgumentSetValidation.class);

	/** The validators run for every command */
	public static final List<ArgumentSetValidator> VALIDATORS = ImmutableList.of(//
		new PositionalArgumentsValidator(), new UniqueNamesValidator(), new BackingKeyValidator(), new NonsenseFlagsValidator());

	private ArgumentSetValidation() {}

	/**
	 * @param arguments The arguments to check
	 * @param backingKeys The keys the command decodes its values from, or null if the command binds every key
	 * @return All problems found, without repeats
	 */
	public static List<ValidationProblem> validate(ArgumentSet arguments, Collection<String> backingKeys) {
		Set<ValidationProblem> problems = new LinkedHashSet<>();
		validate(arguments, backingKeys, problems);
		return new ArrayList<>(problems);
	}

	private static void validate(ArgumentSet arguments, Collection<String> backingKeys, Set<ValidationProblem> problems) {
		for (ArgumentSetValidator validator : VALIDATORS) {
			ValidationProblem problem = validator.validate(arguments, backingKeys);
			if (problem != null)
				problems.add(problem);
		}
		for (ArgumentSet group : arguments.getIncludedGroups())
			validate(group, backingKeys, problems);
	}

	/**
	 * @param commandName The name of the command the arguments belong to
	 * @param arguments The arguments to check
	 * @param backingKeys The keys the command decodes its values from, or null if the command binds every key
	 * @throws ArgumentDefinitionException If any problems are found
	 */
	public static void validateOrThrow(String commandName, ArgumentSet arguments, Collection<String> backingKeys)
		throws ArgumentDefinitionException {
		List<ValidationProblem> problems = validate(arguments, backingKeys);
		if (!problems.isEmpty()) {
			log.error("Invalid arguments for command " + commandName + ": " + problems);
			throw new ArgumentDefinitionException(commandName, problems);
		}
	}
}
