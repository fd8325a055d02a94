package org.qargs.validate;

import java.util.List;

import org.qargs.StringUtils;

import com.google.common.collect.ImmutableList;

/** Thrown when a command's declared arguments are inconsistent. This is a programming error, not a user error. */
public class ArgumentDefinitionException extends IllegalStateException {
	private static final long serialVersionUID = 1L;

	private final String theCommandName;
	private final List<ValidationProblem> theProblems;

	/**
	 * @param commandName The name of the misconfigured command
	 * @param problems The problems found
	 */
	public ArgumentDefinitionException(String commandName, List<ValidationProblem> problems) {
		super("Validation failed for '" + commandName + "':\n" + StringUtils.print("\n", problems, p -> "- " + p.getDescription()));
		theCommandName = commandName;
		theProblems = ImmutableList.copyOf(problems);
	}

	/**
	 * @param message Describes a problem not found by a validator, such as a cycle among commands
	 */
	public ArgumentDefinitionException(String message) {
		super(message);
		theCommandName = null;
		theProblems = ImmutableList.of();
	}

	/** @return The name of the misconfigured command, or null */
	public String getCommandName() {
		return theCommandName;
	}

	/** @return The problems found by validators */
	public List<ValidationProblem> getProblems() {
		return theProblems;
	}
}
