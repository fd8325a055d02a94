package org.qargs;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** The outcome of parsing a command line with a {@link CommandParser} */
public final class ParseResult {
	/** The kinds of outcome */
	public enum Type {
		/** The command line was bound successfully */
		OK,
		/** The command line did not match the commands' arguments */
		ERROR,
		/** The user asked for help */
		HELP_REQUESTED,
		/** The user asked for the version */
		VERSION_REQUESTED,
		/** The user asked for a shell completion script */
		COMPLETION_REQUESTED;
	}

	private final Type theType;
	private final List<CommandTree.Node> theCommandStack;
	private final List<ParsedValues> theValues;
	private final ArgumentParseException theError;
	private final String theMessage;
	private final boolean isHiddenIncluded;

	private ParseResult(Type type, List<CommandTree.Node> commandStack, List<ParsedValues> values, ArgumentParseException error,
		String message, boolean includeHidden) {
		theType = type;
		theCommandStack = commandStack == null ? Collections.emptyList() : ImmutableList.copyOf(commandStack);
		theValues = values == null ? Collections.emptyList() : ImmutableList.copyOf(values);
		theError = error;
		theMessage = message;
		isHiddenIncluded = includeHidden;
	}

	static ParseResult ok(List<CommandTree.Node> commandStack, List<ParsedValues> values) {
		return new ParseResult(Type.OK, commandStack, values, null, null, false);
	}

	static ParseResult error(List<CommandTree.Node> commandStack, ArgumentParseException error, String message) {
		return new ParseResult(Type.ERROR, commandStack, null, error, message, false);
	}

	static ParseResult helpRequested(List<CommandTree.Node> commandStack, boolean includeHidden) {
		return new ParseResult(Type.HELP_REQUESTED, commandStack, null, null, null, includeHidden);
	}

	static ParseResult versionRequested(List<CommandTree.Node> commandStack, String version) {
		return new ParseResult(Type.VERSION_REQUESTED, commandStack, null, null, version, false);
	}

	static ParseResult completionRequested(List<CommandTree.Node> commandStack, String shell) {
		return new ParseResult(Type.COMPLETION_REQUESTED, commandStack, null, null, shell, false);
	}

	/** @return The kind of outcome */
	public Type getType() {
		return theType;
	}

	/** @return Whether the command line was bound successfully */
	public boolean isOk() {
		return theType == Type.OK;
	}

	/** @return The commands reached, from the root down */
	public List<CommandTree.Node> getCommandStack() {
		return theCommandStack;
	}

	/** @return The deepest command reached, or null if none was */
	public CommandDefinition getCommand() {
		return theCommandStack.isEmpty() ? null : theCommandStack.get(theCommandStack.size() - 1).getDefinition();
	}

	/** @return For {@link Type#OK}, the values bound for each command in the {@link #getCommandStack() stack} */
	public List<ParsedValues> getAllValues() {
		return theValues;
	}

	/** @return For {@link Type#OK}, the values bound for the deepest command */
	public ParsedValues getValues() {
		return theValues.isEmpty() ? null : theValues.get(theValues.size() - 1);
	}

	/**
	 * @param command A command in the stack
	 * @return The values bound for the given command, or null if it was not reached
	 */
	public ParsedValues getValues(CommandDefinition command) {
		for (int i = 0; i < theValues.size(); i++) {
			if (theCommandStack.get(i).getDefinition() == command)
				return theValues.get(i);
		}
		return null;
	}

	/** @return For {@link Type#ERROR}, the failure */
	public ArgumentParseException getError() {
		return theError;
	}

	/** @return For {@link Type#ERROR}, the message to show the user */
	public String getErrorMessage() {
		return theType == Type.ERROR ? theMessage : null;
	}

	/** @return For {@link Type#VERSION_REQUESTED}, the version text */
	public String getVersion() {
		return theType == Type.VERSION_REQUESTED ? theMessage : null;
	}

	/** @return For {@link Type#COMPLETION_REQUESTED}, the shell name given with the request, or null */
	public String getCompletionShell() {
		return theType == Type.COMPLETION_REQUESTED ? theMessage : null;
	}

	/** @return For {@link Type#HELP_REQUESTED}, whether hidden arguments should be shown */
	public boolean isHiddenIncluded() {
		return isHiddenIncluded;
	}

	@Override
	public String toString() {
		switch (theType) {
		case OK:
			return "OK " + theCommandStack + ": " + theValues;
		case ERROR:
			return "ERROR " + theMessage;
		default:
			return theType + " " + theCommandStack;
		}
	}
}
