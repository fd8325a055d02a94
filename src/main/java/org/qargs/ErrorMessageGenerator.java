package org.qargs;

import java.util.List;

import org.qargs.ArgumentDefinition.Visibility;
import org.qargs.split.Name;
import org.qargs.split.SplitArguments.IndexedValue;
import org.qargs.split.TokenIndex;

/** Renders the message shown to the user for an {@link ArgumentParseException} */
public class ErrorMessageGenerator {
	/** The default edit distance below which an unknown option gets a suggestion */
	public static final int DEFAULT_SIMILARITY_FLOOR = 4;
	/** Allowed values are listed inline when there are fewer than this many */
	public static final int INLINE_VALUE_LIMIT = 4;

	private final List<ArgumentSet> theArguments;
	private final List<String> theOriginalInput;
	private final int theSimilarityFloor;

	/**
	 * @param arguments The arguments available where the error occurred, for suggestions
	 * @param originalInput The command line
	 * @param similarityFloor The edit distance below which an unknown option gets a suggestion
	 */
	public ErrorMessageGenerator(List<ArgumentSet> arguments, List<String> originalInput, int similarityFloor) {
		theArguments = arguments;
		theOriginalInput = originalInput;
		theSimilarityFloor = similarityFloor;
	}

	/**
	 * @param e The parse failure
	 * @return The message to show the user
	 */
	public String makeErrorMessage(ArgumentParseException e) {
		switch (e.getKind()) {
		case UNKNOWN_OPTION:
			return unknownOption(e.getName());
		case MISSING_VALUE:
			return "Missing value for '" + e.getArguments().get(0).getSynopsis(e.getName()) + "'";
		case UNEXPECTED_VALUE_FOR_OPTION:
			return "The option '" + e.getName().getSynopsis() + "' does not take any value, but '" + e.getValue() + "' was specified.";
		case UNEXPECTED_VALUES:
			return unexpectedValues(e.getExtraValues());
		case DUPLICATE_EXCLUSIVE_VALUES:
			return "Value to be set with flag '" + describe(e.getOrigin().getFirst()) + "' had already been set with flag '"
				+ describe(e.getPreviousOrigin().getFirst()) + "'";
		case MISSING_ARGUMENT:
			if (e.getArguments().size() > 1)
				return "Missing one of: " + StringUtils.print(", ", e.getArguments(), arg -> "'" + arg.getSynopsis() + "'");
			return "Missing expected argument '" + e.getArguments().get(0).getSynopsis() + "'";
		case INVALID_VALUE:
			return invalidValue(e);
		case MISSING_SUBCOMMAND:
			return "Missing required subcommand.";
		default:
			return "Internal error. " + e.getMessage();
		}
	}

	private String unknownOption(Name name) {
		String message = "Unknown option '" + name.getSynopsis() + "'";
		if (name.isShort())
			return message;
		Name suggestion = null;
		int bestDistance = Integer.MAX_VALUE;
		for (ArgumentSet args : theArguments) {
			for (ArgumentDefinition arg : args) {
				if (arg.getVisibility() == Visibility.PRIVATE)
					continue;
				for (Name candidate : arg.getNames()) {
					if (candidate.isShort())
						continue;
					int distance = StringUtils.editDistance(name.getSynopsis(), candidate.getSynopsis());
					if (distance > 0 && distance < theSimilarityFloor && distance < bestDistance) {
						suggestion = candidate;
						bestDistance = distance;
					}
				}
			}
		}
		if (suggestion != null)
			message += ". Did you mean '" + suggestion.getSynopsis() + "'?";
		return message;
	}

	private static String unexpectedValues(List<IndexedValue> values) {
		if (values.size() == 1)
			return "Unexpected argument '" + values.get(0).getValue() + "'";
		return values.size() + " unexpected arguments: " + StringUtils.print(", ", values, v -> "'" + v.getValue() + "'");
	}

	private String describe(TokenIndex index) {
		String original = theOriginalInput.get(index.getInputIndex());
		if (index.isComplete())
			return original;
		return original.charAt(index.getSubIndex() + 1) + "' in '" + original;
	}

	private static String invalidValue(ArgumentParseException e) {
		ArgumentDefinition arg = e.getArguments().get(0);
		StringBuilder message = new StringBuilder("The value '").append(e.getValue()).append("' is invalid for '")
			.append(arg.getSynopsis(e.getName())).append('\'');
		List<String> allowed = arg.getAllowedValues();
		if (allowed.size() >= INLINE_VALUE_LIMIT) {
			message.append(". Please provide one of the following:");
			for (String value : allowed)
				message.append("\n  - ").append(value);
		} else if (!allowed.isEmpty())
			message.append(". Please provide one of ").append(StringUtils.conversational(allowed, "or")).append('.');
		else if (e.getCause() != null && e.getCause().getMessage() != null)
			message.append(": ").append(e.getCause().getMessage());
		return message.toString();
	}
}
