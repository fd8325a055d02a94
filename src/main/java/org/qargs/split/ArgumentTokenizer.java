package org.qargs.split;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;
import org.qargs.split.SplitArguments.Element;
import org.qargs.split.SplitArguments.ElementType;

/**
 * Splits a raw command line into a classified {@link SplitArguments} stream. Splitting never fails: anything that looks wrong is kept
 * for the matcher to report.
 */
public class ArgumentTokenizer {
	private static final Logger log = Logger.getLogger(ArgumentTokenizer.class);

	/** The terminator, after which all input strings are values */
	public static final String TERMINATOR = "--";

	private static final Pattern NUMERIC = Pattern.compile("[0-9]+(\\.[0-9]*)?|\\.[0-9]+");

	private ArgumentTokenizer() {}

	/**
	 * @param args The command line
	 * @return The classified stream
	 */
	public static SplitArguments split(String... args) {
		return split(Arrays.asList(args));
	}

	/**
	 * @param args The command line
	 * @return The classified stream
	 */
	public static SplitArguments split(List<String> args) {
		List<Element> elements = new ArrayList<>();
		boolean terminated = false;
		for (int i = 0; i < args.size(); i++) {
			String arg = args.get(i);
			if (terminated)
				elements.add(value(i, arg));
			else if (arg.equals(TERMINATOR)) {
				terminated = true;
				elements.add(new Element(TokenIndex.complete(i), ElementType.TERMINATOR, null, null));
			} else
				classify(arg, i, elements);
		}
		SplitArguments split = new SplitArguments(args, elements);
		if (log.isDebugEnabled())
			log.debug("Split " + args + " into " + split);
		return split;
	}

	private static void classify(String arg, int index, List<Element> elements) {
		TokenIndex complete = TokenIndex.complete(index);
		if (arg.startsWith("--")) {
			// Only dashes
			if (arg.length() > 2 && arg.chars().allMatch(c -> c == '-')) {
				elements.add(option(complete, ParsedOption.of(Name.ofLong(arg.substring(2)))));
				return;
			}
			String remainder = arg.substring(2);
			int eq = remainder.indexOf('=');
			if (eq == 0)
				elements.add(value(index, arg));
			else if (eq > 0)
				elements.add(option(complete, ParsedOption.of(Name.ofLong(remainder.substring(0, eq)), remainder.substring(eq + 1))));
			else
				elements.add(option(complete, ParsedOption.of(Name.ofLong(remainder))));
		} else if (arg.length() > 1 && arg.charAt(0) == '-') {
			String remainder = arg.substring(1);
			int eq = remainder.indexOf('=');
			if (eq == 0)
				elements.add(value(index, arg));
			else if (eq == 1)
				elements.add(option(complete, ParsedOption.of(Name.ofShort(remainder.charAt(0)), remainder.substring(2))));
			else if (eq > 1)
				elements.add(option(complete, ParsedOption.of(Name.ofLongWithSingleDash(remainder.substring(0, eq)), remainder.substring(eq + 1))));
			else if (remainder.length() == 1) {
				ParsedOption option = ParsedOption.of(Name.ofShort(remainder.charAt(0)));
				if (Character.isDigit(remainder.charAt(0)))
					elements.add(new Element(complete, ElementType.POSSIBLE_NEGATIVE, arg, option));
				else
					elements.add(option(complete, option));
			} else {
				ParsedOption option = ParsedOption.of(Name.ofLongWithSingleDash(remainder));
				if (NUMERIC.matcher(remainder).matches())
					elements.add(new Element(complete, ElementType.POSSIBLE_NEGATIVE, arg, option));
				else
					elements.add(option(complete, option));
				for (int c = 0; c < remainder.length(); c++)
					elements.add(option(TokenIndex.sub(index, c), ParsedOption.of(Name.ofShort(remainder.charAt(c)))));
			}
		} else
			elements.add(value(index, arg));
	}

	private static Element value(int index, String text) {
		return new Element(TokenIndex.complete(index), ElementType.VALUE, text, null);
	}

	private static Element option(TokenIndex index, ParsedOption option) {
		return new Element(index, ElementType.OPTION, null, option);
	}
}
